package xml.java17.xmlmap;

/// A field as declared on a model type: a ready [XmlField], or a [SchemaField] placeholder
/// resolved when the type is built.
public sealed interface FieldDeclaration permits XmlField, SchemaField {

    /// Declaration order across all fields in the process.
    long creationCounter();
}
