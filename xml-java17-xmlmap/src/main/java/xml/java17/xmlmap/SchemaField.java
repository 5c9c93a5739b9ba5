package xml.java17.xmlmap;

import xml.java17.xpath.CompiledXPath;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Placeholder for a string field whose allowed values come from a named XSD simple type.
///
/// Replaced by a [XmlField] when the declaring model type is built, keeping this placeholder's
/// creation counter and `required` flag. Enumerated values become the field's choices, led by
/// a single blank choice for "unset".
public record SchemaField(
        CompiledXPath path,
        String schemaType,
        Boolean required,
        String verboseName,
        String helpText,
        long creationCounter) implements FieldDeclaration {

    private static final Logger LOG = Logger.getLogger(SchemaField.class.getName());

    private static final String STRING_BASE_TYPE = "string";

    public SchemaField {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(schemaType, "schemaType must not be null");
    }

    public SchemaField withRequired(Boolean required) {
        return new SchemaField(path, schemaType, required, verboseName, helpText, creationCounter);
    }

    /// Looks the simple type up in the schema and builds the string field for it.
    /// @throws XmlMappingException if the type is missing, ambiguous or not string based
    public XmlField<String, String> resolve(XsdSchema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        final var type = schema.getType(schemaType);
        final var baseType = type.baseType();
        LOG.fine(() -> "Schema type " + schemaType + " has base type " + baseType);
        if (!STRING_BASE_TYPE.equals(baseType)) {
            throw new XmlMappingException("Schema type " + schemaType + " has base type " + baseType
                    + ", only " + STRING_BASE_TYPE + " is supported");
        }
        final List<String> choices = new ArrayList<>(type.restrictedValues());
        if (!choices.isEmpty()) {
            choices.remove("");
            choices.add(0, "");
        }
        return new XmlField<>(path, new XmlMapper.StringMapper(false), new SingleNodeManager<>(false),
                required, verboseName, helpText, choices, creationCounter);
    }
}
