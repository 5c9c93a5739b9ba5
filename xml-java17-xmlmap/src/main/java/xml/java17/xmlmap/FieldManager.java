package xml.java17.xmlmap;

import org.w3c.dom.Node;
import xml.java17.xpath.CompiledXPath;

/// Runs a field's get, set and delete against the node it is bound to.
///
/// @param <T> the mapper's value type
/// @param <V> the field's value type: `T` for single fields, `List<T>` for list fields
public sealed interface FieldManager<T, V> permits SingleNodeManager, NodeListManager {

    V get(CompiledXPath path, Node node, XmlContext context, XmlMapper<T> mapper);

    void set(CompiledXPath path, Node node, XmlContext context, XmlMapper<T> mapper, V value);

    void delete(CompiledXPath path, Node node, XmlContext context, XmlMapper<T> mapper);
}
