package xml.java17.xmlmap;

import org.w3c.dom.Attr;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import javax.xml.xpath.XPathVariableResolver;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Evaluation context carried by every field operation: the namespace prefixes that
/// field expressions may use and the values bound to XPath variables.
///
/// Variables are looked up by local name. Numbers are handed to the evaluator as doubles.
///
/// @param namespaces prefix to namespace URI
/// @param variables variable name to value (String, Number, Boolean or Node)
public record XmlContext(Map<String, String> namespaces, Map<String, Object> variables) {

    public static final XmlContext EMPTY = new XmlContext(Map.of(), Map.of());

    public XmlContext {
        Objects.requireNonNull(namespaces, "namespaces must not be null");
        Objects.requireNonNull(variables, "variables must not be null");
        namespaces = Map.copyOf(namespaces);
        variables = Map.copyOf(variables);
    }

    public static XmlContext of(Map<String, String> namespaces) {
        return new XmlContext(namespaces, Map.of());
    }

    /// Collects the prefixed namespace declarations in scope at the node; nearer declarations win.
    /// XPath 1.0 has no default namespace, so `xmlns="..."` declarations are skipped.
    public static XmlContext fromNode(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        final var namespaces = new HashMap<String, String>();
        Node current = node.getNodeType() == Node.ATTRIBUTE_NODE ? ((Attr) node).getOwnerElement() : node;
        while (current != null && current.getNodeType() == Node.ELEMENT_NODE) {
            final NamedNodeMap attributes = current.getAttributes();
            for (int i = 0; i < attributes.getLength(); i++) {
                final var attribute = attributes.item(i);
                if (XMLConstants.XMLNS_ATTRIBUTE.equals(attribute.getPrefix())) {
                    namespaces.putIfAbsent(attribute.getLocalName(), attribute.getNodeValue());
                }
            }
            current = current.getParentNode();
        }
        return new XmlContext(namespaces, Map.of());
    }

    /// Returns a context holding this context's bindings overridden by those of `other`.
    public XmlContext merge(XmlContext other) {
        Objects.requireNonNull(other, "other must not be null");
        final var mergedNamespaces = new HashMap<>(namespaces);
        mergedNamespaces.putAll(other.namespaces);
        final var mergedVariables = new HashMap<>(variables);
        mergedVariables.putAll(other.variables);
        return new XmlContext(mergedNamespaces, mergedVariables);
    }

    public XmlContext withNamespace(String prefix, String uri) {
        return merge(new XmlContext(Map.of(prefix, uri), Map.of()));
    }

    public XmlContext withVariable(String name, Object value) {
        return merge(new XmlContext(Map.of(), Map.of(name, value)));
    }

    /// Namespace URI bound to the prefix, or null when unbound.
    public String namespaceUri(String prefix) {
        if (XMLConstants.XML_NS_PREFIX.equals(prefix)) {
            return XMLConstants.XML_NS_URI;
        }
        return namespaces.get(prefix);
    }

    NamespaceContext namespaceContext() {
        return new NamespaceContext() {
            @Override
            public String getNamespaceURI(String prefix) {
                Objects.requireNonNull(prefix, "prefix must not be null");
                if (XMLConstants.XMLNS_ATTRIBUTE.equals(prefix)) {
                    return XMLConstants.XMLNS_ATTRIBUTE_NS_URI;
                }
                final var uri = namespaceUri(prefix);
                return uri == null ? XMLConstants.NULL_NS_URI : uri;
            }

            @Override
            public String getPrefix(String namespaceURI) {
                final Iterator<String> prefixes = getPrefixes(namespaceURI);
                return prefixes.hasNext() ? prefixes.next() : null;
            }

            @Override
            public Iterator<String> getPrefixes(String namespaceURI) {
                Objects.requireNonNull(namespaceURI, "namespaceURI must not be null");
                return namespaces.entrySet().stream()
                        .filter(e -> e.getValue().equals(namespaceURI))
                        .map(Map.Entry::getKey)
                        .sorted()
                        .iterator();
            }
        };
    }

    XPathVariableResolver variableResolver() {
        return name -> {
            final var value = variables.get(name.getLocalPart());
            if (value instanceof Number number && !(value instanceof Double)) {
                return number.doubleValue();
            }
            if (value == null || value instanceof String || value instanceof Boolean
                    || value instanceof Double || value instanceof Node) {
                return value;
            }
            return String.valueOf(value);
        };
    }

    /// Variable value as text, as it is written into the tree when a predicate is constructed.
    String variableText(String name) {
        final var value = variables.get(name);
        if (value instanceof Node node) {
            return node.getTextContent();
        }
        return value == null ? null : String.valueOf(value);
    }

    /// Prefixed namespace declarations to put on a new root element.
    List<Map.Entry<String, String>> declarations() {
        return namespaces.entrySet().stream().sorted(Map.Entry.comparingByKey()).toList();
    }

    static boolean isNamespaceDeclaration(Node attribute) {
        return XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attribute.getNamespaceURI())
                || XMLConstants.XMLNS_ATTRIBUTE.equals(attribute.getNodeName())
                || attribute.getNodeName().startsWith(XMLConstants.XMLNS_ATTRIBUTE + ":");
    }
}
