package xml.java17.xmlmap;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import javax.xml.transform.Result;
import javax.xml.transform.Templates;
import javax.xml.transform.TransformerException;
import javax.xml.transform.dom.DOMResult;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// An element viewed through a model type: fields are read and written by name.
///
/// Subclasses add typed accessors; register them with [XmlObjectType.Builder#factory].
public class XmlObject {

    private static final Logger LOG = Logger.getLogger(XmlObject.class.getName());

    private final XmlObjectType type;
    private final Element node;
    private final XmlContext context;

    public XmlObject(XmlObjectType type, Element node, XmlContext context) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.node = Objects.requireNonNull(node, "node must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    public XmlObjectType type() {
        return type;
    }

    public Element node() {
        return node;
    }

    public XmlContext context() {
        return context;
    }

    /// Reads a field; list fields return a live [NodeList].
    /// @throws IllegalArgumentException if the type has no such field
    @SuppressWarnings("unchecked")
    public <V> V get(String fieldName) {
        return (V) type.field(fieldName).get(node, context);
    }

    /// Writes a field; null removes the value.
    /// @throws XmlConstructionException if missing nodes cannot be synthesized
    public void set(String fieldName, Object value) {
        type.field(fieldName).setUnchecked(node, context, value);
    }

    public void delete(String fieldName) {
        type.field(fieldName).delete(node, context);
    }

    /// Returns the node a single-valued field selects, creating it when missing.
    public Node create(String fieldName) {
        return type.field(fieldName).create(node, context);
    }

    public String serialize(boolean pretty) {
        return XmlDocuments.serialize(node, pretty, false);
    }

    /// Serializes the whole document this object belongs to, with an XML declaration.
    public String serializeDocument(boolean pretty) {
        return XmlDocuments.serialize(node.getOwnerDocument(), pretty, true);
    }

    /// True when the element has no attributes other than namespace declarations, no child
    /// elements, comments or processing instructions, and no text.
    public boolean isEmpty() {
        final var attributes = node.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            if (!XmlContext.isNamespaceDeclaration(attributes.item(i))) {
                return false;
            }
        }
        for (var child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() != Node.TEXT_NODE || !child.getNodeValue().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /// True when the type declares no schema, skips validation, or the element is valid.
    public boolean isValid() {
        return validationErrors().isEmpty();
    }

    public List<String> validationErrors() {
        if (type.xsdSchema() == null || !type.schemaValidate()) {
            return List.of();
        }
        return XmlSchemas.validate(node, type.xsdSchema()).errors();
    }

    /// Applies a stylesheet to this element, or to the whole document when it is the root.
    /// @return the result's root element as a generic object, or empty when the result has no root
    public Optional<XmlObject> transform(Templates xslt, Map<String, String> parameters) {
        return transform(xslt, parameters, XmlObjectType.BASE);
    }

    public Optional<XmlObject> transform(Templates xslt, Map<String, String> parameters, XmlObjectType resultType) {
        Objects.requireNonNull(resultType, "resultType must not be null");
        final var result = new DOMResult(XmlDocuments.newDocument());
        runTransform(xslt, parameters, result);
        final var root = ((Document) result.getNode()).getDocumentElement();
        if (root == null) {
            LOG.warning(() -> "XSL transform of " + node.getNodeName() + " produced no document element");
            return Optional.empty();
        }
        return Optional.of(resultType.wrap(root, context));
    }

    /// Applies a stylesheet and returns its serialized output, for text or non-XML results.
    public Optional<String> transformToString(Templates xslt, Map<String, String> parameters) {
        final var writer = new StringWriter();
        runTransform(xslt, parameters, new StreamResult(writer));
        final var text = writer.toString();
        if (text.isBlank()) {
            LOG.warning(() -> "XSL transform of " + node.getNodeName() + " produced an empty result");
            return Optional.empty();
        }
        return Optional.of(text);
    }

    private void runTransform(Templates xslt, Map<String, String> parameters, Result result) {
        Objects.requireNonNull(xslt, "xslt must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        try {
            final var transformer = xslt.newTransformer();
            parameters.forEach(transformer::setParameter);
            transformer.transform(new DOMSource(transformSource()), result);
        } catch (TransformerException e) {
            throw new XmlMapException("XSL transform of " + node.getNodeName() + " failed", e);
        }
    }

    /// The whole document for a root element, otherwise a new document holding a copy of this element.
    private Node transformSource() {
        final var document = node.getOwnerDocument();
        if (document.getDocumentElement() == node) {
            return document;
        }
        final var partial = XmlDocuments.newDocument();
        partial.appendChild(partial.importNode(node, true));
        return partial;
    }

    /// Same node, or failing that the same serialization.
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof XmlObject that)) {
            return false;
        }
        return node == that.node || serialize(false).equals(that.serialize(false));
    }

    @Override
    public int hashCode() {
        return serialize(false).hashCode();
    }

    /// The element's string value with whitespace normalized.
    @Override
    public String toString() {
        return String.valueOf(XmlEvaluator.evaluate("normalize-space(.)", node, context));
    }
}
