package xml.java17.xmlmap;

import org.w3c.dom.Element;
import xml.java17.xpath.XPathAst;
import xml.java17.xpath.XPathSerializer;

import javax.xml.XMLConstants;

/// An XSD document, read as a model object to look up named type definitions.
public class XsdSchema extends XmlObject {

    public static final XmlObjectType TYPE = XmlObjectType.builder("XsdSchema")
            .rootName("schema")
            .rootNamespace(XMLConstants.W3C_XML_SCHEMA_NS_URI)
            .namespace("xs", XMLConstants.W3C_XML_SCHEMA_NS_URI)
            .field("targetNamespace", Fields.string("@targetNamespace"))
            .factory(XsdSchema::new)
            .build();

    public XsdSchema(XmlObjectType type, Element node, XmlContext context) {
        super(type, node, context);
    }

    /// Parses the XSD at a URI or file path.
    public static XsdSchema load(String location) {
        final var document = XmlDocuments.parseUri(location);
        return (XsdSchema) TYPE.wrap(document.getDocumentElement());
    }

    public String targetNamespace() {
        return get("targetNamespace");
    }

    /// Finds the one definition with the given name anywhere in the schema.
    /// @throws XmlMappingException if no definition or more than one has that name
    public XsdType getType(String name) {
        final var query = "//*[@name=" + XPathSerializer.serialize(new XPathAst.StringLiteral(name)) + "]";
        final var matches = XmlEvaluator.selectNodes(query, node(), context());
        if (matches.isEmpty()) {
            throw new XmlMappingException("Schema type " + name + " not found");
        }
        if (matches.size() > 1) {
            throw new XmlMappingException("Schema type " + name + " is ambiguous, " + matches.size()
                    + " definitions found");
        }
        return (XsdType) XsdType.TYPE.wrap((Element) matches.get(0), context());
    }
}
