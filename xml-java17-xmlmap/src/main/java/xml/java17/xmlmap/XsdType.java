package xml.java17.xmlmap;

import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import java.util.List;

/// A named type definition in an XSD, such as an `xs:simpleType` with enumerated values.
public class XsdType extends XmlObject {

    public static final XmlObjectType TYPE = XmlObjectType.builder("XsdType")
            .namespace("xs", XMLConstants.W3C_XML_SCHEMA_NS_URI)
            .field("name", Fields.string("@name"))
            .field("base", Fields.string("xs:restriction/@base"))
            .field("restrictedValues", Fields.stringList("xs:restriction/xs:enumeration/@value"))
            .factory(XsdType::new)
            .build();

    public XsdType(XmlObjectType type, Element node, XmlContext context) {
        super(type, node, context);
    }

    public String name() {
        return get("name");
    }

    /// The restriction base as written, e.g. `xs:string`.
    public String base() {
        return get("base");
    }

    /// The restriction base without its prefix, e.g. `string`; null when there is no restriction.
    public String baseType() {
        final String base = base();
        if (base == null) {
            return null;
        }
        return base.substring(base.indexOf(':') + 1);
    }

    public List<String> restrictedValues() {
        return get("restrictedValues");
    }
}
