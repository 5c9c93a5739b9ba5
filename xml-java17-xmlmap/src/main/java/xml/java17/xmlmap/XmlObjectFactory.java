package xml.java17.xmlmap;

import org.w3c.dom.Element;

/// Creates the model object for an element, so that types can be backed by subclasses of [XmlObject].
@FunctionalInterface
public interface XmlObjectFactory {

    XmlObject create(XmlObjectType type, Element node, XmlContext context);
}
