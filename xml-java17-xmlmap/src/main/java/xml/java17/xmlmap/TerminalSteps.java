package xml.java17.xmlmap;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.Text;
import xml.java17.xpath.XPathAst;

import java.util.logging.Logger;

/// Helpers around the last step of a path, which decides how a value is written.
final class TerminalSteps {

    private static final Logger LOG = Logger.getLogger(TerminalSteps.class.getName());

    private TerminalSteps() {}

    /// The rightmost step of a `/` or `//` path, or null when the path does not end in a step.
    static XPathAst.Step findTerminalStep(XPathAst ast) {
        if (ast instanceof XPathAst.Step step) {
            return step;
        }
        if (ast instanceof XPathAst.BinaryExpression binary && binary.isPath()) {
            return findTerminalStep(binary.right());
        }
        if (ast instanceof XPathAst.AbsolutePath absolute && absolute.relative() != null) {
            return findTerminalStep(absolute.relative());
        }
        return null;
    }

    /// Writes a mapped value into the node a field expression selected.
    ///
    /// Elements take a node value by grafting its children and attributes, or a string value
    /// as text content; with a `text()` terminal step only the leading text node is replaced.
    /// Attributes and text nodes take the string value.
    ///
    /// @throws XmlConstructionException if a string would replace element children
    static void setInXml(Node target, Object value, XPathAst.Step terminal) {
        if (target instanceof Element element) {
            if (value instanceof Node node) {
                graft(element, node);
            } else if (terminal != null && terminal.isTextTest()) {
                setLeadingText(element, String.valueOf(value));
            } else if (hasElementChildren(element)) {
                throw new XmlConstructionException("Cannot set string value on <" + element.getNodeName()
                        + ">: element has child elements");
            } else {
                element.setTextContent(String.valueOf(value));
            }
        } else if (target instanceof Attr attr) {
            attr.setValue(String.valueOf(value));
        } else if (target instanceof Text text) {
            text.setData(String.valueOf(value));
        } else {
            throw new XmlConstructionException("Cannot set value on node of type " + target.getNodeType());
        }
        LOG.finer(() -> "Set " + target.getNodeName() + " to " + describe(value));
    }

    /// Replaces the element's content and attributes with copies of those of the node.
    private static void graft(Element target, Node source) {
        if (source == target) {
            return;
        }
        final var document = target.getOwnerDocument();
        while (target.getFirstChild() != null) {
            target.removeChild(target.getFirstChild());
        }
        final var attributes = target.getAttributes();
        while (attributes.getLength() > 0) {
            target.removeAttributeNode((Attr) attributes.item(0));
        }
        if (source.hasAttributes()) {
            final var sourceAttributes = source.getAttributes();
            for (int i = 0; i < sourceAttributes.getLength(); i++) {
                final var copy = (Attr) document.importNode(sourceAttributes.item(i), true);
                target.setAttributeNodeNS(copy);
            }
        }
        for (var child = source.getFirstChild(); child != null; child = child.getNextSibling()) {
            target.appendChild(document.importNode(child, true));
        }
    }

    /// Text a predicate's right-hand side assigns: a literal, or a bound variable's value.
    /// Returns null for anything else or an unbound variable.
    static String assignedText(XPathAst value, XmlContext context) {
        if (value instanceof XPathAst.StringLiteral literal) {
            return literal.value();
        }
        if (value instanceof XPathAst.IntegerLiteral integer) {
            return String.valueOf(integer.value());
        }
        if (value instanceof XPathAst.VariableReference variable) {
            return context.variableText(variable.name());
        }
        return null;
    }

    static void setLeadingText(Element element, String value) {
        final var first = element.getFirstChild();
        if (first instanceof Text text) {
            text.setData(value);
        } else {
            element.insertBefore(element.getOwnerDocument().createTextNode(value), first);
        }
    }

    /// Removes the leading text node, returning whether there was one.
    static boolean removeLeadingText(Element element) {
        final var first = element.getFirstChild();
        if (first instanceof Text text) {
            element.removeChild(text);
            return true;
        }
        return false;
    }

    static boolean hasElementChildren(Node node) {
        for (var child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Object value) {
        return value instanceof Node node ? "<" + node.getNodeName() + ">" : "'" + value + "'";
    }
}
