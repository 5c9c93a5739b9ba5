package xml.java17.xmlmap;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import xml.java17.xpath.XPathAst;
import xml.java17.xpath.XPathAst.Operator;
import xml.java17.xpath.XPathSerializer;

import java.util.Objects;
import java.util.logging.Logger;

/// Builds the nodes a constructible expression describes.
///
/// `bar[@type="x"]/baz` under an empty element yields `<bar type="x"><baz/></bar>`; an existing
/// `bar[@type="x"]` is reused. Attribute steps return the attribute, `text()` returns the element
/// whose text it names.
public final class NodeSynthesizer {

    private static final Logger LOG = Logger.getLogger(NodeSynthesizer.class.getName());

    private NodeSynthesizer() {}

    /// Creates the nodes for the expression under the context node and returns the node
    /// the expression's value is written into.
    /// @throws XmlConstructionException if the expression cannot be constructed; the tree is
    ///         left untouched when the failure is detectable before mutation
    public static Node synthesize(XPathAst ast, Node node, XmlContext context) {
        Objects.requireNonNull(node, "node must not be null");
        ConstructibilityAnalyzer.requireConstructible(ast, context);
        LOG.fine(() -> "Synthesizing " + XPathSerializer.serialize(ast) + " under " + node.getNodeName());
        return build(ast, node, context, null);
    }

    /// Creates a single step under the parent, inserted before the given sibling or appended when it is null.
    public static Node synthesizeStep(XPathAst.Step step, Node parent, XmlContext context, Node before) {
        Objects.requireNonNull(parent, "parent must not be null");
        ConstructibilityAnalyzer.requireConstructible(step, context);
        return build(step, parent, context, before);
    }

    private static Node build(XPathAst ast, Node node, XmlContext context, Node before) {
        if (ast instanceof XPathAst.Step step) {
            return buildStep(step, node, context, before);
        }
        if (ast instanceof XPathAst.BinaryExpression binary && binary.op() == Operator.PATH) {
            var parent = XmlEvaluator.firstNode(XPathSerializer.serialize(binary.left()), node, context);
            if (parent == null) {
                parent = build(binary.left(), node, context, null);
            }
            if (parent instanceof Attr) {
                throw new XmlConstructionException("Cannot construct '" + XPathSerializer.serialize(binary.right())
                        + "' under attribute " + parent.getNodeName());
            }
            return build(binary.right(), parent, context, before);
        }
        throw new XmlConstructionException("Cannot construct '" + XPathSerializer.serialize(ast) + "'");
    }

    private static Node buildStep(XPathAst.Step step, Node node, XmlContext context, Node before) {
        if (step.isTextTest()) {
            return node;
        }
        final var name = (XPathAst.NameTest) step.nodeTest();
        final var uri = name.prefix() == null ? null : context.namespaceUri(name.prefix());
        final var qualifiedName = name.prefix() == null ? name.name() : name.prefix() + ":" + name.name();

        if (step.isAttributeAxis()) {
            if (!(node instanceof Element element)) {
                throw new XmlConstructionException("Cannot create attribute " + qualifiedName
                        + " on node " + node.getNodeName());
            }
            if (!element.hasAttributeNS(uri, name.name())) {
                element.setAttributeNS(uri, qualifiedName, "");
                LOG.finer(() -> "Created attribute @" + qualifiedName + " on " + element.getNodeName());
            }
            return element.getAttributeNodeNS(uri, name.name());
        }

        if (!(node instanceof Element) && !(node instanceof Document)) {
            throw new XmlConstructionException("Cannot create element " + qualifiedName
                    + " under node " + node.getNodeName());
        }
        final var document = node instanceof Document doc ? doc : node.getOwnerDocument();
        final var element = document.createElementNS(uri, qualifiedName);
        node.insertBefore(element, before);
        LOG.finer(() -> "Created element <" + qualifiedName + "> under " + node.getNodeName());
        for (final var predicate : step.predicates()) {
            buildPredicate(predicate, element, context);
        }
        return element;
    }

    private static void buildPredicate(XPathAst predicate, Element element, XmlContext context) {
        if (predicate instanceof XPathAst.IntegerLiteral) {
            // positional predicates are satisfied by the new node itself
            return;
        }
        if (predicate instanceof XPathAst.BinaryExpression binary && binary.op() == Operator.EQUAL) {
            final var leaf = build(binary.left(), element, context, null);
            TerminalSteps.setInXml(leaf, predicateValue(binary.right(), context),
                    TerminalSteps.findTerminalStep(binary.left()));
            return;
        }
        build(predicate, element, context, null);
    }

    private static String predicateValue(XPathAst value, XmlContext context) {
        final var text = TerminalSteps.assignedText(value, context);
        if (text == null) {
            throw new XmlConstructionException("Cannot assign predicate value '" + XPathSerializer.serialize(value) + "'");
        }
        return text;
    }
}
