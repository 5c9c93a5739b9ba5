package xml.java17.xmlmap;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.Text;
import xml.java17.xpath.XPathAst;
import xml.java17.xpath.XPathAst.Operator;
import xml.java17.xpath.XPathSerializer;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Removes the node an expression selects and then any constructible ancestors on the path
/// that are left holding nothing but what their own predicates describe.
///
/// Deleting `bar[@type="x"]/baz` from `<r><bar type="x"><baz/></bar></r>` leaves `<r/>`, while
/// `<bar type="x" id="1"><baz/></bar>` keeps its `bar` because `@id` is unrelated content.
public final class NodeRemover {

    private static final Logger LOG = Logger.getLogger(NodeRemover.class.getName());

    private NodeRemover() {}

    /// Removes the first match of the expression under the node.
    /// @param ifEmpty only remove an element that is empty except for predicate content
    /// @return true if something was removed; a missing match is not an error
    public static boolean remove(XPathAst ast, Node node, XmlContext context, boolean ifEmpty) {
        Objects.requireNonNull(ast, "ast must not be null");
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(context, "context must not be null");
        if (ast instanceof XPathAst.Step step) {
            return removeStep(step, node, context, ifEmpty);
        }
        if (ast instanceof XPathAst.BinaryExpression binary && binary.op() == Operator.PATH) {
            final var left = XPathSerializer.serialize(binary.left());
            for (final var parent : XmlEvaluator.selectNodes(left, node, context)) {
                if (remove(binary.right(), parent, context, ifEmpty)) {
                    if (ConstructibilityAnalyzer.isConstructible(binary.left())) {
                        removeIfEmpty(binary.left(), parent, context);
                    }
                    return true;
                }
            }
            return false;
        }
        LOG.fine(() -> "Not removing non-path expression " + XPathSerializer.serialize(ast));
        return false;
    }

    /// Removes the node the path's last step selected, and then its ancestors along the path,
    /// while each is empty except for its predicates.
    private static void removeIfEmpty(XPathAst path, Node matched, XmlContext context) {
        final var step = TerminalSteps.findTerminalStep(path);
        if (!(matched instanceof Element element) || step == null
                || !isEmptyExceptPredicates(element, step, context)) {
            LOG.finer(() -> "Keeping non-empty " + matched.getNodeName());
            return;
        }
        final var parent = element.getParentNode();
        parent.removeChild(element);
        LOG.finer(() -> "Removed empty " + element.getNodeName());
        if (path instanceof XPathAst.BinaryExpression binary && binary.op() == Operator.PATH) {
            removeIfEmpty(binary.left(), parent, context);
        }
    }

    private static boolean removeStep(XPathAst.Step step, Node node, XmlContext context, boolean ifEmpty) {
        if (step.isTextTest()) {
            return node instanceof Element element && TerminalSteps.removeLeadingText(element);
        }
        final var match = XmlEvaluator.firstNode(XPathSerializer.serialize(step), node, context);
        if (match == null) {
            return false;
        }
        if (match instanceof Attr attr) {
            attr.getOwnerElement().removeAttributeNode(attr);
            LOG.finer(() -> "Removed attribute @" + attr.getName());
            return true;
        }
        if (ifEmpty && !(match instanceof Element element && isEmptyExceptPredicates(element, step, context))) {
            LOG.finer(() -> "Keeping non-empty " + match.getNodeName());
            return false;
        }
        match.getParentNode().removeChild(match);
        LOG.finer(() -> "Removed " + match.getNodeName());
        return true;
    }

    /// True when everything the element holds is content its step's predicates demand.
    ///
    /// Content is any attribute other than a namespace declaration, any element, comment or
    /// processing instruction child, and any text that is not whitespace. Predicate content
    /// is what synthesis would create for the predicate and which currently satisfies it.
    public static boolean isEmptyExceptPredicates(Element element, XPathAst.Step step, XmlContext context) {
        Objects.requireNonNull(element, "element must not be null");
        Objects.requireNonNull(step, "step must not be null");
        return isCovered(element, step, null, newNodeSet(), context);
    }

    /// Checks the element's content against its step predicates plus the nodes already covered.
    private static boolean isCovered(Element element, XPathAst.Step step, String requiredText,
                                     Set<Node> covered, XmlContext context) {
        for (final var predicate : step.predicates()) {
            coverPredicate(predicate, element, covered, context);
        }
        final boolean textCovered;
        if (requiredText != null) {
            if (!requiredText.equals(element.getTextContent())) {
                return false;
            }
            textCovered = true;
        } else {
            textCovered = false;
        }
        final var attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            final var attribute = attributes.item(i);
            if (!XmlContext.isNamespaceDeclaration(attribute) && !covered.contains(attribute)) {
                return false;
            }
        }
        for (var child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Text text) {
                if (!textCovered && !covered.contains(text) && !text.getData().isBlank()) {
                    return false;
                }
            } else if (!covered.contains(child)) {
                return false;
            }
        }
        return true;
    }

    private static void coverPredicate(XPathAst predicate, Element element, Set<Node> covered, XmlContext context) {
        if (predicate instanceof XPathAst.BinaryExpression binary && binary.op() == Operator.EQUAL) {
            if (ConstructibilityAnalyzer.isConstructiblePredicate(binary)) {
                final var value = TerminalSteps.assignedText(binary.right(), context);
                if (value != null) {
                    cover(binary.left(), element, value, covered, context);
                }
            }
        } else if (ConstructibilityAnalyzer.isConstructible(predicate)) {
            cover(predicate, element, null, covered, context);
        }
    }

    /// Adds the nodes the path selects under the node to the covered set when they hold nothing else.
    private static boolean cover(XPathAst path, Node node, String requiredText, Set<Node> covered,
                                 XmlContext context) {
        if (path instanceof XPathAst.BinaryExpression binary && binary.op() == Operator.PATH) {
            if (binary.left() instanceof XPathAst.BinaryExpression nested && nested.op() == Operator.PATH) {
                // (a/b)/c selects the same nodes as a/(b/c)
                return cover(new XPathAst.BinaryExpression(nested.left(), Operator.PATH,
                        new XPathAst.BinaryExpression(nested.right(), Operator.PATH, binary.right())),
                        node, requiredText, covered, context);
            }
            final var left = (XPathAst.Step) binary.left();
            for (final var candidate : XmlEvaluator.selectNodes(XPathSerializer.serialize(left), node, context)) {
                if (candidate instanceof Element element) {
                    final var inner = newNodeSet();
                    if (cover(binary.right(), element, requiredText, inner, context)
                            && isCovered(element, left, null, inner, context)) {
                        covered.add(element);
                        return true;
                    }
                }
            }
            return false;
        }
        final var step = (XPathAst.Step) path;
        if (step.isTextTest()) {
            if (node.getFirstChild() instanceof Text text
                    && (requiredText == null || requiredText.equals(text.getData()))) {
                covered.add(text);
                return true;
            }
            return false;
        }
        for (final var candidate : XmlEvaluator.selectNodes(XPathSerializer.serialize(step), node, context)) {
            if (candidate instanceof Attr attr) {
                if (requiredText == null || requiredText.equals(attr.getValue())) {
                    covered.add(attr);
                    return true;
                }
            } else if (candidate instanceof Element element
                    && isCovered(element, step, requiredText, newNodeSet(), context)) {
                covered.add(element);
                return true;
            }
        }
        return false;
    }

    private static Set<Node> newNodeSet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
