package xml.java17.xmlmap;

import org.w3c.dom.Node;

import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathEvaluationResult;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import javax.xml.xpath.XPathNodes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Read-path adapter over the JAXP XPath evaluator.
///
/// Every lookup in the engine goes through here: field gets, list views, the
/// synthesizer resolving existing ancestors and the remover locating matches.
/// Results come back as a `List<Node>` for node-sets, otherwise as the
/// evaluator's native `Double`, `String` or `Boolean`.
final class XmlEvaluator {

    private static final Logger LOG = Logger.getLogger(XmlEvaluator.class.getName());

    private static final LazyConstant<XPathFactory> FACTORY =
            LazyConstant.of("XPathFactory", XPathFactory::newInstance);

    private static final ThreadLocal<XPath> XPATH = ThreadLocal.withInitial(() -> {
        synchronized (FACTORY) {
            return FACTORY.get().newXPath();
        }
    });

    private XmlEvaluator() {}

    /// Evaluates an expression against the node.
    /// @throws XmlMapException if the evaluator rejects the expression
    static Object evaluate(String expression, Node node, XmlContext context) {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(context, "context must not be null");
        final var xpath = prepare(context);
        try {
            final XPathEvaluationResult<?> result = xpath.evaluateExpression(expression, node);
            final Object value = switch (result.type()) {
                case NODESET -> toList((XPathNodes) result.value());
                case NODE -> List.of((Node) result.value());
                default -> result.value();
            };
            LOG.finer(() -> "Evaluated '" + expression + "' to " + describe(value));
            return value;
        } catch (XPathExpressionException e) {
            throw new XmlMapException("Failed to evaluate '" + expression + "'", e);
        }
    }

    /// Evaluates an expression that must yield a node-set.
    static List<Node> selectNodes(String expression, Node node, XmlContext context) {
        final var value = evaluate(expression, node, context);
        if (value instanceof List<?> list) {
            @SuppressWarnings("unchecked")
            final var nodes = (List<Node>) list;
            return nodes;
        }
        throw new XmlMapException("Expression '" + expression + "' did not select nodes, got " + value);
    }

    /// First selected node, the scalar result as is, or null when nothing matches.
    static Object first(String expression, Node node, XmlContext context) {
        final var value = evaluate(expression, node, context);
        if (value instanceof List<?> list) {
            return list.isEmpty() ? null : list.get(0);
        }
        return value;
    }

    /// First selected node, or null when nothing matches or the result is not a node-set.
    static Node firstNode(String expression, Node node, XmlContext context) {
        return first(expression, node, context) instanceof Node match ? match : null;
    }

    private static XPath prepare(XmlContext context) {
        final var xpath = XPATH.get();
        xpath.reset();
        xpath.setNamespaceContext(context.namespaceContext());
        xpath.setXPathVariableResolver(context.variableResolver());
        return xpath;
    }

    private static List<Node> toList(XPathNodes nodes) {
        final var list = new ArrayList<Node>(nodes.size());
        for (final var node : nodes) {
            list.add(node);
        }
        return list;
    }

    private static String describe(Object value) {
        if (value instanceof List<?> list) {
            return list.size() + " node(s)";
        }
        return String.valueOf(value);
    }
}
