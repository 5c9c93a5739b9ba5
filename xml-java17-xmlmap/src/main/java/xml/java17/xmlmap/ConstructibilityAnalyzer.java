package xml.java17.xmlmap;

import xml.java17.xpath.XPathAst;
import xml.java17.xpath.XPathAst.Operator;
import xml.java17.xpath.XPathSerializer;

import java.util.Objects;
import java.util.logging.Logger;

/// Decides, without touching any tree, whether the engine can synthesize nodes for an expression.
///
/// Constructible expressions:
/// - a child step with a concrete name, e.g. `bar` or `foo:bar`
/// - an attribute step with a concrete name, e.g. `@type`
/// - `text()` on the child axis
/// - `/` joining two constructible expressions, the left one ending in an element step
///
/// Every predicate of a constructible step must itself be constructible as a predicate:
/// a constructible path, an equality between a constructible path and a string literal,
/// integer literal or variable, or a positive integer position.
public final class ConstructibilityAnalyzer {

    private static final Logger LOG = Logger.getLogger(ConstructibilityAnalyzer.class.getName());

    private ConstructibilityAnalyzer() {}

    public static boolean isConstructible(XPathAst ast) {
        Objects.requireNonNull(ast, "ast must not be null");
        if (ast instanceof XPathAst.Step step) {
            return isConstructibleStep(step);
        }
        if (ast instanceof XPathAst.BinaryExpression binary && binary.op() == Operator.PATH) {
            return isConstructible(binary.left()) && holdsChildren(binary.left())
                    && isConstructible(binary.right());
        }
        return false;
    }

    /// Attributes and text have no children, so nothing can be constructed below them.
    private static boolean holdsChildren(XPathAst ast) {
        final var terminal = TerminalSteps.findTerminalStep(ast);
        return terminal != null && !terminal.isAttributeAxis() && !terminal.isTextTest();
    }

    /// True when a predicate attached to a constructible step can be made true by synthesis.
    public static boolean isConstructiblePredicate(XPathAst predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        if (predicate instanceof XPathAst.IntegerLiteral position) {
            return position.value() >= 1;
        }
        if (predicate instanceof XPathAst.BinaryExpression binary && binary.op() == Operator.EQUAL) {
            return isConstructible(binary.left()) && isAssignable(binary.right());
        }
        return isConstructible(predicate);
    }

    private static boolean isConstructibleStep(XPathAst.Step step) {
        final boolean nodeTestOk;
        if (step.isTextTest()) {
            nodeTestOk = step.isChildAxis();
        } else if (step.nodeTest() instanceof XPathAst.NameTest name) {
            nodeTestOk = !name.isWildcard() && (step.isChildAxis() || step.isAttributeAxis());
        } else {
            nodeTestOk = false;
        }
        if (!nodeTestOk) {
            return false;
        }
        for (final var predicate : step.predicates()) {
            // attributes and text have no children to hold predicate content
            final boolean leaf = step.isAttributeAxis() || step.isTextTest();
            if (leaf && !(predicate instanceof XPathAst.IntegerLiteral)) {
                return false;
            }
            if (!isConstructiblePredicate(predicate)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAssignable(XPathAst value) {
        return value instanceof XPathAst.StringLiteral
                || value instanceof XPathAst.IntegerLiteral
                || value instanceof XPathAst.VariableReference;
    }

    /// Runs every check synthesis depends on, so that a failure leaves the tree untouched.
    /// @throws XmlConstructionException if the expression is not constructible, or it uses
    ///         a namespace prefix or variable the context does not bind
    public static void requireConstructible(XPathAst ast, XmlContext context) {
        Objects.requireNonNull(ast, "ast must not be null");
        Objects.requireNonNull(context, "context must not be null");
        if (!isConstructible(ast)) {
            throw new XmlConstructionException("Cannot construct XPath '" + XPathSerializer.serialize(ast)
                    + "': expression is not constructible");
        }
        checkBindings(ast, context);
        LOG.finer(() -> "Constructible: " + XPathSerializer.serialize(ast));
    }

    private static void checkBindings(XPathAst ast, XmlContext context) {
        if (ast instanceof XPathAst.Step step) {
            if (step.nodeTest() instanceof XPathAst.NameTest name && name.prefix() != null
                    && context.namespaceUri(name.prefix()) == null) {
                throw new XmlConstructionException("Cannot construct XPath '" + XPathSerializer.serialize(ast)
                        + "': namespace prefix '" + name.prefix() + "' is not bound");
            }
            step.predicates().forEach(p -> checkBindings(p, context));
        } else if (ast instanceof XPathAst.BinaryExpression binary) {
            checkBindings(binary.left(), context);
            checkBindings(binary.right(), context);
        } else if (ast instanceof XPathAst.VariableReference variable
                && !context.variables().containsKey(variable.name())) {
            throw new XmlConstructionException("Cannot construct predicate value: variable $"
                    + variable.name() + " is not bound");
        }
    }
}
