package xml.java17.xpath;

import java.util.List;
import java.util.Objects;

/// AST representation for the supported XPath subset.
/// Based on the XPath 1.0 grammar from https://www.w3.org/TR/xpath/
///
/// An expression is a tree of:
/// - UnaryExpression: negation (e.g., -foo)
/// - BinaryExpression: path, boolean, relational, arithmetic and union operators (e.g., a/b, a and b, a | b)
/// - PredicatedExpression: a filter expression with predicates (e.g., (a or b)[2])
/// - AbsolutePath: a location path rooted at the document (e.g., /a/b or //a)
/// - Step: axis, node test and predicates (e.g., a, @b, text(), parent::foo:bar[5])
/// - AbbreviatedStep: . or ..
/// - VariableReference: $name or $prefix:name
/// - FunctionCall: name(args...)
/// - StringLiteral, IntegerLiteral, FloatLiteral: literal values
///
/// Nodes are immutable records, so two ASTs are structurally equal exactly when `equals` says so.
public sealed interface XPathAst permits
        XPathAst.UnaryExpression,
        XPathAst.BinaryExpression,
        XPathAst.PredicatedExpression,
        XPathAst.AbsolutePath,
        XPathAst.Step,
        XPathAst.AbbreviatedStep,
        XPathAst.VariableReference,
        XPathAst.FunctionCall,
        XPathAst.StringLiteral,
        XPathAst.IntegerLiteral,
        XPathAst.FloatLiteral {

    /// Negation: -operand
    record UnaryExpression(Operator op, XPathAst operand) implements XPathAst {
        public UnaryExpression {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    /// Any binary expression: a/b; a//b; a and b; a = "x"; a | b
    record BinaryExpression(XPathAst left, Operator op, XPathAst right) implements XPathAst {
        public BinaryExpression {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        /// True for `/` and `//`.
        public boolean isPath() {
            return op.isPath();
        }
    }

    /// A filtered expression: $var[1]; (a or b)[foo][@bar]
    record PredicatedExpression(XPathAst base, List<XPathAst> predicates) implements XPathAst {
        public PredicatedExpression {
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(predicates, "predicates must not be null");
            if (predicates.isEmpty()) {
                throw new IllegalArgumentException("PredicatedExpression must have at least one predicate");
            }
            predicates = List.copyOf(predicates);
        }
    }

    /// An absolute path: /; /a/b; //a/@c
    /// The relative part is null for the bare root path `/`.
    record AbsolutePath(Operator op, XPathAst relative) implements XPathAst {
        public AbsolutePath {
            Objects.requireNonNull(op, "op must not be null");
            if (!op.isPath()) {
                throw new IllegalArgumentException("AbsolutePath operator must be / or //, got " + op);
            }
            if (op == Operator.DESCENDANT_PATH && relative == null) {
                throw new IllegalArgumentException("// must be followed by a relative path");
            }
        }
    }

    /// A single step in a location path.
    /// The axis is null when unspecified, "@" when abbreviated, otherwise the axis name.
    record Step(String axis, NodeTest nodeTest, List<XPathAst> predicates) implements XPathAst {
        public static final String ABBREVIATED_ATTRIBUTE = "@";

        public Step {
            Objects.requireNonNull(nodeTest, "nodeTest must not be null");
            Objects.requireNonNull(predicates, "predicates must not be null");
            predicates = List.copyOf(predicates);
        }

        /// True when this step selects children: no axis or `child::`.
        public boolean isChildAxis() {
            return axis == null || "child".equals(axis);
        }

        /// True when this step selects attributes: `@` or `attribute::`.
        public boolean isAttributeAxis() {
            return ABBREVIATED_ATTRIBUTE.equals(axis) || "attribute".equals(axis);
        }

        /// True when the node test is `text()`.
        public boolean isTextTest() {
            return nodeTest instanceof NodeType type && "text".equals(type.name());
        }
    }

    /// The node test of a step: a name test or a node type test.
    sealed interface NodeTest permits NameTest, NodeType {}

    /// A name test; prefix is null when unprefixed, name is `*` for a wildcard.
    record NameTest(String prefix, String name) implements NodeTest {
        public static final String WILDCARD = "*";

        public NameTest {
            Objects.requireNonNull(name, "name must not be null");
        }

        public boolean isWildcard() {
            return WILDCARD.equals(name);
        }
    }

    /// A node type test such as node(), text() or processing-instruction("target").
    record NodeType(String name, String literal) implements NodeTest {
        public NodeType {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /// `.` or `..`
    record AbbreviatedStep(String abbreviation) implements XPathAst {
        public static final String SELF = ".";
        public static final String PARENT = "..";

        public AbbreviatedStep {
            if (!SELF.equals(abbreviation) && !PARENT.equals(abbreviation)) {
                throw new IllegalArgumentException("Abbreviated step must be . or .., got " + abbreviation);
            }
        }
    }

    /// $name or $prefix:name
    record VariableReference(String prefix, String name) implements XPathAst {
        public VariableReference {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /// name(args...) or prefix:name(args...)
    record FunctionCall(String prefix, String name, List<XPathAst> args) implements XPathAst {
        public FunctionCall {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(args, "args must not be null");
            args = List.copyOf(args);
        }
    }

    /// A quoted string literal; the value excludes the quotes.
    record StringLiteral(String value) implements XPathAst {
        public StringLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /// An integer number literal such as 1 or 42.
    record IntegerLiteral(long value) implements XPathAst {}

    /// A decimal number literal such as 2.5 or .5
    record FloatLiteral(double value) implements XPathAst {}

    /// Operators, lowest binding first within each group.
    enum Operator {
        OR("or", 1, true),
        AND("and", 2, true),
        EQUAL("=", 3, false),
        NOT_EQUAL("!=", 3, false),
        LESS("<", 4, false),
        LESS_OR_EQUAL("<=", 4, false),
        GREATER(">", 4, false),
        GREATER_OR_EQUAL(">=", 4, false),
        PLUS("+", 5, false),
        MINUS("-", 5, false),
        MULTIPLY("*", 6, false),
        DIV("div", 6, true),
        MOD("mod", 6, true),
        UNION("|", 8, false),
        PATH("/", 9, false),
        DESCENDANT_PATH("//", 9, false);

        /// Binding strength of unary minus, between multiplicative and union.
        static final int UNARY_PRECEDENCE = 7;

        private final String symbol;
        private final int precedence;
        private final boolean keyword;

        Operator(String symbol, int precedence, boolean keyword) {
            this.symbol = symbol;
            this.precedence = precedence;
            this.keyword = keyword;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }

        /// True for the word operators `or`, `and`, `div`, `mod`.
        public boolean isKeyword() {
            return keyword;
        }

        public boolean isPath() {
            return this == PATH || this == DESCENDANT_PATH;
        }

        static Operator fromSymbol(String symbol) {
            for (final var op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown operator: " + symbol);
        }
    }
}
