package xml.java17.xpath;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import xml.java17.xpath.XPathAst.Operator;
import xml.java17.xpath.XPathToken.Type;

/// Parser for XPath expressions into [XPathAst].
/// Implements a recursive descent parser over the tokens produced by [XPathLexer].
///
/// Precedence, loosest first:
/// - `or`
/// - `and`
/// - `=` `!=`
/// - `<` `<=` `>` `>=`
/// - `+` `-`
/// - `*` `div` `mod`
/// - unary `-`
/// - `|`
/// - path expressions (`/` and `//` joined location steps, filter expressions)
///
/// All binary operators are left associative. Relative location paths are built as left-nested
/// [XPathAst.BinaryExpression]s, so `a/b/c` is `(a/b)/c`.
public final class XPathParser {

    private static final Logger LOG = Logger.getLogger(XPathParser.class.getName());

    private final String expression;
    private final List<XPathToken> tokens;
    private int index;

    private XPathParser(String expression, List<XPathToken> tokens) {
        this.expression = expression;
        this.tokens = tokens;
        this.index = 0;
    }

    /// Parses an XPath expression string into an AST.
    /// @param expression the expression to parse
    /// @return the parsed AST
    /// @throws NullPointerException if expression is null
    /// @throws XPathSyntaxException if the expression cannot be lexed or parsed
    public static XPathAst parse(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        LOG.fine(() -> "Parsing XPath: " + expression);
        final var parser = new XPathParser(expression, XPathLexer.tokenize(expression));
        final var ast = parser.parseExpr();
        if (parser.peek().type() != Type.END) {
            throw parser.unexpected(parser.peek());
        }
        LOG.finer(() -> "Parsed AST: " + ast);
        return ast;
    }

    private XPathAst parseExpr() {
        return parseOr();
    }

    private XPathAst parseOr() {
        var left = parseAnd();
        while (peek().type() == Type.OR_OP) {
            next();
            left = new XPathAst.BinaryExpression(left, Operator.OR, parseAnd());
        }
        return left;
    }

    private XPathAst parseAnd() {
        var left = parseEquality();
        while (peek().type() == Type.AND_OP) {
            next();
            left = new XPathAst.BinaryExpression(left, Operator.AND, parseEquality());
        }
        return left;
    }

    private XPathAst parseEquality() {
        var left = parseRelational();
        while (peek().type() == Type.EQUAL_OP) {
            final var op = Operator.fromSymbol(next().text());
            left = new XPathAst.BinaryExpression(left, op, parseRelational());
        }
        return left;
    }

    private XPathAst parseRelational() {
        var left = parseAdditive();
        while (peek().type() == Type.REL_OP) {
            final var op = Operator.fromSymbol(next().text());
            left = new XPathAst.BinaryExpression(left, op, parseAdditive());
        }
        return left;
    }

    private XPathAst parseAdditive() {
        var left = parseMultiplicative();
        while (peek().type() == Type.PLUS_OP || peek().type() == Type.MINUS_OP) {
            final var op = next().type() == Type.PLUS_OP ? Operator.PLUS : Operator.MINUS;
            left = new XPathAst.BinaryExpression(left, op, parseMultiplicative());
        }
        return left;
    }

    private XPathAst parseMultiplicative() {
        var left = parseUnary();
        var op = multiplicativeOperator(peek());
        while (op != null) {
            next();
            left = new XPathAst.BinaryExpression(left, op, parseUnary());
            op = multiplicativeOperator(peek());
        }
        return left;
    }

    private static Operator multiplicativeOperator(XPathToken token) {
        return switch (token.type()) {
            case MULT_OP -> Operator.MULTIPLY;
            case DIV_OP -> Operator.DIV;
            case MOD_OP -> Operator.MOD;
            default -> null;
        };
    }

    private XPathAst parseUnary() {
        if (peek().type() == Type.MINUS_OP) {
            next();
            return new XPathAst.UnaryExpression(Operator.MINUS, parseUnary());
        }
        return parseUnion();
    }

    private XPathAst parseUnion() {
        var left = parsePathExpr();
        while (peek().type() == Type.UNION_OP) {
            next();
            left = new XPathAst.BinaryExpression(left, Operator.UNION, parsePathExpr());
        }
        return left;
    }

    private XPathAst parsePathExpr() {
        final var token = peek();
        if (token.type() == Type.PATH_SEP || token.type() == Type.ABBREV_PATH_SEP) {
            next();
            final var op = pathOperator(token);
            if (op == Operator.PATH && !startsStep(peek())) {
                return new XPathAst.AbsolutePath(op, null);
            }
            return new XPathAst.AbsolutePath(op, parseRelativeLocationPath());
        }
        if (startsFilter()) {
            var left = parseFilterExpr();
            while (isPathSeparator(peek())) {
                final var op = pathOperator(next());
                left = new XPathAst.BinaryExpression(left, op, parseStep());
            }
            return left;
        }
        return parseRelativeLocationPath();
    }

    private XPathAst parseRelativeLocationPath() {
        var left = parseStep();
        while (isPathSeparator(peek())) {
            final var op = pathOperator(next());
            left = new XPathAst.BinaryExpression(left, op, parseStep());
        }
        return left;
    }

    private XPathAst parseStep() {
        final var token = peek();
        switch (token.type()) {
            case ABBREV_STEP_SELF -> {
                next();
                return new XPathAst.AbbreviatedStep(XPathAst.AbbreviatedStep.SELF);
            }
            case ABBREV_STEP_PARENT -> {
                next();
                return new XPathAst.AbbreviatedStep(XPathAst.AbbreviatedStep.PARENT);
            }
            default -> {
                // fall through to axis and node test
            }
        }

        String axis = null;
        if (token.type() == Type.AXISNAME) {
            axis = next().text();
            expect(Type.AXIS_SEP);
        } else if (token.type() == Type.ABBREV_AXIS_AT) {
            next();
            axis = XPathAst.Step.ABBREVIATED_ATTRIBUTE;
        }

        final var nodeTest = parseNodeTest();
        return new XPathAst.Step(axis, nodeTest, parsePredicates());
    }

    private XPathAst.NodeTest parseNodeTest() {
        final var token = next();
        switch (token.type()) {
            case NODETYPE -> {
                expect(Type.OPEN_PAREN);
                String literal = null;
                if (peek().type() == Type.LITERAL) {
                    literal = next().text();
                }
                expect(Type.CLOSE_PAREN);
                return new XPathAst.NodeType(token.text(), literal);
            }
            case STAR_OP -> {
                return new XPathAst.NameTest(null, XPathAst.NameTest.WILDCARD);
            }
            case NCNAME -> {
                if (peek().type() != Type.COLON) {
                    return new XPathAst.NameTest(null, token.text());
                }
                next();
                final var local = next();
                if (local.type() == Type.STAR_OP) {
                    return new XPathAst.NameTest(token.text(), XPathAst.NameTest.WILDCARD);
                }
                if (local.type() != Type.NCNAME) {
                    throw unexpected(local);
                }
                return new XPathAst.NameTest(token.text(), local.text());
            }
            default -> throw unexpected(token);
        }
    }

    private List<XPathAst> parsePredicates() {
        final var predicates = new ArrayList<XPathAst>();
        while (peek().type() == Type.OPEN_BRACKET) {
            next();
            predicates.add(parseExpr());
            expect(Type.CLOSE_BRACKET);
        }
        return predicates;
    }

    private XPathAst parseFilterExpr() {
        final var primary = parsePrimary();
        final var predicates = parsePredicates();
        if (predicates.isEmpty()) {
            return primary;
        }
        return new XPathAst.PredicatedExpression(primary, predicates);
    }

    private XPathAst parsePrimary() {
        final var token = next();
        return switch (token.type()) {
            case DOLLAR -> parseVariableReference();
            case LITERAL -> new XPathAst.StringLiteral(token.text());
            case INTEGER -> parseInteger(token);
            case FLOAT -> new XPathAst.FloatLiteral(Double.parseDouble(token.text()));
            case FUNCNAME -> parseFunctionCall(null, token.text());
            case NCNAME -> {
                expect(Type.COLON);
                yield parseFunctionCall(token.text(), expect(Type.FUNCNAME).text());
            }
            case OPEN_PAREN -> {
                final var inner = parseExpr();
                expect(Type.CLOSE_PAREN);
                yield inner;
            }
            default -> throw unexpected(token);
        };
    }

    private XPathAst parseVariableReference() {
        final var first = expect(Type.NCNAME);
        if (peek().type() == Type.COLON) {
            next();
            return new XPathAst.VariableReference(first.text(), expect(Type.NCNAME).text());
        }
        return new XPathAst.VariableReference(null, first.text());
    }

    private XPathAst parseInteger(XPathToken token) {
        try {
            return new XPathAst.IntegerLiteral(Long.parseLong(token.text()));
        } catch (NumberFormatException e) {
            throw new XPathSyntaxException("Integer literal out of range '" + token.text() + "'",
                    expression, token.position());
        }
    }

    private XPathAst parseFunctionCall(String prefix, String name) {
        expect(Type.OPEN_PAREN);
        final var args = new ArrayList<XPathAst>();
        if (peek().type() != Type.CLOSE_PAREN) {
            args.add(parseExpr());
            while (peek().type() == Type.COMMA) {
                next();
                args.add(parseExpr());
            }
        }
        expect(Type.CLOSE_PAREN);
        return new XPathAst.FunctionCall(prefix, name, args);
    }

    private boolean startsFilter() {
        return switch (peek().type()) {
            case DOLLAR, LITERAL, INTEGER, FLOAT, FUNCNAME, OPEN_PAREN -> true;
            case NCNAME -> peek(1).type() == Type.COLON && peek(2).type() == Type.FUNCNAME;
            default -> false;
        };
    }

    private static boolean startsStep(XPathToken token) {
        return switch (token.type()) {
            case ABBREV_STEP_SELF, ABBREV_STEP_PARENT, AXISNAME, ABBREV_AXIS_AT, NODETYPE, STAR_OP, NCNAME -> true;
            default -> false;
        };
    }

    private static boolean isPathSeparator(XPathToken token) {
        return token.type() == Type.PATH_SEP || token.type() == Type.ABBREV_PATH_SEP;
    }

    private static Operator pathOperator(XPathToken token) {
        return token.type() == Type.ABBREV_PATH_SEP ? Operator.DESCENDANT_PATH : Operator.PATH;
    }

    private XPathToken peek() {
        return tokens.get(index);
    }

    private XPathToken peek(int ahead) {
        return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    private XPathToken next() {
        final var token = tokens.get(index);
        if (token.type() != Type.END) {
            index++;
        }
        return token;
    }

    private XPathToken expect(Type type) {
        final var token = next();
        if (token.type() != type) {
            throw unexpected(token);
        }
        return token;
    }

    private XPathSyntaxException unexpected(XPathToken token) {
        if (token.type() == Type.END) {
            return new XPathSyntaxException("Unexpected end of expression", expression, token.position());
        }
        return new XPathSyntaxException("Unexpected token '" + token.text() + "'", expression, token.position());
    }
}
