package xml.java17.xpath;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

import xml.java17.xpath.XPathAst.Operator;

/// Renders an [XPathAst] back into expression text.
///
/// Keyword operators are written with surrounding spaces and other operators are written bare.
/// Parentheses are only added where the operator precedence of the tree requires them.
/// Re-parsing the output yields an AST equal to the input for any AST produced by [XPathParser];
/// the text itself may differ from the parsed text, e.g. in literal quoting or whitespace.
public final class XPathSerializer {

    private static final int ATOMIC = 10;

    private XPathSerializer() {}

    /// Serializes the AST to XPath text.
    /// @throws IllegalArgumentException if a string literal contains both quote characters
    ///         or a float literal is not finite
    public static String serialize(XPathAst ast) {
        Objects.requireNonNull(ast, "ast must not be null");
        final var sb = new StringBuilder();
        write(sb, ast);
        return sb.toString();
    }

    private static void write(StringBuilder sb, XPathAst ast) {
        if (ast instanceof XPathAst.UnaryExpression unary) {
            sb.append(unary.op().symbol());
            writeOperand(sb, unary.operand(), isBareRoot(unary.operand())
                    || precedenceOf(unary.operand()) < Operator.UNARY_PRECEDENCE);
        } else if (ast instanceof XPathAst.BinaryExpression binary) {
            writeBinary(sb, binary);
        } else if (ast instanceof XPathAst.PredicatedExpression predicated) {
            sb.append('(');
            write(sb, predicated.base());
            sb.append(')');
            writePredicates(sb, predicated.predicates());
        } else if (ast instanceof XPathAst.AbsolutePath absolute) {
            sb.append(absolute.op().symbol());
            if (absolute.relative() != null) {
                write(sb, absolute.relative());
            }
        } else if (ast instanceof XPathAst.Step step) {
            writeStep(sb, step);
        } else if (ast instanceof XPathAst.AbbreviatedStep abbreviated) {
            sb.append(abbreviated.abbreviation());
        } else if (ast instanceof XPathAst.VariableReference variable) {
            sb.append('$');
            writeQualifiedName(sb, variable.prefix(), variable.name());
        } else if (ast instanceof XPathAst.FunctionCall function) {
            writeQualifiedName(sb, function.prefix(), function.name());
            sb.append('(');
            for (int i = 0; i < function.args().size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                write(sb, function.args().get(i));
            }
            sb.append(')');
        } else if (ast instanceof XPathAst.StringLiteral literal) {
            sb.append(quote(literal.value()));
        } else if (ast instanceof XPathAst.IntegerLiteral integer) {
            sb.append(integer.value());
        } else if (ast instanceof XPathAst.FloatLiteral number) {
            sb.append(formatFloat(number.value()));
        }
    }

    private static void writeBinary(StringBuilder sb, XPathAst.BinaryExpression binary) {
        final var op = binary.op();
        if (op.isPath()) {
            writeOperand(sb, binary.left(), !isPathOperand(binary.left()));
            sb.append(op.symbol());
            write(sb, binary.right());
            return;
        }

        writeOperand(sb, binary.left(), needsParentheses(binary.left(), op.precedence(), false));
        final int leftEnd = sb.length();
        if (op.isKeyword()) {
            sb.append(' ').append(op.symbol()).append(' ');
        } else if (op == Operator.MINUS && leftEnd > 0 && endsWithNameChar(sb)) {
            // a-b would lex as a single name
            sb.append(" - ");
        } else {
            sb.append(op.symbol());
        }
        writeOperand(sb, binary.right(), needsParentheses(binary.right(), op.precedence(), true));
    }

    private static boolean needsParentheses(XPathAst operand, int parentPrecedence, boolean right) {
        if (isBareRoot(operand)) {
            return true;
        }
        final int precedence = precedenceOf(operand);
        return right ? precedence <= parentPrecedence : precedence < parentPrecedence;
    }

    /// A lone `/` swallows a following name as its first step, so it is bracketed as an operand.
    private static boolean isBareRoot(XPathAst ast) {
        return ast instanceof XPathAst.AbsolutePath absolute && absolute.relative() == null;
    }

    /// Left operands of `/` that re-parse as the same filter or location path without parentheses.
    private static boolean isPathOperand(XPathAst operand) {
        if (operand instanceof XPathAst.BinaryExpression binary) {
            return binary.isPath();
        }
        return !(operand instanceof XPathAst.UnaryExpression || operand instanceof XPathAst.AbsolutePath);
    }

    private static int precedenceOf(XPathAst ast) {
        if (ast instanceof XPathAst.BinaryExpression binary) {
            return binary.op().precedence();
        }
        if (ast instanceof XPathAst.UnaryExpression) {
            return Operator.UNARY_PRECEDENCE;
        }
        if (ast instanceof XPathAst.AbsolutePath) {
            return Operator.PATH.precedence();
        }
        return ATOMIC;
    }

    private static void writeOperand(StringBuilder sb, XPathAst operand, boolean parenthesize) {
        if (parenthesize) {
            sb.append('(');
            write(sb, operand);
            sb.append(')');
        } else {
            write(sb, operand);
        }
    }

    private static void writeStep(StringBuilder sb, XPathAst.Step step) {
        if (step.axis() != null) {
            sb.append(step.axis());
            if (!XPathAst.Step.ABBREVIATED_ATTRIBUTE.equals(step.axis())) {
                sb.append("::");
            }
        }
        if (step.nodeTest() instanceof XPathAst.NameTest name) {
            writeQualifiedName(sb, name.prefix(), name.name());
        } else if (step.nodeTest() instanceof XPathAst.NodeType type) {
            sb.append(type.name()).append('(');
            if (type.literal() != null) {
                sb.append(quote(type.literal()));
            }
            sb.append(')');
        }
        writePredicates(sb, step.predicates());
    }

    private static void writePredicates(StringBuilder sb, List<XPathAst> predicates) {
        for (final var predicate : predicates) {
            sb.append('[');
            write(sb, predicate);
            sb.append(']');
        }
    }

    private static void writeQualifiedName(StringBuilder sb, String prefix, String name) {
        if (prefix != null) {
            sb.append(prefix).append(':');
        }
        sb.append(name);
    }

    private static boolean endsWithNameChar(StringBuilder sb) {
        return XPathLexer.isNameChar(sb.codePointBefore(sb.length()));
    }

    /// XPath 1.0 literals have no escape syntax, so a value holding both quote kinds cannot be written.
    static String quote(String value) {
        if (value.indexOf('"') < 0) {
            return '"' + value + '"';
        }
        if (value.indexOf('\'') < 0) {
            return '\'' + value + '\'';
        }
        throw new IllegalArgumentException("String literal cannot contain both quote characters: " + value);
    }

    private static String formatFloat(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Float literal must be finite: " + value);
        }
        final var text = BigDecimal.valueOf(value).toPlainString();
        return text.indexOf('.') < 0 ? text + ".0" : text;
    }
}
