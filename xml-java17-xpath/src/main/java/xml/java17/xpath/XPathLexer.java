package xml.java17.xpath;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

import xml.java17.xpath.XPathToken.Type;

/// Tokenizer for XPath expressions.
///
/// XPath lexing is context sensitive (https://www.w3.org/TR/xpath/#exprlex):
/// 1. If there is a preceding token and it is not one of `@`, `::`, `(`, `[`, `,` or an operator,
///    then `*` is the multiply operator and a name is an operator name (`or`, `and`, `div`, `mod`).
/// 2. Otherwise, a name followed by `(` is a node type (`comment`, `text`, `processing-instruction`,
///    `node`) or a function name.
/// 3. Otherwise, a name followed by `::` is an axis name.
///
/// Names are lexed as NCNames; qualified names are assembled by the parser from NCNAME COLON NCNAME,
/// so `:` is treated like an operator to keep `foo:div` a single step.
final class XPathLexer {

    private static final Logger LOG = Logger.getLogger(XPathLexer.class.getName());

    static final Set<String> NODE_TYPES = Set.of("comment", "text", "processing-instruction", "node");

    private static final Map<String, Type> OPERATOR_NAMES = Map.of(
            "or", Type.OR_OP,
            "and", Type.AND_OP,
            "div", Type.DIV_OP,
            "mod", Type.MOD_OP);

    private static final Set<Type> OPERATOR_FORCERS = Set.of(
            Type.ABBREV_AXIS_AT, Type.AXIS_SEP, Type.OPEN_PAREN, Type.OPEN_BRACKET, Type.COMMA,
            Type.AND_OP, Type.OR_OP, Type.MOD_OP, Type.DIV_OP, Type.MULT_OP,
            Type.PATH_SEP, Type.ABBREV_PATH_SEP, Type.UNION_OP, Type.PLUS_OP, Type.MINUS_OP,
            Type.EQUAL_OP, Type.REL_OP,
            Type.COLON, Type.DOLLAR);

    private final String expression;
    private int pos;

    private XPathLexer(String expression) {
        this.expression = expression;
        this.pos = 0;
    }

    /// Tokenizes an expression, applying the disambiguation rules. The returned list always ends with END.
    /// @throws XPathSyntaxException on an unrecognized character sequence
    static List<XPathToken> tokenize(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        final var raw = new XPathLexer(expression).scanAll();
        final var tokens = new ArrayList<XPathToken>(raw.size());
        XPathToken last = null;
        for (int i = 0; i < raw.size(); i++) {
            var token = raw.get(i);
            final var next = i + 1 < raw.size() ? raw.get(i + 1) : null;
            token = reclassify(token, last, next);
            tokens.add(token);
            last = token;
        }
        return tokens;
    }

    private static XPathToken reclassify(XPathToken token, XPathToken last, XPathToken next) {
        final boolean operatorContext = last != null && !OPERATOR_FORCERS.contains(last.type());
        if (token.type() == Type.STAR_OP && operatorContext) {
            return token.withType(Type.MULT_OP);
        }
        if (token.type() != Type.NCNAME) {
            return token;
        }
        if (operatorContext) {
            final var operator = OPERATOR_NAMES.get(token.text());
            if (operator != null) {
                LOG.finer(() -> "Name '" + token.text() + "' reclassified as operator " + operator);
                return token.withType(operator);
            }
            return token;
        }
        if (next != null && next.type() == Type.OPEN_PAREN) {
            return token.withType(NODE_TYPES.contains(token.text()) ? Type.NODETYPE : Type.FUNCNAME);
        }
        if (next != null && next.type() == Type.AXIS_SEP) {
            return token.withType(Type.AXISNAME);
        }
        return token;
    }

    private List<XPathToken> scanAll() {
        final var tokens = new ArrayList<XPathToken>();
        while (true) {
            skipWhitespace();
            if (pos >= expression.length()) {
                tokens.add(new XPathToken(Type.END, "", pos));
                return tokens;
            }
            tokens.add(scanToken());
        }
    }

    private XPathToken scanToken() {
        final int start = pos;
        final char c = expression.charAt(pos);

        if (c == '"' || c == '\'') {
            return scanLiteral(c);
        }
        if (isDigit(c) || (c == '.' && isDigitAt(pos + 1))) {
            return scanNumber();
        }
        if (isNameStart(expression.codePointAt(pos))) {
            return scanName();
        }

        return switch (c) {
            case '/' -> lookingAt("//") ? symbol(Type.ABBREV_PATH_SEP, 2) : symbol(Type.PATH_SEP, 1);
            case ':' -> lookingAt("::") ? symbol(Type.AXIS_SEP, 2) : symbol(Type.COLON, 1);
            case '.' -> lookingAt("..") ? symbol(Type.ABBREV_STEP_PARENT, 2) : symbol(Type.ABBREV_STEP_SELF, 1);
            case '@' -> symbol(Type.ABBREV_AXIS_AT, 1);
            case '(' -> symbol(Type.OPEN_PAREN, 1);
            case ')' -> symbol(Type.CLOSE_PAREN, 1);
            case '[' -> symbol(Type.OPEN_BRACKET, 1);
            case ']' -> symbol(Type.CLOSE_BRACKET, 1);
            case '|' -> symbol(Type.UNION_OP, 1);
            case '+' -> symbol(Type.PLUS_OP, 1);
            case '-' -> symbol(Type.MINUS_OP, 1);
            case '*' -> symbol(Type.STAR_OP, 1);
            case ',' -> symbol(Type.COMMA, 1);
            case '$' -> symbol(Type.DOLLAR, 1);
            case '=' -> symbol(Type.EQUAL_OP, 1);
            case '!' -> {
                if (lookingAt("!=")) {
                    yield symbol(Type.EQUAL_OP, 2);
                }
                throw new XPathSyntaxException("Unknown text '" + unknownText(start) + "'", expression, start);
            }
            case '<', '>' -> lookingAt(c + "=") ? symbol(Type.REL_OP, 2) : symbol(Type.REL_OP, 1);
            default -> throw new XPathSyntaxException("Unknown text '" + unknownText(start) + "'", expression, start);
        };
    }

    private XPathToken symbol(Type type, int length) {
        final var token = new XPathToken(type, expression.substring(pos, pos + length), pos);
        pos += length;
        return token;
    }

    private XPathToken scanLiteral(char quote) {
        final int start = pos;
        final int close = expression.indexOf(quote, pos + 1);
        if (close < 0) {
            throw new XPathSyntaxException("Unterminated string literal", expression, start);
        }
        pos = close + 1;
        return new XPathToken(Type.LITERAL, expression.substring(start + 1, close), start);
    }

    private XPathToken scanNumber() {
        final int start = pos;
        while (isDigitAt(pos)) {
            pos++;
        }
        if (pos < expression.length() && expression.charAt(pos) == '.'
                && !(pos + 1 < expression.length() && expression.charAt(pos + 1) == '.')) {
            pos++;
            while (isDigitAt(pos)) {
                pos++;
            }
            return new XPathToken(Type.FLOAT, expression.substring(start, pos), start);
        }
        return new XPathToken(Type.INTEGER, expression.substring(start, pos), start);
    }

    private XPathToken scanName() {
        final int start = pos;
        pos += Character.charCount(expression.codePointAt(pos));
        while (pos < expression.length()) {
            final int cp = expression.codePointAt(pos);
            if (!isNameChar(cp)) {
                break;
            }
            pos += Character.charCount(cp);
        }
        return new XPathToken(Type.NCNAME, expression.substring(start, pos), start);
    }

    private void skipWhitespace() {
        while (pos < expression.length()) {
            final char c = expression.charAt(pos);
            if (c != ' ' && c != '\t' && c != '\r' && c != '\n') {
                return;
            }
            pos++;
        }
    }

    private boolean lookingAt(String text) {
        return expression.startsWith(text, pos);
    }

    private String unknownText(int start) {
        int end = start + 1;
        while (end < expression.length() && !Character.isWhitespace(expression.charAt(end))) {
            end++;
        }
        return expression.substring(start, end);
    }

    private boolean isDigitAt(int index) {
        return index < expression.length() && isDigit(expression.charAt(index));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    /// NameStartChar from https://www.w3.org/TR/REC-xml/#NT-NameStartChar without ':'.
    static boolean isNameStart(int cp) {
        return (cp >= 'A' && cp <= 'Z') || cp == '_' || (cp >= 'a' && cp <= 'z')
                || (cp >= 0xC0 && cp <= 0xD6) || (cp >= 0xD8 && cp <= 0xF6) || (cp >= 0xF8 && cp <= 0x2FF)
                || (cp >= 0x370 && cp <= 0x37D) || (cp >= 0x37F && cp <= 0x1FFF)
                || (cp >= 0x200C && cp <= 0x200D) || (cp >= 0x2070 && cp <= 0x218F)
                || (cp >= 0x2C00 && cp <= 0x2FEF) || (cp >= 0x3001 && cp <= 0xD7FF)
                || (cp >= 0xF900 && cp <= 0xFDCF) || (cp >= 0xFDF0 && cp <= 0xFFFD)
                || (cp >= 0x10000 && cp <= 0xEFFFF);
    }

    /// NameChar from https://www.w3.org/TR/REC-xml/#NT-NameChar without ':'.
    static boolean isNameChar(int cp) {
        return isNameStart(cp) || cp == '-' || cp == '.' || (cp >= '0' && cp <= '9') || cp == 0xB7
                || (cp >= 0x300 && cp <= 0x36F) || (cp >= 0x203F && cp <= 0x2040);
    }
}
