package xml.java17.xpath;

/// Exception thrown when an XPath expression cannot be lexed or parsed.
/// This is a runtime exception as a malformed field expression is a programming error,
/// surfaced when the expression is compiled rather than when it is first used.
public class XPathSyntaxException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int position;
    private final String expression;

    /// Creates a new syntax exception with the given message.
    public XPathSyntaxException(String message) {
        super(message);
        this.position = -1;
        this.expression = null;
    }

    /// Creates a new syntax exception with position information.
    public XPathSyntaxException(String message, String expression, int position) {
        super(formatMessage(message, expression, position));
        this.position = position;
        this.expression = expression;
    }

    /// Returns the position in the expression where the error occurred, or -1 if unknown.
    public int position() {
        return position;
    }

    /// Returns the expression that was being parsed, or null if unknown.
    public String expression() {
        return expression;
    }

    private static String formatMessage(String message, String expression, int position) {
        if (expression == null || position < 0) {
            return message;
        }
        final var sb = new StringBuilder();
        sb.append(message);
        sb.append(" at position ").append(position);
        sb.append(" in expression: ").append(expression);
        if (position < expression.length()) {
            sb.append(" (near '").append(expression.charAt(position)).append("')");
        }
        return sb.toString();
    }
}
