package xml.java17.xpath;

import java.util.Objects;
import java.util.logging.Logger;

/// An XPath expression paired with its parsed AST.
///
/// Compile once when a field is declared, then reuse for every read and write:
/// ```java
/// CompiledXPath path = CompiledXPath.compile("bar[@type=\"x\"]/baz");
/// XPathAst ast = path.ast();
/// String text = path.text(); // handed to the host evaluator for reads
/// ```
///
/// @param text the expression as written, used for evaluation
/// @param ast the parsed expression, used for construction and removal
public record CompiledXPath(String text, XPathAst ast) {

    private static final Logger LOG = Logger.getLogger(CompiledXPath.class.getName());

    public CompiledXPath {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(ast, "ast must not be null");
    }

    /// Parses an expression eagerly.
    /// @throws XPathSyntaxException if the expression is invalid
    public static CompiledXPath compile(String text) {
        Objects.requireNonNull(text, "text must not be null");
        final var ast = XPathParser.parse(text);
        LOG.fine(() -> "Compiled XPath: " + text);
        return new CompiledXPath(text, ast);
    }

    /// Returns the canonical text regenerated from the AST.
    public String canonical() {
        return XPathSerializer.serialize(ast);
    }

    @Override
    public String toString() {
        return text;
    }
}
