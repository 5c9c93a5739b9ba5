package xml.java17.xpath;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

/// Property-based testing of the parse, serialize, re-parse cycle.
/// Generates syntactically valid expressions from a small grammar and checks that
/// the serialized form of the parsed AST parses back to an equal AST.
class XPathRoundTripPropertyTest extends XPathLoggingConfig {

    private static final Logger LOG = Logger.getLogger(XPathRoundTripPropertyTest.class.getName());

    private static final int MAX_DEPTH = 3;
    private static final List<String> NAMES = List.of("a", "b", "foo", "mods:title", "bar-baz", "x1", "café", "or");
    private static final List<String> FUNCTIONS = List.of("f", "count", "fn:upper", "concat");
    private static final List<String> LITERALS = List.of("'x'", "\"y\"", "\"it's\"", "'say \"hi\"'", "''");
    private static final List<String> NUMBERS = List.of("0", "7", "42", "1.5", "0.25", ".5", "2.0");
    private static final List<String> BINARY_OPERATORS = List.of(
            " or ", " and ", " = ", " != ", " < ", " <= ", " > ", " >= ", " + ", " - ", " * ", " div ", " mod ");
    private static final List<String> SEPARATORS = List.of("/", "//");

    @Provide
    Arbitrary<String> expressions() {
        return expr(MAX_DEPTH);
    }

    @Property(tries = 500)
    void serializedAstReparsesToEqualAst(@ForAll("expressions") String expression) {
        LOG.fine(() -> "Round trip of: " + expression);
        final var ast = XPathParser.parse(expression);
        final var text = XPathSerializer.serialize(ast);
        assertThat(XPathParser.parse(text))
                .as("re-parse of '%s' serialized as '%s'", expression, text)
                .isEqualTo(ast);
    }

    @Property(tries = 200)
    void serializationIsAFixedPoint(@ForAll("expressions") String expression) {
        final var once = XPathSerializer.serialize(XPathParser.parse(expression));
        final var twice = XPathSerializer.serialize(XPathParser.parse(once));
        assertThat(twice).isEqualTo(once);
    }

    private Arbitrary<String> expr(int depth) {
        if (depth == 0) {
            return Arbitraries.oneOf(locationPath(0), literal(), number(), variable());
        }
        final var binary = Combinators.combine(expr(depth - 1), Arbitraries.of(BINARY_OPERATORS), expr(depth - 1))
                .as((left, op, right) -> left + op + right);
        final var union = Combinators.combine(locationPath(depth - 1), locationPath(depth - 1))
                .as((left, right) -> left + " | " + right);
        final var unary = expr(depth - 1).map(operand -> "-" + operand);
        final var path = locationPath(depth - 1);
        return Arbitraries.oneOf(path, path, binary, binary, union, unary, filter(depth - 1));
    }

    private Arbitrary<String> filter(int depth) {
        final var function = Combinators.combine(Arbitraries.of(FUNCTIONS), expr(depth).list().ofMaxSize(2))
                .as((name, args) -> name + "(" + String.join(", ", args) + ")");
        final var parenthesized = expr(depth).map(inner -> "(" + inner + ")");
        final var primary = Arbitraries.oneOf(function, parenthesized, variable(), literal());
        final var predicated = Combinators.combine(primary, expr(depth))
                .as((base, predicate) -> base + "[" + predicate + "]");
        final var followedByPath = Combinators.combine(primary, Arbitraries.of(SEPARATORS), relativePath(depth))
                .as((base, separator, path) -> base + separator + path);
        return Arbitraries.oneOf(primary, predicated, followedByPath);
    }

    private Arbitrary<String> locationPath(int depth) {
        final var absolute = Combinators.combine(Arbitraries.of(SEPARATORS), relativePath(depth))
                .as((separator, path) -> separator + path);
        return Arbitraries.oneOf(relativePath(depth), absolute);
    }

    private Arbitrary<String> relativePath(int depth) {
        return Combinators.combine(step(depth), Arbitraries.of(SEPARATORS).list().ofMaxSize(2), step(depth).list().ofSize(2))
                .as((first, separators, rest) -> {
                    final var sb = new StringBuilder(first);
                    for (int i = 0; i < separators.size(); i++) {
                        sb.append(separators.get(i)).append(rest.get(i));
                    }
                    return sb.toString();
                });
    }

    private Arbitrary<String> step(int depth) {
        final var nodeTest = Arbitraries.oneOf(
                Arbitraries.of(NAMES),
                Arbitraries.of("*", "mods:*", "text()", "node()", "comment()"));
        final var axis = Arbitraries.of("", "@", "child::", "attribute::", "parent::", "descendant-or-self::");
        final var plain = Combinators.combine(axis, nodeTest).as((a, t) -> a + t);
        final var abbreviated = Arbitraries.of(".", "..");
        if (depth == 0) {
            return Arbitraries.oneOf(plain, abbreviated);
        }
        final var predicated = Combinators.combine(plain, expr(depth - 1))
                .as((s, predicate) -> s + "[" + predicate + "]");
        return Arbitraries.oneOf(plain, abbreviated, predicated);
    }

    private Arbitrary<String> literal() {
        return Arbitraries.of(LITERALS);
    }

    private Arbitrary<String> number() {
        return Arbitraries.of(NUMBERS);
    }

    private Arbitrary<String> variable() {
        return Arbitraries.of("$v", "$ns:v", "$div");
    }
}
