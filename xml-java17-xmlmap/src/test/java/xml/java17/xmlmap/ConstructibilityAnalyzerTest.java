package xml.java17.xmlmap;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import xml.java17.xpath.CompiledXPath;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConstructibilityAnalyzerTest extends XmlMapTestBase {

    @ParameterizedTest
    @ValueSource(strings = {
            "bar",
            "foo:bar",
            "child::bar",
            "@type",
            "attribute::type",
            "text()",
            "bar/baz",
            "bar[1]/baz",
            "pred[@a=\"foo\"]",
            "a[b]",
            "a[b/c]",
            "a[@id=$v]",
            "a[b=1]",
            "a/text()",
            "a[text()='x']",
            "a[b[@c='d']]/e/@f"
    })
    void constructibleExpressions(String xpath) {
        assertThat(ConstructibilityAnalyzer.isConstructible(CompiledXPath.compile(xpath).ast())).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "*",
            "foo:*",
            ".",
            "..",
            "/a",
            "//a",
            "a//b",
            "a|b",
            "ancestor::a",
            "node()",
            "count(a)",
            "$v",
            "bar[position()=2]",
            "a[@x>1]",
            "a[b!='x']",
            "a[0]",
            "@x[y]",
            "a[@*='x']",
            "a[b='x' or c='y']",
            "a[b=c]",
            "a[@b=concat('x', 'y')]",
            "@a/b",
            "a/@b/c",
            "text()/a",
            "a[@b/c]"
    })
    void nonConstructibleExpressions(String xpath) {
        assertThat(ConstructibilityAnalyzer.isConstructible(CompiledXPath.compile(xpath).ast())).isFalse();
    }

    @Test
    void positionalPredicateIsConstructibleOnlyWhenPositive() {
        assertThat(ConstructibilityAnalyzer.isConstructiblePredicate(CompiledXPath.compile("3").ast())).isTrue();
        assertThat(ConstructibilityAnalyzer.isConstructiblePredicate(CompiledXPath.compile("0").ast())).isFalse();
    }

    @Test
    void requireConstructibleRejectsUnboundPrefix() {
        final var ast = CompiledXPath.compile("x:item").ast();
        assertThatThrownBy(() -> ConstructibilityAnalyzer.requireConstructible(ast, XmlContext.EMPTY))
                .isInstanceOf(XmlConstructionException.class)
                .hasMessageContaining("prefix 'x'");
        ConstructibilityAnalyzer.requireConstructible(ast, XmlContext.of(Map.of("x", "urn:x")));
    }

    @Test
    void requireConstructibleRejectsUnboundVariable() {
        final var ast = CompiledXPath.compile("a[@id=$v]").ast();
        assertThatThrownBy(() -> ConstructibilityAnalyzer.requireConstructible(ast, XmlContext.EMPTY))
                .isInstanceOf(XmlConstructionException.class)
                .hasMessageContaining("$v");
        ConstructibilityAnalyzer.requireConstructible(ast, XmlContext.EMPTY.withVariable("v", 7));
    }

    @Test
    void requireConstructibleNamesTheExpression() {
        final var ast = CompiledXPath.compile("a|b").ast();
        assertThatThrownBy(() -> ConstructibilityAnalyzer.requireConstructible(ast, XmlContext.EMPTY))
                .isInstanceOf(XmlConstructionException.class)
                .hasMessageContaining("a|b");
    }
}
