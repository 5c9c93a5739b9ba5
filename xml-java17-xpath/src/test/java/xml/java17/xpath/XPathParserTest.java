package xml.java17.xpath;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.logging.Logger;

import xml.java17.xpath.XPathAst.AbbreviatedStep;
import xml.java17.xpath.XPathAst.AbsolutePath;
import xml.java17.xpath.XPathAst.BinaryExpression;
import xml.java17.xpath.XPathAst.FloatLiteral;
import xml.java17.xpath.XPathAst.FunctionCall;
import xml.java17.xpath.XPathAst.IntegerLiteral;
import xml.java17.xpath.XPathAst.NameTest;
import xml.java17.xpath.XPathAst.NodeType;
import xml.java17.xpath.XPathAst.Operator;
import xml.java17.xpath.XPathAst.PredicatedExpression;
import xml.java17.xpath.XPathAst.Step;
import xml.java17.xpath.XPathAst.StringLiteral;
import xml.java17.xpath.XPathAst.UnaryExpression;
import xml.java17.xpath.XPathAst.VariableReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for XPathParser - tests parsing of XPath strings to AST
class XPathParserTest extends XPathLoggingConfig {

    private static final Logger LOG = Logger.getLogger(XPathParserTest.class.getName());

    private static Step step(String name) {
        return new Step(null, new NameTest(null, name), List.of());
    }

    private static Step step(String name, XPathAst... predicates) {
        return new Step(null, new NameTest(null, name), List.of(predicates));
    }

    private static Step attribute(String name) {
        return new Step(Step.ABBREVIATED_ATTRIBUTE, new NameTest(null, name), List.of());
    }

    private static BinaryExpression path(XPathAst left, XPathAst right) {
        return new BinaryExpression(left, Operator.PATH, right);
    }

    // ========== Location paths ==========

    @Test
    void testParseSingleStep() {
        LOG.info(() -> "TEST: testParseSingleStep - foo");
        assertThat(XPathParser.parse("foo")).isEqualTo(step("foo"));
    }

    @Test
    void testRelativePathIsLeftNested() {
        LOG.info(() -> "TEST: testRelativePathIsLeftNested - a/b//c");
        assertThat(XPathParser.parse("a/b//c")).isEqualTo(
                new BinaryExpression(path(step("a"), step("b")), Operator.DESCENDANT_PATH, step("c")));
    }

    @Test
    void testAbsolutePaths() {
        LOG.info(() -> "TEST: testAbsolutePaths - /, /a/b, //a");
        assertThat(XPathParser.parse("/")).isEqualTo(new AbsolutePath(Operator.PATH, null));
        assertThat(XPathParser.parse("/a/b")).isEqualTo(new AbsolutePath(Operator.PATH, path(step("a"), step("b"))));
        assertThat(XPathParser.parse("//a")).isEqualTo(new AbsolutePath(Operator.DESCENDANT_PATH, step("a")));
    }

    @Test
    void testAttributeAndAxisSteps() {
        LOG.info(() -> "TEST: testAttributeAndAxisSteps");
        assertThat(XPathParser.parse("@type")).isEqualTo(attribute("type"));
        assertThat(XPathParser.parse("attribute::type"))
                .isEqualTo(new Step("attribute", new NameTest(null, "type"), List.of()));
        final var parent = (Step) XPathParser.parse("parent::mods:name[5]");
        assertThat(parent.axis()).isEqualTo("parent");
        assertThat(parent.nodeTest()).isEqualTo(new NameTest("mods", "name"));
        assertThat(parent.predicates()).containsExactly(new IntegerLiteral(5));
    }

    @Test
    void testNodeTests() {
        LOG.info(() -> "TEST: testNodeTests - wildcards and node types");
        assertThat(XPathParser.parse("*")).isEqualTo(step("*"));
        assertThat(((Step) XPathParser.parse("mods:*")).nodeTest()).isEqualTo(new NameTest("mods", "*"));
        assertThat(((Step) XPathParser.parse("text()")).nodeTest()).isEqualTo(new NodeType("text", null));
        assertThat(((Step) XPathParser.parse("processing-instruction('pi')")).nodeTest())
                .isEqualTo(new NodeType("processing-instruction", "pi"));
        assertThat(((Step) XPathParser.parse("text()")).isTextTest()).isTrue();
    }

    @Test
    void testAbbreviatedSteps() {
        LOG.info(() -> "TEST: testAbbreviatedSteps - ../.");
        assertThat(XPathParser.parse("../.")).isEqualTo(
                path(new AbbreviatedStep(AbbreviatedStep.PARENT), new AbbreviatedStep(AbbreviatedStep.SELF)));
    }

    @Test
    void testEqualityPredicate() {
        LOG.info(() -> "TEST: testEqualityPredicate - pred[@a=\"foo\"]");
        assertThat(XPathParser.parse("pred[@a=\"foo\"]")).isEqualTo(
                step("pred", new BinaryExpression(attribute("a"), Operator.EQUAL, new StringLiteral("foo"))));
    }

    @Test
    void testMultiplePredicates() {
        LOG.info(() -> "TEST: testMultiplePredicates - a[b][2]");
        assertThat(XPathParser.parse("a[b][2]")).isEqualTo(step("a", step("b"), new IntegerLiteral(2)));
    }

    // ========== Operators ==========

    @Test
    void testPrecedenceOrAnd() {
        LOG.info(() -> "TEST: testPrecedenceOrAnd - a or b and c");
        assertThat(XPathParser.parse("a or b and c")).isEqualTo(
                new BinaryExpression(step("a"), Operator.OR,
                        new BinaryExpression(step("b"), Operator.AND, step("c"))));
    }

    @Test
    void testPrecedenceArithmetic() {
        LOG.info(() -> "TEST: testPrecedenceArithmetic - 1 + 2 * 3 = 7");
        assertThat(XPathParser.parse("1 + 2 * 3 = 7")).isEqualTo(
                new BinaryExpression(
                        new BinaryExpression(new IntegerLiteral(1), Operator.PLUS,
                                new BinaryExpression(new IntegerLiteral(2), Operator.MULTIPLY, new IntegerLiteral(3))),
                        Operator.EQUAL,
                        new IntegerLiteral(7)));
    }

    @Test
    void testLeftAssociativity() {
        LOG.info(() -> "TEST: testLeftAssociativity - 8 - 4 - 2");
        assertThat(XPathParser.parse("8 - 4 - 2")).isEqualTo(
                new BinaryExpression(
                        new BinaryExpression(new IntegerLiteral(8), Operator.MINUS, new IntegerLiteral(4)),
                        Operator.MINUS,
                        new IntegerLiteral(2)));
    }

    @Test
    void testRelationalAndNotEqual() {
        LOG.info(() -> "TEST: testRelationalAndNotEqual");
        assertThat(((BinaryExpression) XPathParser.parse("a <= 3")).op()).isEqualTo(Operator.LESS_OR_EQUAL);
        assertThat(((BinaryExpression) XPathParser.parse("a != 3")).op()).isEqualTo(Operator.NOT_EQUAL);
        assertThat(((BinaryExpression) XPathParser.parse("a div b")).op()).isEqualTo(Operator.DIV);
        assertThat(((BinaryExpression) XPathParser.parse("a mod b")).op()).isEqualTo(Operator.MOD);
    }

    @Test
    void testUnaryBindsLooserThanUnion() {
        LOG.info(() -> "TEST: testUnaryBindsLooserThanUnion - -a | b");
        assertThat(XPathParser.parse("-a | b")).isEqualTo(
                new UnaryExpression(Operator.MINUS, new BinaryExpression(step("a"), Operator.UNION, step("b"))));
        assertThat(XPathParser.parse("--1")).isEqualTo(
                new UnaryExpression(Operator.MINUS, new UnaryExpression(Operator.MINUS, new IntegerLiteral(1))));
    }

    @Test
    void testUnionOfPaths() {
        LOG.info(() -> "TEST: testUnionOfPaths - a/b | c");
        assertThat(XPathParser.parse("a/b | c")).isEqualTo(
                new BinaryExpression(path(step("a"), step("b")), Operator.UNION, step("c")));
    }

    // ========== Filter expressions ==========

    @Test
    void testFunctionCalls() {
        LOG.info(() -> "TEST: testFunctionCalls - count(a, 'x', 2.5) and fn:upper()");
        assertThat(XPathParser.parse("count(a, 'x', 2.5)")).isEqualTo(
                new FunctionCall(null, "count", List.of(step("a"), new StringLiteral("x"), new FloatLiteral(2.5))));
        assertThat(XPathParser.parse("fn:upper()")).isEqualTo(new FunctionCall("fn", "upper", List.of()));
    }

    @Test
    void testVariableReferences() {
        LOG.info(() -> "TEST: testVariableReferences - $x and $ns:y");
        assertThat(XPathParser.parse("$x")).isEqualTo(new VariableReference(null, "x"));
        assertThat(XPathParser.parse("$ns:y")).isEqualTo(new VariableReference("ns", "y"));
    }

    @Test
    void testParenthesesWithoutPredicatesAreTransparent() {
        LOG.info(() -> "TEST: testParenthesesWithoutPredicatesAreTransparent - (a)");
        assertThat(XPathParser.parse("(a)")).isEqualTo(step("a"));
    }

    @Test
    void testPredicatedExpression() {
        LOG.info(() -> "TEST: testPredicatedExpression - (a | b)[1]");
        assertThat(XPathParser.parse("(a | b)[1]")).isEqualTo(new PredicatedExpression(
                new BinaryExpression(step("a"), Operator.UNION, step("b")), List.of(new IntegerLiteral(1))));
        assertThat(XPathParser.parse("$x[2]")).isEqualTo(
                new PredicatedExpression(new VariableReference(null, "x"), List.of(new IntegerLiteral(2))));
    }

    @Test
    void testFilterFollowedByPath() {
        LOG.info(() -> "TEST: testFilterFollowedByPath - $x/a/@b");
        assertThat(XPathParser.parse("$x/a/@b")).isEqualTo(
                path(path(new VariableReference(null, "x"), step("a")), attribute("b")));
    }

    @Test
    void testPositionPredicate() {
        LOG.info(() -> "TEST: testPositionPredicate - bar[position()=2]");
        assertThat(XPathParser.parse("bar[position()=2]")).isEqualTo(step("bar",
                new BinaryExpression(new FunctionCall(null, "position", List.of()), Operator.EQUAL,
                        new IntegerLiteral(2))));
    }

    @Test
    void testOperatorKeywordsAsNames() {
        LOG.info(() -> "TEST: testOperatorKeywordsAsNames - or/and[div]");
        assertThat(XPathParser.parse("or/and[div]")).isEqualTo(path(step("or"), step("and", step("div"))));
    }

    // ========== Errors ==========

    @ParameterizedTest
    @ValueSource(strings = {"", "a/", "a[", "a[b", "a b", "@", "(a", "count(a,", "a | | b", "$", "child::", "//"})
    void testMalformedExpressions(String expression) {
        LOG.info(() -> "TEST: testMalformedExpressions - '" + expression + "'");
        assertThatThrownBy(() -> XPathParser.parse(expression)).isInstanceOf(XPathSyntaxException.class);
    }

    @Test
    void testUnexpectedTokenMessage() {
        LOG.info(() -> "TEST: testUnexpectedTokenMessage - a ]");
        assertThatThrownBy(() -> XPathParser.parse("a ]"))
                .isInstanceOf(XPathSyntaxException.class)
                .hasMessageContaining("Unexpected token ']'")
                .hasMessageContaining("position 2");
    }

    @Test
    void testUnexpectedEndMessage() {
        LOG.info(() -> "TEST: testUnexpectedEndMessage - a/");
        assertThatThrownBy(() -> XPathParser.parse("a/"))
                .isInstanceOf(XPathSyntaxException.class)
                .hasMessageContaining("Unexpected end of expression");
    }

    @Test
    void testIntegerOverflow() {
        LOG.info(() -> "TEST: testIntegerOverflow");
        assertThatThrownBy(() -> XPathParser.parse("a[99999999999999999999]"))
                .isInstanceOf(XPathSyntaxException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    void testNullExpression() {
        LOG.info(() -> "TEST: testNullExpression");
        assertThatThrownBy(() -> XPathParser.parse(null)).isInstanceOf(NullPointerException.class);
    }
}
