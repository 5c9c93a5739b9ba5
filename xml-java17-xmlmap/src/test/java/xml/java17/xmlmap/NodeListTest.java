package xml.java17.xmlmap;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeListTest extends XmlMapTestBase {

    private static final XmlContext CTX = XmlContext.EMPTY;

    private static final String TWO_BAZ = "<root><bar><baz>42</baz><baz>13</baz></bar></root>";

    @Test
    void listViewReadsAllMatches() {
        final var root = root(TWO_BAZ);
        final var list = Fields.stringList("bar/baz").get(root, CTX);
        assertThat(list).containsExactly("42", "13");
        assertThat(list.indexOf("13")).isEqualTo(1);
        assertThat(list.contains("42")).isTrue();
    }

    @Test
    void assigningLongerListAppends() {
        final var root = root(TWO_BAZ);
        final var field = Fields.stringList("bar/baz");
        field.set(root, CTX, List.of("1", "2", "3"));
        assertThat(xml(root)).isEqualTo("<root><bar><baz>1</baz><baz>2</baz><baz>3</baz></bar></root>");
        assertThat(field.get(root, CTX)).containsExactly("1", "2", "3");
    }

    @Test
    void assigningShorterListTruncates() {
        final var root = root(TWO_BAZ);
        final var field = Fields.stringList("bar/baz");
        field.set(root, CTX, List.of("1"));
        assertThat(xml(root)).isEqualTo("<root><bar><baz>1</baz></bar></root>");
    }

    @Test
    void overlappingPrefixKeepsNodes() {
        final var root = root("<root><bar><baz id=\"a\">42</baz><baz id=\"b\">13</baz></bar></root>");
        Fields.stringList("bar/baz").set(root, CTX, List.of("42", "7"));
        assertThat(xml(root)).isEqualTo("<root><bar><baz id=\"a\">42</baz><baz id=\"b\">7</baz></bar></root>");
    }

    @Test
    void insertPlacesNodeAtIndex() {
        final var root = root(TWO_BAZ);
        final var list = Fields.stringList("bar/baz").get(root, CTX);
        list.add(1, "x");
        assertThat(xml(root)).isEqualTo("<root><bar><baz>42</baz><baz>x</baz><baz>13</baz></bar></root>");
        list.add(0, "first");
        assertThat(list).containsExactly("first", "42", "x", "13");
    }

    @Test
    void appendOnEmptyListSynthesizesPath() {
        final var root = root("<root/>");
        final var list = Fields.stringList("bar/baz").get(root, CTX);
        assertThat(list).isEmpty();
        list.add("a");
        list.add("b");
        assertThat(xml(root)).isEqualTo("<root><bar><baz>a</baz><baz>b</baz></bar></root>");
    }

    @Test
    void appendKeepsNewNodeNextToLastMatch() {
        final var root = root("<root><baz>1</baz><other/></root>");
        final var list = Fields.stringList("baz").get(root, CTX);
        list.add("2");
        assertThat(xml(root)).isEqualTo("<root><baz>1</baz><baz>2</baz><other/></root>");
    }

    @Test
    void removeAndPop() {
        final var root = root("<root><v>1</v><v>2</v><v>3</v></root>");
        final var list = Fields.stringList("v").get(root, CTX);
        assertThat(list.remove(0)).isEqualTo("1");
        assertThat(((NodeList<String>) list).pop()).isEqualTo("3");
        assertThat(list).containsExactly("2");
        assertThat(list.remove("2")).isTrue();
        assertThat(xml(root)).isEqualTo("<root/>");
        assertThatThrownBy(((NodeList<String>) list)::pop).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void countCountsEqualValues() {
        final var root = root("<root><v>a</v><v>b</v><v>a</v></root>");
        final var list = (NodeList<String>) Fields.stringList("v").get(root, CTX);
        assertThat(list.count("a")).isEqualTo(2);
        assertThat(list.count("z")).isZero();
    }

    @Test
    void setReplacesValueAndReturnsPrevious() {
        final var root = root(TWO_BAZ);
        final var list = Fields.stringList("bar/baz").get(root, CTX);
        assertThat(list.set(0, "x")).isEqualTo("42");
        assertThat(list).containsExactly("x", "13");
    }

    @Test
    void outOfRangeAndNullAreRejected() {
        final var root = root(TWO_BAZ);
        final var list = Fields.stringList("bar/baz").get(root, CTX);
        assertThatThrownBy(() -> list.get(2)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> list.set(5, "x")).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> list.add(3, "x")).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> list.add(null)).isInstanceOf(NullPointerException.class);
        assertThat(list).hasSize(2);
    }

    @Test
    void rangeViewsAndSortingAreUnsupported() {
        final var root = root(TWO_BAZ);
        final var list = Fields.stringList("bar/baz").get(root, CTX);
        assertThatThrownBy(() -> list.subList(0, 1)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> Collections.sort(list)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void deleteRemovesEveryMatch() {
        final var root = root(TWO_BAZ);
        Fields.stringList("bar/baz").delete(root, CTX);
        assertThat(xml(root)).isEqualTo("<root><bar/></root>");
    }

    @Test
    void clearUsesRemove() {
        final var root = root(TWO_BAZ);
        Fields.stringList("bar/baz").get(root, CTX).clear();
        assertThat(xml(root)).isEqualTo("<root><bar/></root>");
    }

    @Test
    void attributeListRemovesAttributes() {
        final var root = root("<root><i id=\"1\"/><i id=\"2\"/></root>");
        final var ids = Fields.integerList("i/@id").get(root, CTX);
        assertThat(ids).containsExactly(1L, 2L);
        ids.remove(0);
        assertThat(xml(root)).isEqualTo("<root><i/><i id=\"2\"/></root>");
    }

    @Test
    void attributeListAppendCreatesNewHolder() {
        final var root = root("<root><i id=\"1\"/></root>");
        final var ids = Fields.integerList("i/@id").get(root, CTX);
        ids.add(2L);
        ids.add(0, 0L);
        assertThat(xml(root)).isEqualTo("<root><i id=\"0\"/><i id=\"1\"/><i id=\"2\"/></root>");
    }

    @Test
    void textListAppendCreatesNewHolder() {
        final var root = root("<root><p>a</p></root>");
        final var texts = Fields.stringList("p/text()").get(root, CTX);
        texts.add("b");
        assertThat(xml(root)).isEqualTo("<root><p>a</p><p>b</p></root>");
    }

    @Test
    void secondBareAttributeCannotBeAdded() {
        final var root = root("<root id=\"1\"/>");
        final var ids = Fields.stringList("@id").get(root, CTX);
        assertThatThrownBy(() -> ids.add("2")).isInstanceOf(XmlConstructionException.class);
        assertThat(xml(root)).isEqualTo("<root id=\"1\"/>");
    }

    @Test
    void nodeListWrapsNestedObjects() {
        final var item = XmlObjectType.builder("Item").field("name", Fields.string("@name")).build();
        final var root = root("<root><item name=\"a\"/><item name=\"b\"/></root>");
        final var items = Fields.nodeList("item", item).get(root, CTX);
        assertThat(items).hasSize(2);
        assertThat(items.get(1).<String>get("name")).isEqualTo("b");

        final var other = root("<item name=\"c\"/>");
        items.set(0, item.wrap(other));
        assertThat(xml(root)).isEqualTo("<root><item name=\"c\"/><item name=\"b\"/></root>");
    }

    @Test
    void appendToNonConstructibleListFails() {
        final var root = root("<root><x><baz>1</baz></x></root>");
        final var wildcard = Fields.stringList("*/baz").get(root, CTX);
        assertThatThrownBy(() -> wildcard.add("2"))
                .isInstanceOf(XmlConstructionException.class)
                .hasMessageContaining("not constructible");
        final var descendants = Fields.stringList("//baz").get(root, CTX);
        assertThatThrownBy(() -> descendants.add(0, "0")).isInstanceOf(XmlConstructionException.class);
        assertThat(xml(root)).isEqualTo("<root><x><baz>1</baz></x></root>");
    }

    @Test
    void assigningLongerValueToNonConstructibleListFailsBeforeAnyChange() {
        final var root = root("<root><x><baz>1</baz></x></root>");
        final var field = Fields.stringList("*/baz");
        assertThatThrownBy(() -> field.set(root, CTX, List.of("a", "b")))
                .isInstanceOf(XmlConstructionException.class);
        assertThat(xml(root)).isEqualTo("<root><x><baz>1</baz></x></root>");

        field.set(root, CTX, List.of("z"));
        assertThat(field.get(root, CTX)).containsExactly("z");
    }
}
