package xml.java17.xmlmap;

import xml.java17.xpath.CompiledXPath;

import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Supplier;

/// Field factories, one per kind of value a model type can bind.
///
/// ```java
/// XmlObjectType book = XmlObjectType.builder("Book")
///     .rootName("book")
///     .field("title", Fields.string("title"))
///     .field("authors", Fields.stringList("author/name", true))
///     .field("year", Fields.integer("@year"))
///     .field("chapters", Fields.selfNodeList("chapter"))
///     .build();
/// ```
///
/// Every factory parses its expression immediately, so a malformed expression fails at declaration.
public final class Fields {

    private Fields() {}

    public static XmlField<String, String> string(String xpath) {
        return string(xpath, false);
    }

    public static XmlField<String, String> string(String xpath, boolean normalize) {
        return XmlField.of(xpath, new XmlMapper.StringMapper(normalize), new SingleNodeManager<>(false));
    }

    public static XmlField<String, List<String>> stringList(String xpath) {
        return stringList(xpath, false);
    }

    public static XmlField<String, List<String>> stringList(String xpath, boolean normalize) {
        return XmlField.of(xpath, new XmlMapper.StringMapper(normalize), new NodeListManager<>());
    }

    public static XmlField<Long, Long> integer(String xpath) {
        return XmlField.of(xpath, new XmlMapper.IntegerMapper(), new SingleNodeManager<>(false));
    }

    public static XmlField<Long, List<Long>> integerList(String xpath) {
        return XmlField.of(xpath, new XmlMapper.IntegerMapper(), new NodeListManager<>());
    }

    /// @param falseToken null when false is represented by the node being absent
    public static XmlField<Boolean, Boolean> simpleBoolean(String xpath, String trueToken, String falseToken) {
        return XmlField.of(xpath, new XmlMapper.SimpleBooleanMapper(trueToken, falseToken),
                new SingleNodeManager<>(false));
    }

    public static XmlField<LocalDateTime, LocalDateTime> dateTime(String xpath) {
        return dateTime(xpath, null, false);
    }

    /// @param format a `DateTimeFormatter` pattern, or null for ISO-8601
    public static XmlField<LocalDateTime, LocalDateTime> dateTime(String xpath, String format, boolean normalize) {
        return XmlField.of(xpath, new XmlMapper.DateTimeMapper(format, normalize), new SingleNodeManager<>(false));
    }

    public static XmlField<LocalDateTime, List<LocalDateTime>> dateTimeList(String xpath, String format,
                                                                            boolean normalize) {
        return XmlField.of(xpath, new XmlMapper.DateTimeMapper(format, normalize), new NodeListManager<>());
    }

    public static XmlField<XmlObject, XmlObject> node(String xpath, XmlObjectType type) {
        return XmlField.of(xpath, XmlMapper.NodeMapper.of(type), new SingleNodeManager<>(false));
    }

    /// Nested type declared later, looked up on first use.
    public static XmlField<XmlObject, XmlObject> node(String xpath, Supplier<XmlObjectType> type) {
        return XmlField.of(xpath, XmlMapper.NodeMapper.deferred(type), new SingleNodeManager<>(false));
    }

    /// Nested object that creates its node when read and it is missing.
    /// @deprecated use [#node(String, XmlObjectType)] with [XmlObject#create(String)]
    @Deprecated
    public static XmlField<XmlObject, XmlObject> node(String xpath, XmlObjectType type, boolean instantiateOnGet) {
        return XmlField.of(xpath, XmlMapper.NodeMapper.of(type), new SingleNodeManager<>(instantiateOnGet));
    }

    /// Nested object of the type being declared.
    public static XmlField<XmlObject, XmlObject> selfNode(String xpath) {
        return XmlField.of(xpath, XmlMapper.NodeMapper.self(), new SingleNodeManager<>(false));
    }

    public static XmlField<XmlObject, List<XmlObject>> nodeList(String xpath, XmlObjectType type) {
        return XmlField.of(xpath, XmlMapper.NodeMapper.of(type), new NodeListManager<>());
    }

    public static XmlField<XmlObject, List<XmlObject>> nodeList(String xpath, Supplier<XmlObjectType> type) {
        return XmlField.of(xpath, XmlMapper.NodeMapper.deferred(type), new NodeListManager<>());
    }

    public static XmlField<XmlObject, List<XmlObject>> selfNodeList(String xpath) {
        return XmlField.of(xpath, XmlMapper.NodeMapper.self(), new NodeListManager<>());
    }

    /// Raw evaluator result, for expressions such as `count(item)` or `name(.)`.
    public static XmlField<Object, Object> item(String xpath) {
        return XmlField.of(xpath, new XmlMapper.ItemMapper(), new SingleNodeManager<>(false));
    }

    /// String field whose choices come from the named simple type in the declaring type's XSD.
    public static SchemaField schema(String xpath, String schemaType) {
        return new SchemaField(CompiledXPath.compile(xpath), schemaType, null, null, null, XmlField.nextCounter());
    }
}
