package xml.java17.xmlmap;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/// Converts between what a field expression selects and the field's Java value.
///
/// `fromXml` receives the first match of the expression: a DOM node, one of the evaluator's
/// scalar results (`Double`, `String`, `Boolean`) or null when nothing matched.
/// `toXml` returns what is written into the selected node, or null to remove it.
///
/// @param <T> the Java value type
public sealed interface XmlMapper<T> permits
        XmlMapper.StringMapper,
        XmlMapper.IntegerMapper,
        XmlMapper.SimpleBooleanMapper,
        XmlMapper.DateTimeMapper,
        XmlMapper.NodeMapper,
        XmlMapper.ItemMapper {

    T fromXml(Object match, XmlContext context);

    Object toXml(T value);

    /// The Java type `fromXml` produces and `toXml` accepts.
    Class<T> valueType();

    /// Text of a match as XPath's `string()` would give it; null for no match.
    static String textOf(Object match) {
        if (match == null) {
            return null;
        }
        if (match instanceof Node node) {
            return node.getTextContent();
        }
        if (match instanceof Double number) {
            if (!number.isInfinite() && number == Math.rint(number) && Math.abs(number) < 1e18) {
                return Long.toString(number.longValue());
            }
            return number.toString();
        }
        return String.valueOf(match);
    }

    private static String normalizeSpace(String text) {
        return text.strip().replaceAll("\\s+", " ");
    }

    /// Text content, optionally with whitespace runs collapsed to a single space and trimmed.
    record StringMapper(boolean normalize) implements XmlMapper<String> {
        @Override
        public Class<String> valueType() {
            return String.class;
        }

        @Override
        public String fromXml(Object match, XmlContext context) {
            final var text = textOf(match);
            return text != null && normalize ? normalizeSpace(text) : text;
        }

        @Override
        public Object toXml(String value) {
            return value;
        }
    }

    /// Whole numbers. Fractions truncate toward zero; text that is not a number maps to null.
    record IntegerMapper() implements XmlMapper<Long> {
        private static final Pattern NUMBER = Pattern.compile("-?(\\d+(\\.\\d*)?|\\.\\d+)");

        @Override
        public Class<Long> valueType() {
            return Long.class;
        }

        @Override
        public Long fromXml(Object match, XmlContext context) {
            if (match instanceof Double number) {
                return number.isNaN() ? null : number.longValue();
            }
            final var text = textOf(match);
            if (text == null) {
                return null;
            }
            final var trimmed = text.strip();
            if (!NUMBER.matcher(trimmed).matches()) {
                return null;
            }
            return (long) Double.parseDouble(trimmed);
        }

        @Override
        public Object toXml(Long value) {
            return value == null ? null : value.toString();
        }
    }

    /// A boolean stored as one of two tokens, e.g. `yes`/`no`.
    ///
    /// With no false token the element's absence means false, and setting false removes it.
    ///
    /// @param trueToken text meaning true
    /// @param falseToken text meaning false, or null when false is represented by absence
    record SimpleBooleanMapper(String trueToken, String falseToken) implements XmlMapper<Boolean> {
        public SimpleBooleanMapper {
            Objects.requireNonNull(trueToken, "trueToken must not be null");
        }

        @Override
        public Class<Boolean> valueType() {
            return Boolean.class;
        }

        @Override
        public Boolean fromXml(Object match, XmlContext context) {
            final var text = textOf(match);
            if (text == null) {
                return falseToken == null ? Boolean.FALSE : null;
            }
            if (text.equals(trueToken)) {
                return Boolean.TRUE;
            }
            if (text.equals(falseToken)) {
                return Boolean.FALSE;
            }
            throw new XmlMappingException("Boolean field value '" + text + "' is neither true token '"
                    + trueToken + "' nor false token '" + falseToken + "'");
        }

        @Override
        public Object toXml(Boolean value) {
            return Boolean.TRUE.equals(value) ? trueToken : falseToken;
        }
    }

    /// Date-times. A trailing `Z` or `+HH:MM`/`-HH:MM` offset is dropped before parsing.
    ///
    /// @param pattern a [DateTimeFormatter] pattern, or null for ISO-8601 local date-time
    ///        with optional fractional seconds
    /// @param normalize collapse whitespace before parsing
    record DateTimeMapper(String pattern, boolean normalize) implements XmlMapper<LocalDateTime> {
        public DateTimeMapper {
            if (pattern != null) {
                DateTimeFormatter.ofPattern(pattern);
            }
        }

        public DateTimeFormatter formatter() {
            return pattern == null ? DateTimeFormatter.ISO_LOCAL_DATE_TIME : DateTimeFormatter.ofPattern(pattern);
        }

        @Override
        public Class<LocalDateTime> valueType() {
            return LocalDateTime.class;
        }

        @Override
        public LocalDateTime fromXml(Object match, XmlContext context) {
            var text = textOf(match);
            if (text == null || text.isBlank()) {
                return null;
            }
            text = normalize ? normalizeSpace(text) : text.strip();
            text = stripZone(text);
            try {
                return LocalDateTime.parse(text, formatter());
            } catch (DateTimeParseException e) {
                throw new XmlMappingException("Cannot parse date-time '" + text + "'", e);
            }
        }

        @Override
        public Object toXml(LocalDateTime value) {
            return value == null ? null : formatter().format(value);
        }

        private static String stripZone(String text) {
            if (text.endsWith("Z")) {
                return text.substring(0, text.length() - 1);
            }
            final int length = text.length();
            if (length > 6) {
                final char sign = text.charAt(length - 6);
                if ((sign == '+' || sign == '-') && text.charAt(length - 3) == ':') {
                    return text.substring(0, length - 6);
                }
            }
            return text;
        }
    }

    /// Nested model objects: the matched element wrapped as an instance of a model type.
    ///
    /// The type may be given directly, supplied later for forward references, or be the
    /// declaring type itself, which is bound when that type is built.
    final class NodeMapper implements XmlMapper<XmlObject> {

        private final Supplier<XmlObjectType> deferred;
        private final boolean self;
        private volatile XmlObjectType type;

        private NodeMapper(XmlObjectType type, Supplier<XmlObjectType> deferred, boolean self) {
            this.type = type;
            this.deferred = deferred;
            this.self = self;
        }

        public static NodeMapper of(XmlObjectType type) {
            return new NodeMapper(Objects.requireNonNull(type, "type must not be null"), null, false);
        }

        public static NodeMapper deferred(Supplier<XmlObjectType> supplier) {
            return new NodeMapper(null, Objects.requireNonNull(supplier, "supplier must not be null"), false);
        }

        public static NodeMapper self() {
            return new NodeMapper(null, null, true);
        }

        public boolean isSelfReference() {
            return self;
        }

        public boolean isBound() {
            return type != null;
        }

        @Override
        public Class<XmlObject> valueType() {
            return XmlObject.class;
        }

        /// Binds a self reference to its declaring type; allowed once.
        synchronized void bind(XmlObjectType declaringType) {
            Objects.requireNonNull(declaringType, "declaringType must not be null");
            if (!self) {
                throw new IllegalStateException("Only self references are bound to their declaring type");
            }
            if (type != null) {
                throw new IllegalStateException("Self reference already bound to " + type.name());
            }
            type = declaringType;
        }

        public XmlObjectType type() {
            var resolved = type;
            if (resolved == null && deferred != null) {
                resolved = deferred.get();
                if (resolved != null) {
                    type = resolved;
                }
            }
            if (resolved == null) {
                throw new IllegalStateException("Nested type is not resolved yet");
            }
            return resolved;
        }

        @Override
        public XmlObject fromXml(Object match, XmlContext context) {
            if (match == null) {
                return null;
            }
            if (match instanceof Element element) {
                return type().wrap(element, context);
            }
            throw new XmlMappingException("Nested object field matched a non-element: " + textOf(match));
        }

        @Override
        public Object toXml(XmlObject value) {
            return value == null ? null : value.node();
        }

        @Override
        public String toString() {
            if (type != null) {
                return "NodeMapper[" + type.name() + "]";
            }
            return self ? "NodeMapper[self]" : "NodeMapper[deferred]";
        }
    }

    /// The evaluator's result as it is, for expressions such as `count(item)`.
    record ItemMapper() implements XmlMapper<Object> {
        @Override
        public Class<Object> valueType() {
            return Object.class;
        }

        @Override
        public Object fromXml(Object match, XmlContext context) {
            return match;
        }

        @Override
        public Object toXml(Object value) {
            if (value == null || value instanceof Node) {
                return value;
            }
            return String.valueOf(value);
        }
    }
}
