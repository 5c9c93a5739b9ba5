package xml.java17.xmlmap;

import org.w3c.dom.Node;
import xml.java17.xpath.CompiledXPath;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/// A compiled field: where the value lives, how it converts, and whether it is single or list valued.
///
/// Display metadata (`required`, `verboseName`, `helpText`, `choices`) is carried for form layers
/// and does not affect reads or writes. `required` is null when unknown.
public record XmlField<T, V>(
        CompiledXPath path,
        XmlMapper<T> mapper,
        FieldManager<T, V> manager,
        Boolean required,
        String verboseName,
        String helpText,
        List<String> choices,
        long creationCounter) implements FieldDeclaration {

    private static final AtomicLong COUNTER = new AtomicLong();

    public XmlField {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(mapper, "mapper must not be null");
        Objects.requireNonNull(manager, "manager must not be null");
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    /// Compiles the expression and takes the next creation counter.
    /// @throws xml.java17.xpath.XPathSyntaxException if the expression is invalid
    public static <T, V> XmlField<T, V> of(String xpath, XmlMapper<T> mapper, FieldManager<T, V> manager) {
        return new XmlField<>(CompiledXPath.compile(xpath), mapper, manager, null, null, null, List.of(),
                nextCounter());
    }

    static long nextCounter() {
        return COUNTER.getAndIncrement();
    }

    public XmlField<T, V> withRequired(Boolean required) {
        return new XmlField<>(path, mapper, manager, required, verboseName, helpText, choices, creationCounter);
    }

    public XmlField<T, V> withVerboseName(String verboseName) {
        return new XmlField<>(path, mapper, manager, required, verboseName, helpText, choices, creationCounter);
    }

    public XmlField<T, V> withHelpText(String helpText) {
        return new XmlField<>(path, mapper, manager, required, verboseName, helpText, choices, creationCounter);
    }

    public XmlField<T, V> withChoices(List<String> choices) {
        return new XmlField<>(path, mapper, manager, required, verboseName, helpText, choices, creationCounter);
    }

    public V get(Node node, XmlContext context) {
        return manager.get(path, node, context, mapper);
    }

    public void set(Node node, XmlContext context, V value) {
        manager.set(path, node, context, mapper, value);
    }

    /// Sets a value whose type has not been checked by the compiler, as model objects do for
    /// access by field name. List fields take a `List` of the mapper's value type.
    /// @throws ClassCastException before any change if the value does not fit the mapper
    @SuppressWarnings("unchecked")
    public void setUnchecked(Node node, XmlContext context, Object value) {
        requireFits(value);
        manager.set(path, node, context, mapper, (V) value);
    }

    private void requireFits(Object value) {
        if (value == null) {
            return;
        }
        final var type = mapper.valueType();
        if (!isList()) {
            if (!type.isInstance(value)) {
                throw mismatch(value, type.getSimpleName());
            }
            return;
        }
        if (!(value instanceof List<?> values)) {
            throw mismatch(value, "List<" + type.getSimpleName() + ">");
        }
        for (final var item : values) {
            if (item != null && !type.isInstance(item)) {
                throw mismatch(item, type.getSimpleName());
            }
        }
    }

    private ClassCastException mismatch(Object value, String expected) {
        return new ClassCastException("Value " + value + " (" + value.getClass().getName()
                + ") does not fit field " + path.text() + ", expected " + expected);
    }

    public void delete(Node node, XmlContext context) {
        manager.delete(path, node, context, mapper);
    }

    /// Returns the selected node, synthesizing it when missing.
    /// @throws UnsupportedOperationException for list fields
    public Node create(Node node, XmlContext context) {
        if (manager instanceof SingleNodeManager<?> single) {
            return single.create(path, node, context);
        }
        throw new UnsupportedOperationException("Cannot create list field " + path.text());
    }

    public boolean isList() {
        return manager instanceof NodeListManager;
    }
}
