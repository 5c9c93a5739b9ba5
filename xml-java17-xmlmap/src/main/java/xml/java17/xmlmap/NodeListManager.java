package xml.java17.xmlmap;

import org.w3c.dom.Node;
import xml.java17.xpath.CompiledXPath;

import java.util.List;
import java.util.logging.Logger;

/// Manages a field holding every node the expression selects, as a live [NodeList].
public record NodeListManager<T>() implements FieldManager<T, List<T>> {

    private static final Logger LOG = Logger.getLogger(NodeListManager.class.getName());

    @Override
    public List<T> get(CompiledXPath path, Node node, XmlContext context, XmlMapper<T> mapper) {
        return new NodeList<>(path, node, context, mapper);
    }

    /// Overwrites matches position by position, then appends or drops trailing matches to reach
    /// the new length. Null clears the list.
    /// @throws XmlConstructionException before any change when appending is needed but the
    ///         expression is not constructible
    @Override
    public void set(CompiledXPath path, Node node, XmlContext context, XmlMapper<T> mapper, List<T> value) {
        if (value == null) {
            delete(path, node, context, mapper);
            return;
        }
        LOG.fine(() -> "Set " + path.text() + " to " + value.size() + " item(s)");
        final var list = new NodeList<>(path, node, context, mapper);
        if (value.size() > list.size()) {
            ConstructibilityAnalyzer.requireConstructible(path.ast(), context);
        }
        for (int i = 0; i < value.size(); i++) {
            list.assign(i, value.get(i));
        }
        while (list.size() > value.size()) {
            list.pop();
        }
    }

    @Override
    public void delete(CompiledXPath path, Node node, XmlContext context, XmlMapper<T> mapper) {
        LOG.fine(() -> "Delete all " + path.text());
        final var list = new NodeList<>(path, node, context, mapper);
        while (!list.isEmpty()) {
            list.pop();
        }
    }
}
