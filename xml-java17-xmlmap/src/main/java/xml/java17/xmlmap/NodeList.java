package xml.java17.xmlmap;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import xml.java17.xpath.CompiledXPath;
import xml.java17.xpath.XPathAst;

import java.util.AbstractList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;
import java.util.logging.Logger;

/// Live list view over every node a field expression selects.
///
/// The expression is evaluated again on each access, so the view always reflects the tree.
/// Writes go straight to the tree: `set` replaces a match's value, `add` synthesizes a new node
/// at the position of index `i` in document order, `remove` detaches a match.
///
/// Range views and sorting are not supported. Null values are rejected.
public final class NodeList<T> extends AbstractList<T> implements RandomAccess {

    private static final Logger LOG = Logger.getLogger(NodeList.class.getName());

    private final CompiledXPath path;
    private final Node node;
    private final XmlContext context;
    private final XmlMapper<T> mapper;

    NodeList(CompiledXPath path, Node node, XmlContext context, XmlMapper<T> mapper) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.node = Objects.requireNonNull(node, "node must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    private List<Node> matches() {
        return XmlEvaluator.selectNodes(path.text(), node, context);
    }

    @Override
    public int size() {
        return matches().size();
    }

    @Override
    public T get(int index) {
        final var matches = matches();
        Objects.checkIndex(index, matches.size());
        return mapper.fromXml(matches.get(index), context);
    }

    @Override
    public T set(int index, T element) {
        final var matches = matches();
        Objects.checkIndex(index, matches.size());
        final var xmlValue = toXml(element);
        final var match = matches.get(index);
        final var previous = mapper.fromXml(match, context);
        if (xmlValue instanceof Element replacement && match instanceof Element) {
            if (replacement != match) {
                final var imported = replacement.getOwnerDocument() == match.getOwnerDocument()
                        ? replacement
                        : match.getOwnerDocument().importNode(replacement, true);
                match.getParentNode().replaceChild(imported, match);
            }
        } else {
            TerminalSteps.setInXml(match, xmlValue, TerminalSteps.findTerminalStep(path.ast()));
        }
        LOG.finer(() -> "Set " + path.text() + "[" + index + "]");
        return previous;
    }

    /// Inserts a new node so that it becomes match `index`.
    /// With existing matches a child element is placed beside them, and an attribute or text
    /// match gets a new element of its own beside the one holding the existing match.
    /// Otherwise the full expression is synthesized.
    /// @throws XmlConstructionException if the expression is not constructible, or a further match
    ///         cannot be created, e.g. a second `@a`
    @Override
    public void add(int index, T element) {
        final var matches = matches();
        Objects.checkIndex(index, matches.size() + 1);
        final var xmlValue = toXml(element);
        ConstructibilityAnalyzer.requireConstructible(path.ast(), context);
        final var terminal = TerminalSteps.findTerminalStep(path.ast());
        final Node created;
        if (matches.isEmpty()) {
            created = NodeSynthesizer.synthesize(path.ast(), node, context);
        } else if (isChildElementStep(terminal)) {
            final var anchor = index < matches.size() ? matches.get(index) : matches.get(matches.size() - 1);
            final var before = index < matches.size() ? anchor : anchor.getNextSibling();
            created = NodeSynthesizer.synthesizeStep(terminal, anchor.getParentNode(), context, before);
        } else {
            created = addInNewContainer(index, matches, terminal);
        }
        TerminalSteps.setInXml(created, xmlValue, terminal);
        modCount++;
        LOG.finer(() -> "Inserted " + path.text() + "[" + index + "]");
    }

    private Node addInNewContainer(int index, List<Node> matches, XPathAst.Step terminal) {
        final var containerStep = path.ast() instanceof XPathAst.BinaryExpression binary && binary.isPath()
                ? TerminalSteps.findTerminalStep(binary.left())
                : null;
        if (!isChildElementStep(containerStep)) {
            throw new XmlConstructionException("Cannot add another match of '" + path.text() + "'");
        }
        final var anchor = index < matches.size() ? matches.get(index) : matches.get(matches.size() - 1);
        final var container = anchor instanceof Attr attr ? attr.getOwnerElement() : anchor.getParentNode();
        final var before = index < matches.size() ? container : container.getNextSibling();
        final var created = NodeSynthesizer.synthesizeStep(containerStep, container.getParentNode(), context, before);
        return NodeSynthesizer.synthesizeStep(terminal, created, context, null);
    }

    @Override
    public T remove(int index) {
        final var matches = matches();
        Objects.checkIndex(index, matches.size());
        final var match = matches.get(index);
        final var previous = mapper.fromXml(match, context);
        if (match instanceof Attr attr) {
            attr.getOwnerElement().removeAttributeNode(attr);
        } else {
            match.getParentNode().removeChild(match);
        }
        modCount++;
        LOG.finer(() -> "Removed " + path.text() + "[" + index + "]");
        return previous;
    }

    /// Removes and returns the last value.
    /// @throws IndexOutOfBoundsException if the list is empty
    public T pop() {
        return remove(size() - 1);
    }

    /// Number of values equal to the given one.
    public int count(Object value) {
        int count = 0;
        for (final var item : this) {
            if (Objects.equals(item, value)) {
                count++;
            }
        }
        return count;
    }

    /// Sets the value at the index, appending when the index equals the size.
    void assign(int index, T element) {
        if (index == size()) {
            add(index, element);
        } else {
            set(index, element);
        }
    }

    @Override
    public List<T> subList(int fromIndex, int toIndex) {
        throw new UnsupportedOperationException("Range views are not supported on " + path.text());
    }

    @Override
    public void sort(Comparator<? super T> c) {
        throw new UnsupportedOperationException("Sorting is not supported on " + path.text());
    }

    private Object toXml(T element) {
        return Objects.requireNonNull(mapper.toXml(element), "list values must not be null");
    }

    private static boolean isChildElementStep(XPathAst.Step step) {
        return step != null && step.isChildAxis() && step.nodeTest() instanceof XPathAst.NameTest;
    }
}
