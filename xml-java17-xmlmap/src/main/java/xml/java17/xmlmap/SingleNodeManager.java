package xml.java17.xmlmap;

import org.w3c.dom.Node;
import xml.java17.xpath.CompiledXPath;
import xml.java17.xpath.XPathSerializer;

import java.util.logging.Logger;

/// Manages a field holding one value: the first node the expression selects.
///
/// Setting null removes the match, and with it any constructed ancestors left empty.
/// Setting `""` keeps the node with an empty value.
///
/// @param instantiateOnGet synthesize a missing node on get instead of returning null;
///        kept for older model declarations
public record SingleNodeManager<T>(boolean instantiateOnGet) implements FieldManager<T, T> {

    private static final Logger LOG = Logger.getLogger(SingleNodeManager.class.getName());

    @Override
    public T get(CompiledXPath path, Node node, XmlContext context, XmlMapper<T> mapper) {
        LOG.fine(() -> "Get " + path.text());
        var match = XmlEvaluator.first(path.text(), node, context);
        if (match == null && instantiateOnGet) {
            match = NodeSynthesizer.synthesize(path.ast(), node, context);
        }
        return mapper.fromXml(match, context);
    }

    @Override
    public void set(CompiledXPath path, Node node, XmlContext context, XmlMapper<T> mapper, T value) {
        LOG.fine(() -> "Set " + path.text());
        final var xmlValue = mapper.toXml(value);
        if (xmlValue == null) {
            delete(path, node, context, mapper);
            return;
        }
        final var match = XmlEvaluator.first(path.text(), node, context);
        final var target = match instanceof Node existing
                ? existing
                : NodeSynthesizer.synthesize(path.ast(), node, context);
        TerminalSteps.setInXml(target, xmlValue, TerminalSteps.findTerminalStep(path.ast()));
    }

    @Override
    public void delete(CompiledXPath path, Node node, XmlContext context, XmlMapper<T> mapper) {
        LOG.fine(() -> "Delete " + path.text());
        if (!(XmlEvaluator.first(path.text(), node, context) instanceof Node)) {
            return;
        }
        if (!NodeRemover.remove(path.ast(), node, context, false)) {
            LOG.warning(() -> "Could not remove match of " + XPathSerializer.serialize(path.ast()));
        }
    }

    /// Returns the node the expression selects, synthesizing it when missing.
    public Node create(CompiledXPath path, Node node, XmlContext context) {
        LOG.fine(() -> "Create " + path.text());
        final var match = XmlEvaluator.firstNode(path.text(), node, context);
        return match != null ? match : NodeSynthesizer.synthesize(path.ast(), node, context);
    }
}
