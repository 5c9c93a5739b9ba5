package xml.java17.xmlmap;

import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Process-wide cache of compiled XSD schemas, keyed by location.
///
/// Each schema is compiled once; concurrent first use of the same location waits for the
/// single compilation.
public final class XmlSchemas {

    private static final Logger LOG = Logger.getLogger(XmlSchemas.class.getName());

    private static final Map<String, Schema> CACHE = new ConcurrentHashMap<>();

    private XmlSchemas() {}

    /// Returns the compiled schema at a URI or file path.
    /// @throws XmlMapException if the schema cannot be read or compiled
    public static Schema load(String location) {
        final var systemId = XmlDocuments.systemId(location);
        return CACHE.computeIfAbsent(systemId, XmlSchemas::compile);
    }

    private static Schema compile(String systemId) {
        LOG.fine(() -> "Compiling XSD schema " + systemId);
        final var factory = SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI);
        try {
            return factory.newSchema(new StreamSource(systemId));
        } catch (SAXException e) {
            throw new XmlMapException("Failed to load XSD schema " + systemId + ": " + e.getMessage(), e);
        }
    }

    /// Validates a document or element against the schema, collecting every error.
    public static XmlValidationResult validate(Node node, String location) {
        Objects.requireNonNull(node, "node must not be null");
        final var validator = load(location).newValidator();
        final var errors = new ArrayList<String>();
        validator.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException e) {
                LOG.fine(() -> "Validation warning: " + describe(e));
            }

            @Override
            public void error(SAXParseException e) {
                errors.add(describe(e));
            }

            @Override
            public void fatalError(SAXParseException e) {
                errors.add(describe(e));
            }
        });
        try {
            validator.validate(new DOMSource(node));
        } catch (SAXException e) {
            if (errors.isEmpty()) {
                errors.add(e.getMessage());
            }
        } catch (IOException e) {
            throw new XmlMapException("Failed to validate against " + location, e);
        }
        LOG.fine(() -> "Validated " + node.getNodeName() + " against " + location + ": " + errors.size() + " error(s)");
        return errors.isEmpty() ? XmlValidationResult.success() : XmlValidationResult.failure(errors);
    }

    private static String describe(SAXParseException e) {
        if (e.getLineNumber() < 0) {
            return e.getMessage();
        }
        return e.getLineNumber() + ":" + e.getColumnNumber() + ": " + e.getMessage();
    }

    /// Drops every cached schema, so the next use recompiles.
    static void clear() {
        CACHE.clear();
    }

    static List<String> cachedLocations() {
        return List.copyOf(CACHE.keySet());
    }
}
