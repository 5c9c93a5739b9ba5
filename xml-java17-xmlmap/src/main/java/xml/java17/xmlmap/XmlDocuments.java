package xml.java17.xmlmap;

import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Templates;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerConfigurationException;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/// Reading, writing and transforming documents with the JDK's namespace-aware DOM.
///
/// Loading into a model type can validate while parsing: against the type's XSD when it
/// declares one, otherwise against the document's DTD.
public final class XmlDocuments {

    private static final Logger LOG = Logger.getLogger(XmlDocuments.class.getName());

    private static final LazyConstant<DocumentBuilderFactory> BUILDERS =
            LazyConstant.of("DocumentBuilderFactory", () -> newFactory(false, null));

    private static final LazyConstant<DocumentBuilderFactory> DTD_VALIDATING_BUILDERS =
            LazyConstant.of("validating DocumentBuilderFactory", () -> newFactory(true, null));

    private static final LazyConstant<TransformerFactory> TRANSFORMERS =
            LazyConstant.of("TransformerFactory", TransformerFactory::newInstance);

    private static final String INDENT_AMOUNT = "{http://xml.apache.org/xslt}indent-amount";

    private static final ErrorHandler STRICT = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            LOG.warning(() -> "XML parse warning: " + e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    private XmlDocuments() {}

    public static Document newDocument() {
        return builder(BUILDERS.get()).newDocument();
    }

    public static Document parse(String xml) {
        Objects.requireNonNull(xml, "xml must not be null");
        return parse(BUILDERS.get(), new InputSource(new StringReader(xml)), "string");
    }

    public static Document parse(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        return parse(BUILDERS.get(), new InputSource(file.toUri().toString()), file.toString());
    }

    public static Document parse(InputStream stream, String systemId) {
        Objects.requireNonNull(stream, "stream must not be null");
        final var source = new InputSource(stream);
        source.setSystemId(systemId);
        return parse(BUILDERS.get(), source, systemId == null ? "stream" : systemId);
    }

    /// Parses the document at a URI or file path.
    public static Document parseUri(String location) {
        final var systemId = systemId(location);
        return parse(BUILDERS.get(), new InputSource(systemId), systemId);
    }

    public static XmlObject loadFromString(String xml, XmlObjectType type) {
        return loadFromString(xml, type, false);
    }

    /// Parses a document and wraps its root element as the type.
    /// @throws XmlMapException if the document is malformed or, when validating, invalid
    public static XmlObject loadFromString(String xml, XmlObjectType type, boolean validate) {
        Objects.requireNonNull(xml, "xml must not be null");
        return load(new InputSource(new StringReader(xml)), type, validate, "string");
    }

    public static XmlObject loadFromFile(Path file, XmlObjectType type, boolean validate) {
        Objects.requireNonNull(file, "file must not be null");
        return load(new InputSource(file.toUri().toString()), type, validate, file.toString());
    }

    public static XmlObject loadFromStream(InputStream stream, String systemId, XmlObjectType type,
                                           boolean validate) {
        Objects.requireNonNull(stream, "stream must not be null");
        final var source = new InputSource(stream);
        source.setSystemId(systemId);
        return load(source, type, validate, systemId == null ? "stream" : systemId);
    }

    private static XmlObject load(InputSource source, XmlObjectType type, boolean validate, String description) {
        Objects.requireNonNull(type, "type must not be null");
        final DocumentBuilderFactory factory;
        if (!validate) {
            factory = BUILDERS.get();
        } else if (type.xsdSchema() != null) {
            factory = newFactory(false, XmlSchemas.load(type.xsdSchema()));
        } else {
            factory = DTD_VALIDATING_BUILDERS.get();
        }
        final var document = parse(factory, source, description);
        LOG.fine(() -> "Loaded " + type.name() + " from " + description + (validate ? " with validation" : ""));
        return type.wrap(document.getDocumentElement());
    }

    /// Serializes a node. Pretty printing indents by two spaces; the declaration is only
    /// written when asked for.
    public static String serialize(Node node, boolean pretty, boolean xmlDeclaration) {
        Objects.requireNonNull(node, "node must not be null");
        try {
            final var transformer = newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, xmlDeclaration ? "no" : "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            if (pretty) {
                transformer.setOutputProperty(OutputKeys.INDENT, "yes");
                transformer.setOutputProperty(INDENT_AMOUNT, "2");
            }
            final var writer = new StringWriter();
            transformer.transform(new DOMSource(node), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new XmlMapException("Failed to serialize " + node.getNodeName(), e);
        }
    }

    public static Templates compileXslt(String xslt) {
        Objects.requireNonNull(xslt, "xslt must not be null");
        return compileXslt(new StreamSource(new StringReader(xslt)), "string");
    }

    public static Templates compileXslt(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        return compileXslt(new StreamSource(file.toFile()), file.toString());
    }

    private static Templates compileXslt(StreamSource source, String description) {
        final var factory = TRANSFORMERS.get();
        try {
            synchronized (factory) {
                return factory.newTemplates(source);
            }
        } catch (TransformerConfigurationException e) {
            throw new XmlMapException("Failed to compile XSLT from " + description, e);
        }
    }

    /// A location with a URI scheme is used as is, anything else is taken as a file path.
    static String systemId(String location) {
        Objects.requireNonNull(location, "location must not be null");
        final var scheme = URI.create(location.replace(" ", "%20")).getScheme();
        if (scheme != null && scheme.length() > 1) {
            return location;
        }
        return Path.of(location).toAbsolutePath().toUri().toString();
    }

    private static Document parse(DocumentBuilderFactory factory, InputSource source, String description) {
        try {
            return builder(factory).parse(source);
        } catch (SAXException e) {
            throw new XmlMapException("Failed to parse XML from " + description + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new XmlMapException("Failed to read XML from " + description, e);
        }
    }

    private static DocumentBuilder builder(DocumentBuilderFactory factory) {
        try {
            final DocumentBuilder builder;
            synchronized (factory) {
                builder = factory.newDocumentBuilder();
            }
            builder.setErrorHandler(STRICT);
            return builder;
        } catch (ParserConfigurationException e) {
            throw new XmlMapException("Failed to configure XML parser", e);
        }
    }

    private static Transformer newTransformer() throws TransformerConfigurationException {
        final var factory = TRANSFORMERS.get();
        synchronized (factory) {
            return factory.newTransformer();
        }
    }

    private static DocumentBuilderFactory newFactory(boolean dtdValidating, Schema schema) {
        final var factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setValidating(dtdValidating);
        factory.setSchema(schema);
        return factory;
    }
}
