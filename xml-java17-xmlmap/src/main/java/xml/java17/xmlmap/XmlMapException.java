package xml.java17.xmlmap;

/// Base exception for failures while mapping fields onto an XML tree.
/// Thrown directly when the host XPath evaluator rejects an expression or when
/// a document, schema or stylesheet cannot be read.
public class XmlMapException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public XmlMapException(String message) {
        super(message);
    }

    public XmlMapException(String message, Throwable cause) {
        super(message, cause);
    }
}
