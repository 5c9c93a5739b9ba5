package xml.java17.xmlmap;

/// Thrown when matched content does not fit the vocabulary of a field,
/// e.g. boolean text that is neither configured token or a malformed date.
public class XmlMappingException extends XmlMapException {

    private static final long serialVersionUID = 1L;

    public XmlMappingException(String message) {
        super(message);
    }

    public XmlMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
