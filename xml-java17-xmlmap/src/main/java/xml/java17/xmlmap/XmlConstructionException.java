package xml.java17.xmlmap;

/// Thrown when a field expression cannot be used to build missing nodes, or when a value
/// cannot be assigned to the node it selects. Whenever the problem is detectable from the
/// expression alone the tree is left unmodified.
public class XmlConstructionException extends XmlMapException {

    private static final long serialVersionUID = 1L;

    public XmlConstructionException(String message) {
        super(message);
    }
}
