package xml.java17.xmlmap;

import java.util.List;

/// Result of validating an element against an XSD schema.
///
/// When `isValid()` is true the error list is empty.
/// When `isValid()` is false at least one message is present, prefixed with its line and column
/// where the validator reports them.
public record XmlValidationResult(boolean isValid, List<String> errors) {

    private static final XmlValidationResult SUCCESS = new XmlValidationResult(true, List.of());

    public XmlValidationResult {
        errors = List.copyOf(errors);
    }

    public static XmlValidationResult success() {
        return SUCCESS;
    }

    public static XmlValidationResult failure(List<String> errors) {
        return new XmlValidationResult(false, errors);
    }
}
