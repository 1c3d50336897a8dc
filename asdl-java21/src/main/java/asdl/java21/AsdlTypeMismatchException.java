package asdl.java21;

/// Raised when a value has the wrong kind, shape or type identity for its field.
public final class AsdlTypeMismatchException extends AsdlValueException {

    private static final long serialVersionUID = 1L;

    public AsdlTypeMismatchException(String message, String path) {
        super(message, path);
    }
}
