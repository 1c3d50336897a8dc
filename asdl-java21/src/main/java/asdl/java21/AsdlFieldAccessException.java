package asdl.java21;

/// Raised when a node is asked for a field its constructor does not declare.
public final class AsdlFieldAccessException extends AsdlValueException {

    private static final long serialVersionUID = 1L;

    public AsdlFieldAccessException(String message, String path) {
        super(message, path);
    }
}
