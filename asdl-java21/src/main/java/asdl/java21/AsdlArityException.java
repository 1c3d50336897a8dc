package asdl.java21;

/// Raised when the number or names of supplied fields do not match the declaration.
public final class AsdlArityException extends AsdlValueException {

    private static final long serialVersionUID = 1L;

    public AsdlArityException(String message, String path) {
        super(message, path);
    }
}
