package asdl.java21;

/// Raised when printing descends deeper than the configured ceiling.
public final class AsdlRecursionLimitException extends AsdlValueException {

    private static final long serialVersionUID = 1L;

    public AsdlRecursionLimitException(String message, String path) {
        super(message, path);
    }
}
