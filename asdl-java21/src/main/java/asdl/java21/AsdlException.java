package asdl.java21;

/// Root of every error raised while loading a schema or working with its values.
public abstract class AsdlException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    AsdlException(String message) {
        super(message);
    }
}
