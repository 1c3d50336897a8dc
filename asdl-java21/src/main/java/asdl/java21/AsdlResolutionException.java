package asdl.java21;

/// Raised when a field names a type that is neither a primitive nor declared in a visible module.
public final class AsdlResolutionException extends AsdlSchemaException {

    private static final long serialVersionUID = 1L;

    public AsdlResolutionException(String description, String sourceName, SourcePosition position) {
        super(description, sourceName, position);
    }
}
