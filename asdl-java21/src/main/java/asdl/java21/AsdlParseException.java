package asdl.java21;

/// Raised by the parser on a grammar violation or a duplicate name inside one declaration.
public final class AsdlParseException extends AsdlSchemaException {

    private static final long serialVersionUID = 1L;

    public AsdlParseException(String description, String sourceName, SourcePosition position) {
        super(description, sourceName, position);
    }
}
