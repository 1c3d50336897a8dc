package asdl.java21;

/// Raised by the lexer on a character that cannot start a token.
public final class AsdlLexException extends AsdlSchemaException {

    private static final long serialVersionUID = 1L;

    public AsdlLexException(String description, String sourceName, SourcePosition position) {
        super(description, sourceName, position);
    }
}
