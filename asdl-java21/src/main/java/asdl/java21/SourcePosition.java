package asdl.java21;

/// Location of a token or declaration in schema source text.
/// `offset` is 0-based; `line` and `column` are 1-based.
public record SourcePosition(int offset, int line, int column) implements java.io.Serializable {

    /// Position used for declarations that do not come from source text.
    public static final SourcePosition UNKNOWN = new SourcePosition(-1, 0, 0);

    public boolean isKnown() {
        return offset >= 0;
    }

    @Override
    public String toString() {
        return isKnown() ? line + ":" + column : "?";
    }
}
