package asdl.java21;

import java.util.Objects;

/// Raised while turning schema text into a [TypeModel].
/// The load attempt that raised it produced no model.
public abstract class AsdlSchemaException extends AsdlException {

    private static final long serialVersionUID = 1L;

    private final String sourceName;
    private final SourcePosition position;
    private final String description;

    AsdlSchemaException(String description, String sourceName, SourcePosition position) {
        super(formatMessage(description, sourceName, position));
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.sourceName = sourceName;
        this.position = position == null ? SourcePosition.UNKNOWN : position;
    }

    /// Returns the name the schema text was loaded under, or null if none was given.
    public String sourceName() {
        return sourceName;
    }

    /// Returns where in the source the problem was found.
    public SourcePosition position() {
        return position;
    }

    /// Returns the message without location details.
    public String description() {
        return description;
    }

    private static String formatMessage(String description, String sourceName, SourcePosition position) {
        if (position == null || !position.isKnown()) {
            return sourceName == null ? description : description + " in " + sourceName;
        }
        final var sb = new StringBuilder(description);
        sb.append(" at ");
        if (sourceName != null) {
            sb.append(sourceName).append(':');
        }
        sb.append(position.line()).append(':').append(position.column());
        return sb.toString();
    }
}
