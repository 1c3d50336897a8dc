package asdl.java21;

import java.util.Objects;

/// Raised by construction, field access, validation or printing of a single value.
/// These are per-call failures; the [TypeModel] is unaffected.
public abstract class AsdlValueException extends AsdlException {

    private static final long serialVersionUID = 1L;

    private final String path;
    private final String detail;

    AsdlValueException(String message, String path) {
        super(path == null || path.isEmpty() ? message : message + " at " + path);
        this.path = Objects.requireNonNullElse(path, "");
        this.detail = message;
    }

    /// Returns the message without the path.
    public String detail() {
        return detail;
    }

    /// Returns the field path of the offending value, for example `arith_expr.left.args[1]`.
    public String path() {
        return path;
    }
}
