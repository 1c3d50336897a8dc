package asdl.java21;

import java.util.Objects;

/// The first violation found by [AsdlValidator#check].
/// `path` is the field path of the offending value, `message` says what was wrong with it.
public record ValidationError(String path, String message) {

    public ValidationError {
        Objects.requireNonNull(path, "path must not be null");
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("Error message cannot be null or empty");
        }
    }

    @Override
    public String toString() {
        return path.isEmpty() ? message : message + " at " + path;
    }
}
