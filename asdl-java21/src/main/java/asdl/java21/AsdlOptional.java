package asdl.java21;

import java.util.Objects;
import java.util.Optional;

/// Contents of an optional field: one value or absent.
public final class AsdlOptional implements AsdlValue {

    private static final AsdlOptional EMPTY = new AsdlOptional(null);

    private final AsdlValue value;

    private AsdlOptional(AsdlValue value) {
        this.value = value;
    }

    public static AsdlOptional of(AsdlValue value) {
        return new AsdlOptional(Objects.requireNonNull(value, "value must not be null"));
    }

    public static AsdlOptional empty() {
        return EMPTY;
    }

    public boolean isPresent() {
        return value != null;
    }

    public Optional<AsdlValue> value() {
        return Optional.ofNullable(value);
    }

    @Override
    public String kind() {
        return "optional";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AsdlOptional other && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return AsdlPrinter.print(this);
    }
}
