package asdl.java21;

import java.util.Objects;

/// A `string` (or `identifier`) value.
public record AsdlString(String value) implements AsdlValue {

    public AsdlString {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static AsdlString of(String value) {
        return new AsdlString(value);
    }

    @Override
    public String kind() {
        return "string";
    }

    @Override
    public String toString() {
        return AsdlPrinter.print(this);
    }
}
