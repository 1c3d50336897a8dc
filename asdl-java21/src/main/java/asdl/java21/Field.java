package asdl.java21;

import java.util.Objects;

/// A typed, named slot of a constructor or product type.
/// `index` is the field's 0-based position within its owner.
public record Field(String name, TypeRef type, Multiplicity multiplicity, int index) {

    public Field {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(multiplicity, "multiplicity must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
    }

    @Override
    public String toString() {
        return type.typeName() + multiplicity.symbol() + " " + name;
    }
}
