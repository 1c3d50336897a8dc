package asdl.java21;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// One variant of a [SumType].
///
/// `tag` is the 0-based declaration index within the sum type. `fields` lists the
/// constructor's own fields followed by the sum type's attributes.
public record Constructor(String name, int tag, List<Field> fields) {

    public Constructor {
        Objects.requireNonNull(name, "name must not be null");
        fields = List.copyOf(fields);
        if (tag < 0) {
            throw new IllegalArgumentException("tag must be >= 0");
        }
    }

    public Optional<Field> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    @Override
    public String toString() {
        return name + "#" + tag + fields;
    }
}
