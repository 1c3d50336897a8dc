package asdl.java21;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// A record type with one fixed field list.
public record ProductType(String module, String name, List<Field> fields) implements AsdlType {

    public ProductType {
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(name, "name must not be null");
        fields = List.copyOf(fields);
    }

    public Optional<Field> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    @Override
    public List<List<Field>> shapes() {
        return List.of(fields);
    }

    @Override
    public String toString() {
        return name + " = " + fields;
    }
}
