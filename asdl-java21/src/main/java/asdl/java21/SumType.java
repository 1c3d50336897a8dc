package asdl.java21;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/// A closed set of named constructors.
/// `attributes` are the shared trailing fields already appended to every constructor.
public record SumType(String module, String name, List<Constructor> constructors, List<Field> attributes)
        implements AsdlType {

    public SumType {
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(name, "name must not be null");
        constructors = List.copyOf(constructors);
        attributes = List.copyOf(attributes);
        if (constructors.isEmpty()) {
            throw new IllegalArgumentException("sum type " + name + " must have at least one constructor");
        }
        for (int i = 0; i < constructors.size(); i++) {
            if (constructors.get(i).tag() != i) {
                throw new IllegalArgumentException("constructor " + constructors.get(i).name()
                    + " of " + name + " has tag " + constructors.get(i).tag() + ", expected " + i);
            }
        }
    }

    public Optional<Constructor> constructor(String constructorName) {
        return constructors.stream().filter(c -> c.name().equals(constructorName)).findFirst();
    }

    public Constructor constructor(int tag) {
        return constructors.get(tag);
    }

    /// True when no constructor carries fields, so the type behaves like an enumeration.
    public boolean isSimple() {
        return constructors.stream().allMatch(c -> c.fields().isEmpty());
    }

    @Override
    public List<List<Field>> shapes() {
        return constructors.stream().map(Constructor::fields).collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        return name + " = " + constructors.stream().map(Constructor::name).collect(Collectors.joining(" | "));
    }
}
