package asdl.java21;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// A named, ordered group of declared types.
public record AsdlModule(String name, List<AsdlType> types) {

    public AsdlModule {
        Objects.requireNonNull(name, "name must not be null");
        types = List.copyOf(types);
    }

    public Optional<AsdlType> type(String typeName) {
        return types.stream().filter(t -> t.name().equals(typeName)).findFirst();
    }
}
