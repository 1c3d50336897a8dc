package asdl.java21;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Assigns the fields of one constructor (or product type) by name, then builds the node.
///
/// ```java
/// AsdlNode call = model.builder("arith_expr", "FuncCall")
///     .set("name", "max")
///     .set("args", List.of(x, y))
///     .build();
/// ```
/// Each field may be set once. A builder is a single-use, single-thread helper;
/// the node it builds is immutable like any other.
public final class AsdlNodeBuilder {

    private final TypeModel model;
    private final AsdlType type;
    private final Constructor constructor;
    private final Map<String, Object> assigned = new LinkedHashMap<>();

    AsdlNodeBuilder(TypeModel model, AsdlType type, Constructor constructor) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.constructor = constructor;
    }

    /// @throws AsdlArityException if the field was already set or is not declared
    public AsdlNodeBuilder set(String fieldName, Object value) {
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        final var declared = constructor != null
            ? constructor.field(fieldName)
            : ((ProductType) type).field(fieldName);
        if (declared.isEmpty()) {
            throw new AsdlArityException(label() + " declares no field named '" + fieldName + "'", label());
        }
        if (assigned.containsKey(fieldName)) {
            throw new AsdlArityException("duplicate assignment of field '" + fieldName + "'", label() + "." + fieldName);
        }
        assigned.put(fieldName, value);
        return this;
    }

    /// @throws AsdlArityException if a single field was never set
    /// @throws AsdlTypeMismatchException if a value does not fit its field
    public AsdlNode build() {
        return constructor != null
            ? model.constructNamed(type.qualifiedName(), constructor.name(), assigned)
            : model.constructNamed(type.qualifiedName(), assigned);
    }

    private String label() {
        return constructor != null ? constructor.name() : type.name();
    }
}
