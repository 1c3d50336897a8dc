package asdl.java21;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// An instance of a declared type.
///
/// Nodes are created only through [TypeModel] (`construct`, `constructNamed`,
/// `builder`), which checks every field before the node exists. There is no
/// way to change a field afterwards.
///
/// ```java
/// TypeModel model = Asdl.load("module cf { cflow = Break | Return(int status) }");
/// AsdlNode ret = model.construct("cflow", "Return", List.of(2));
/// ret.get("status");   // AsdlInt[value=2]
/// ret.toString();      // Return(status=2)
/// ```
public sealed interface AsdlNode extends AsdlValue permits AsdlNode.Sum, AsdlNode.Product {

    AsdlType type();

    /// Field declarations of this node's constructor (or product type), in order.
    List<Field> fields();

    /// Field values, parallel to [#fields()].
    List<AsdlValue> values();

    /// Constructor name for sum nodes, type name for product nodes.
    String label();

    @Override
    default String kind() {
        return type().name();
    }

    /// Returns the value of the named field.
    /// @throws AsdlFieldAccessException if this node's constructor declares no such field
    default AsdlValue get(String fieldName) {
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        final var fields = fields();
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(fieldName)) {
                return values().get(i);
            }
        }
        throw new AsdlFieldAccessException(
            label() + " has no field '" + fieldName + "'; declared fields are " + fieldNames(), label());
    }

    /// Returns the value at the given field index.
    /// @throws AsdlFieldAccessException if the index is out of range
    default AsdlValue get(int index) {
        if (index < 0 || index >= values().size()) {
            throw new AsdlFieldAccessException(
                label() + " has " + values().size() + " field(s); index " + index + " is out of range", label());
        }
        return values().get(index);
    }

    default String getString(String fieldName) {
        return as(fieldName, AsdlString.class).value();
    }

    default long getInt(String fieldName) {
        return as(fieldName, AsdlInt.class).value();
    }

    default boolean getBool(String fieldName) {
        return as(fieldName, AsdlBool.class).value();
    }

    default AsdlNode getNode(String fieldName) {
        return as(fieldName, AsdlNode.class);
    }

    default List<AsdlValue> getSeq(String fieldName) {
        return as(fieldName, AsdlSeq.class).elements();
    }

    default Optional<AsdlValue> getOptional(String fieldName) {
        return as(fieldName, AsdlOptional.class).value();
    }

    private <T extends AsdlValue> T as(String fieldName, Class<T> kind) {
        final var value = get(fieldName);
        if (!kind.isInstance(value)) {
            throw new AsdlTypeMismatchException(
                "field holds " + value.kind() + ", not " + kind.getSimpleName(), label() + "." + fieldName);
        }
        return kind.cast(value);
    }

    private List<String> fieldNames() {
        return fields().stream().map(Field::name).toList();
    }

    /// A node of a [SumType], tagged with the constructor that built it.
    final class Sum implements AsdlNode {

        private final SumType type;
        private final Constructor constructor;
        private final List<AsdlValue> values;

        Sum(SumType type, Constructor constructor, List<AsdlValue> values) {
            this.type = Objects.requireNonNull(type, "type must not be null");
            this.constructor = Objects.requireNonNull(constructor, "constructor must not be null");
            this.values = List.copyOf(values);
        }

        @Override
        public SumType type() {
            return type;
        }

        public Constructor constructor() {
            return constructor;
        }

        /// Declaration index of the constructor within its sum type.
        public int tag() {
            return constructor.tag();
        }

        @Override
        public List<Field> fields() {
            return constructor.fields();
        }

        @Override
        public List<AsdlValue> values() {
            return values;
        }

        @Override
        public String label() {
            return constructor.name();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Sum other
                && type.qualifiedName().equals(other.type.qualifiedName())
                && constructor.tag() == other.constructor.tag()
                && values.equals(other.values);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type.qualifiedName(), constructor.tag(), values);
        }

        @Override
        public String toString() {
            return AsdlPrinter.print(this);
        }
    }

    /// A node of a [ProductType].
    final class Product implements AsdlNode {

        private final ProductType type;
        private final List<AsdlValue> values;

        Product(ProductType type, List<AsdlValue> values) {
            this.type = Objects.requireNonNull(type, "type must not be null");
            this.values = List.copyOf(values);
        }

        @Override
        public ProductType type() {
            return type;
        }

        @Override
        public List<Field> fields() {
            return type.fields();
        }

        @Override
        public List<AsdlValue> values() {
            return values;
        }

        @Override
        public String label() {
            return type.name();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Product other
                && type.qualifiedName().equals(other.type.qualifiedName())
                && values.equals(other.values);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type.qualifiedName(), values);
        }

        @Override
        public String toString() {
            return AsdlPrinter.print(this);
        }
    }
}
