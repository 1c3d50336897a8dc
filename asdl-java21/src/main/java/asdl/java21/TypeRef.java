package asdl.java21;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Resolved type of a [Field]: a primitive kind or a declared type.
public sealed interface TypeRef permits TypeRef.Primitive, TypeRef.Named {

    /// Returns the name the type is written with in schema text.
    String typeName();

    /// Built-in leaf types.
    enum Primitive implements TypeRef {
        STRING("string"),
        INT("int"),
        BOOL("bool");

        private final String typeName;

        Primitive(String typeName) {
            this.typeName = typeName;
        }

        @Override
        public String typeName() {
            return typeName;
        }

        /// Looks up a primitive by its schema name. `identifier` is an alias of `string`.
        public static Optional<Primitive> lookup(String name) {
            return switch (name) {
                case "string", "identifier" -> Optional.of(STRING);
                case "int" -> Optional.of(INT);
                case "bool" -> Optional.of(BOOL);
                default -> Optional.empty();
            };
        }

        static boolean isPrimitiveName(String name) {
            return lookup(name).isPresent();
        }

        @Override
        public String toString() {
            return typeName;
        }
    }

    /// Reference to a declared sum or product type.
    ///
    /// The target is looked up in the registry of the model that resolved it, so
    /// types may refer to each other in any order. Equality is by qualified name.
    final class Named implements TypeRef {

        private final String module;
        private final String name;
        private final Map<String, AsdlType> registry;

        /// `registry` must be a read-only view; it is never exposed.
        Named(String module, String name, Map<String, AsdlType> registry) {
            this.module = Objects.requireNonNull(module, "module must not be null");
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.registry = Objects.requireNonNull(registry, "registry must not be null");
        }

        /// Name of the module declaring the target.
        public String module() {
            return module;
        }

        public String name() {
            return name;
        }

        /// Returns the declared type this reference resolves to.
        public AsdlType target() {
            final var type = registry.get(qualifiedName());
            if (type == null) {
                throw new IllegalStateException("Type reference not resolved: " + qualifiedName());
            }
            return type;
        }

        public String qualifiedName() {
            return module + "." + name;
        }

        @Override
        public String typeName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Named other && module.equals(other.module) && name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(module, name);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
