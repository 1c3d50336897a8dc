package asdl.java21;

import java.util.List;
import java.util.Objects;

/// Unresolved declaration tree produced by [AsdlParser].
///
/// Type names in fields are still plain strings here; [AsdlResolver] turns
/// them into [TypeRef]s. Every node keeps the position it was parsed at.
public sealed interface AsdlAst {

    SourcePosition position();

    /// `module NAME { ... }`
    record Module(String name, List<TypeDecl> types, SourcePosition position) implements AsdlAst {
        public Module {
            Objects.requireNonNull(name, "name must not be null");
            types = List.copyOf(types);
        }
    }

    /// A named type declaration, either a sum or a product.
    sealed interface TypeDecl extends AsdlAst permits SumDecl, ProductDecl {
        String name();
    }

    /// `NAME = Ctor(...) | Ctor(...) attributes(...)`
    record SumDecl(
            String name,
            List<ConstructorDecl> constructors,
            List<FieldDecl> attributes,
            SourcePosition position
    ) implements TypeDecl {
        public SumDecl {
            Objects.requireNonNull(name, "name must not be null");
            constructors = List.copyOf(constructors);
            attributes = List.copyOf(attributes);
            if (constructors.isEmpty()) {
                throw new IllegalArgumentException("sum type must have at least one constructor");
            }
        }
    }

    /// `NAME = (fields)`
    record ProductDecl(String name, List<FieldDecl> fields, SourcePosition position) implements TypeDecl {
        public ProductDecl {
            Objects.requireNonNull(name, "name must not be null");
            fields = List.copyOf(fields);
        }
    }

    /// One alternative of a sum type.
    record ConstructorDecl(String name, List<FieldDecl> fields, SourcePosition position) implements AsdlAst {
        public ConstructorDecl {
            Objects.requireNonNull(name, "name must not be null");
            fields = List.copyOf(fields);
        }
    }

    /// `typeName[*|?] name`
    record FieldDecl(
            String typeName,
            Multiplicity multiplicity,
            String name,
            SourcePosition position
    ) implements AsdlAst {
        public FieldDecl {
            Objects.requireNonNull(typeName, "typeName must not be null");
            Objects.requireNonNull(multiplicity, "multiplicity must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String toString() {
            return typeName + multiplicity.symbol() + " " + name;
        }
    }
}
