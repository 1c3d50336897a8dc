package asdl.java21;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// The resolved, immutable registry of the types declared by one load, plus
/// the models it imported.
///
/// A model is built once by [Asdl#load] and may then be shared freely between
/// threads. It is the target of every construction, access, validation and
/// printing operation:
///
/// ```java
/// TypeModel model = Asdl.load("""
///     module bools {
///       bool_expr = BoolUnary(string op, bool_expr child)
///                 | BoolBinary(string op, bool_expr left, bool_expr right)
///                 | BoolLit(bool value)
///     }
///     """);
/// AsdlNode lit = model.construct("bool_expr", "BoolLit", List.of(true));
/// AsdlNode not = model.construct("bool_expr", "BoolUnary", List.of("!", lit));
/// model.validate(not, "bool_expr");
/// model.print(not);    // BoolUnary(op="!", child=BoolLit(value=true))
/// ```
///
/// Type names may be given plainly (`bool_expr`) or qualified by module
/// (`bools.bool_expr`). A plain name resolves to the first match among this
/// model's modules in declaration order, then among the imported models.
public final class TypeModel {

    private static final Logger LOG = Logger.getLogger(TypeModel.class.getName());

    private final String sourceName;
    private final List<AsdlModule> modules;
    private final List<TypeModel> imports;
    private final Map<String, AsdlType> registry;
    private final Map<String, AsdlType> byName;
    private final Map<String, AsdlNode.Sum> constants;

    /// `registry` must be a read-only view shared with the model's [TypeRef.Named] references.
    TypeModel(String sourceName, List<AsdlModule> modules, List<TypeModel> imports, Map<String, AsdlType> registry) {
        this.sourceName = sourceName;
        this.modules = List.copyOf(modules);
        this.imports = List.copyOf(imports);
        this.registry = registry;

        final var names = new LinkedHashMap<String, AsdlType>();
        for (final var module : allModules()) {
            for (final var type : module.types()) {
                names.putIfAbsent(type.name(), type);
            }
        }
        this.byName = Collections.unmodifiableMap(names);

        final var shared = new LinkedHashMap<String, AsdlNode.Sum>();
        for (final var type : registry.values()) {
            if (type instanceof SumType sum) {
                for (final var ctor : sum.constructors()) {
                    if (ctor.fields().isEmpty()) {
                        shared.put(constantKey(sum, ctor), new AsdlNode.Sum(sum, ctor, List.of()));
                    }
                }
            }
        }
        this.constants = Collections.unmodifiableMap(shared);
    }

    /// Name the schema text was loaded under, or null.
    public String sourceName() {
        return sourceName;
    }

    /// Modules declared by this load, in source order.
    public List<AsdlModule> modules() {
        return modules;
    }

    public List<TypeModel> imports() {
        return imports;
    }

    /// Types declared by this load, in source order.
    public List<AsdlType> types() {
        final var types = new ArrayList<AsdlType>();
        for (final var module : modules) {
            types.addAll(module.types());
        }
        return Collections.unmodifiableList(types);
    }

    /// Looks up a module of this model or of any imported model.
    public Optional<AsdlModule> module(String name) {
        return allModules().stream().filter(m -> m.name().equals(name)).findFirst();
    }

    /// Looks up a declared type by plain or module-qualified name.
    public Optional<AsdlType> lookup(String name) {
        Objects.requireNonNull(name, "name must not be null");
        final var qualified = registry.get(name);
        return qualified != null ? Optional.of(qualified) : Optional.ofNullable(byName.get(name));
    }

    /// Like [#lookup] but fails for unknown names.
    /// @throws AsdlTypeMismatchException if no such type is visible
    public AsdlType type(String name) {
        return lookup(name).orElseThrow(() -> new AsdlTypeMismatchException("unknown type '" + name + "'", ""));
    }

    /// Returns a reference to a primitive (`string`, `identifier`, `int`, `bool`) or declared type.
    /// @throws AsdlTypeMismatchException if the name is neither
    public TypeRef typeRef(String name) {
        final var primitive = TypeRef.Primitive.lookup(name);
        if (primitive.isPresent()) {
            return primitive.get();
        }
        final var type = type(name);
        return new TypeRef.Named(type.module(), type.name(), registry);
    }

    // ------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------

    /// Builds a node of a sum type from positional field values.
    /// @throws AsdlArityException if the number of values differs from the constructor's field count
    /// @throws AsdlTypeMismatchException if a value does not fit its field, or the type or constructor is unknown
    public AsdlNode.Sum construct(String typeName, String constructorName, List<?> fieldValues) {
        Objects.requireNonNull(fieldValues, "fieldValues must not be null");
        final var sum = sumType(typeName);
        final var ctor = constructorOf(sum, constructorName);
        if (ctor.fields().isEmpty() && fieldValues.isEmpty()) {
            return constants.get(constantKey(sum, ctor));
        }
        return NodeFactory.sum(sum, ctor, fieldValues);
    }

    /// Builds a node of a product type from positional field values.
    /// @throws AsdlArityException if the number of values differs from the field count
    /// @throws AsdlTypeMismatchException if a value does not fit its field, or the type is unknown
    public AsdlNode.Product construct(String typeName, List<?> fieldValues) {
        Objects.requireNonNull(fieldValues, "fieldValues must not be null");
        return NodeFactory.product(productType(typeName), fieldValues);
    }

    /// Builds a node of a sum type from field values keyed by field name.
    /// Omitted optional fields are absent and omitted repeated fields empty.
    /// @throws AsdlArityException on an unknown field name or an omitted single field
    /// @throws AsdlTypeMismatchException if a value does not fit its field
    public AsdlNode.Sum constructNamed(String typeName, String constructorName, Map<String, ?> fieldValues) {
        Objects.requireNonNull(fieldValues, "fieldValues must not be null");
        final var sum = sumType(typeName);
        final var ctor = constructorOf(sum, constructorName);
        return construct(typeName, constructorName, NodeFactory.positional(ctor.fields(), fieldValues, ctor.name()));
    }

    /// Builds a node of a product type from field values keyed by field name.
    public AsdlNode.Product constructNamed(String typeName, Map<String, ?> fieldValues) {
        Objects.requireNonNull(fieldValues, "fieldValues must not be null");
        final var product = productType(typeName);
        return NodeFactory.product(product, NodeFactory.positional(product.fields(), fieldValues, product.name()));
    }

    /// Returns a builder assigning the fields of one sum constructor by name.
    public AsdlNodeBuilder builder(String typeName, String constructorName) {
        final var sum = sumType(typeName);
        return new AsdlNodeBuilder(this, sum, constructorOf(sum, constructorName));
    }

    /// Returns a builder assigning the fields of a product type by name.
    public AsdlNodeBuilder builder(String typeName) {
        return new AsdlNodeBuilder(this, productType(typeName), null);
    }

    // ------------------------------------------------------------------
    // Access, validation, printing
    // ------------------------------------------------------------------

    /// @throws AsdlFieldAccessException if the node's constructor declares no such field
    public AsdlValue get(AsdlNode node, String fieldName) {
        Objects.requireNonNull(node, "node must not be null");
        return node.get(fieldName);
    }

    /// @throws AsdlFieldAccessException if the index is out of range
    public AsdlValue get(AsdlNode node, int index) {
        Objects.requireNonNull(node, "node must not be null");
        return node.get(index);
    }

    /// @throws AsdlTypeMismatchException on the first violation
    public void validate(AsdlValue value, TypeRef type) {
        AsdlValidator.validate(value, type);
    }

    /// @throws AsdlTypeMismatchException on the first violation, or if the type name is unknown
    public void validate(AsdlValue value, String typeName) {
        AsdlValidator.validate(value, typeRef(typeName));
    }

    /// Like [#validate(AsdlValue, String)] but returns the outcome instead of throwing.
    /// An unknown type name is a failed result.
    public ValidationResult check(AsdlValue value, String typeName) {
        final TypeRef type;
        try {
            type = typeRef(typeName);
        } catch (AsdlTypeMismatchException e) {
            LOG.fine(() -> "Check against unknown type " + typeName);
            return ValidationResult.failure(new ValidationError(e.path(), e.detail()));
        }
        return AsdlValidator.check(value, type);
    }

    /// @throws AsdlRecursionLimitException if the value nests deeper than the default print depth
    public String print(AsdlValue value) {
        return AsdlPrinter.print(value);
    }

    // ------------------------------------------------------------------

    Map<String, AsdlType> registry() {
        return registry;
    }

    /// This model's modules followed by those of its imports, without repeats.
    List<AsdlModule> allModules() {
        final var all = new LinkedHashSet<AsdlModule>(modules);
        for (final var imported : imports) {
            all.addAll(imported.allModules());
        }
        return List.copyOf(all);
    }

    SumType sumType(String typeName) {
        final var type = type(typeName);
        if (!(type instanceof SumType sum)) {
            throw new AsdlTypeMismatchException(
                "type '" + typeName + "' is a product type; construct it without a constructor name", "");
        }
        return sum;
    }

    ProductType productType(String typeName) {
        final var type = type(typeName);
        if (!(type instanceof ProductType product)) {
            throw new AsdlTypeMismatchException(
                "type '" + typeName + "' is a sum type; a constructor name is required", "");
        }
        return product;
    }

    private static Constructor constructorOf(SumType sum, String constructorName) {
        Objects.requireNonNull(constructorName, "constructorName must not be null");
        return sum.constructor(constructorName).orElseThrow(() -> {
            LOG.fine(() -> "Unknown constructor " + constructorName + " requested for " + sum.name());
            return new AsdlTypeMismatchException(
                "sum type '" + sum.name() + "' has no constructor '" + constructorName + "'", "");
        });
    }

    private static String constantKey(SumType sum, Constructor ctor) {
        return sum.qualifiedName() + "." + ctor.name();
    }

    @Override
    public String toString() {
        return "TypeModel[" + (sourceName == null ? "" : sourceName + ": ")
            + modules.stream().map(AsdlModule::name).toList() + "]";
    }
}
