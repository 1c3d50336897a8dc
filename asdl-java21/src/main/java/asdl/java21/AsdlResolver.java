package asdl.java21;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Turns parsed modules into a [TypeModel].
///
/// - every field type name becomes a [TypeRef]; names are looked up as a
///   primitive, then in the declaring module, then in earlier modules of the
///   same source, then in the imported models in the order given
/// - constructors get 0-based tags and fields 0-based indices in declaration order
/// - a type that can only be built by embedding itself through single fields
///   is rejected with [AsdlCycleException]
final class AsdlResolver {

    private static final Logger LOG = Logger.getLogger(AsdlResolver.class.getName());

    private final String sourceName;
    private final List<TypeModel> imports;
    private final Map<String, AsdlType> registry = new LinkedHashMap<>();
    private final Map<String, AsdlType> readOnlyRegistry = Collections.unmodifiableMap(registry);
    private final Map<String, SourcePosition> positions = new HashMap<>();

    private AsdlResolver(String sourceName, List<TypeModel> imports) {
        this.sourceName = sourceName;
        this.imports = imports;
    }

    static TypeModel resolve(List<AsdlAst.Module> modules, String sourceName, List<TypeModel> imports) {
        Objects.requireNonNull(modules, "modules must not be null");
        Objects.requireNonNull(imports, "imports must not be null");
        return new AsdlResolver(sourceName, List.copyOf(imports)).run(modules);
    }

    private TypeModel run(List<AsdlAst.Module> modules) {
        for (final var imported : imports) {
            registry.putAll(imported.registry());
        }

        final var resolved = new ArrayList<AsdlModule>();
        for (int i = 0; i < modules.size(); i++) {
            final var module = modules.get(i);
            if (isImportedModule(module.name())) {
                throw new AsdlResolutionException(
                    "module '" + module.name() + "' is already loaded by an imported model", sourceName, module.position());
            }
            resolved.add(resolveModule(module, modules.subList(0, i)));
        }

        for (final var module : resolved) {
            checkRepresentable(module);
        }

        final var model = new TypeModel(sourceName, resolved, imports, readOnlyRegistry);
        LOG.fine(() -> "Resolved " + resolved.size() + " module(s) with " + model.types().size()
            + " type(s) from " + (sourceName == null ? "<string>" : sourceName));
        return model;
    }

    private boolean isImportedModule(String name) {
        return imports.stream().anyMatch(m -> m.module(name).isPresent());
    }

    private AsdlModule resolveModule(AsdlAst.Module module, List<AsdlAst.Module> earlier) {
        final var types = new ArrayList<AsdlType>();
        for (final var decl : module.types()) {
            final AsdlType type;
            if (decl instanceof AsdlAst.SumDecl sum) {
                type = resolveSum(module, earlier, sum);
            } else {
                type = resolveProduct(module, earlier, (AsdlAst.ProductDecl) decl);
            }
            types.add(type);
            registry.put(type.qualifiedName(), type);
            positions.put(type.qualifiedName(), decl.position());
        }
        return new AsdlModule(module.name(), types);
    }

    private SumType resolveSum(AsdlAst.Module module, List<AsdlAst.Module> earlier, AsdlAst.SumDecl decl) {
        final var constructors = new ArrayList<Constructor>();
        final var attributeDecls = decl.attributes();
        for (int tag = 0; tag < decl.constructors().size(); tag++) {
            final var ctor = decl.constructors().get(tag);
            final var fields = new ArrayList<Field>();
            for (final var field : ctor.fields()) {
                fields.add(resolveField(module, earlier, field, fields.size()));
            }
            for (final var attribute : attributeDecls) {
                fields.add(resolveField(module, earlier, attribute, fields.size()));
            }
            constructors.add(new Constructor(ctor.name(), tag, fields));
        }
        final var attributes = new ArrayList<Field>();
        for (final var attribute : attributeDecls) {
            attributes.add(resolveField(module, earlier, attribute, attributes.size()));
        }
        LOG.finer(() -> "Resolved sum " + decl.name() + " with tags 0.." + (constructors.size() - 1));
        return new SumType(module.name(), decl.name(), constructors, attributes);
    }

    private ProductType resolveProduct(AsdlAst.Module module, List<AsdlAst.Module> earlier, AsdlAst.ProductDecl decl) {
        final var fields = new ArrayList<Field>();
        for (final var field : decl.fields()) {
            fields.add(resolveField(module, earlier, field, fields.size()));
        }
        return new ProductType(module.name(), decl.name(), fields);
    }

    private Field resolveField(AsdlAst.Module module, List<AsdlAst.Module> earlier, AsdlAst.FieldDecl decl, int index) {
        return new Field(decl.name(), resolveTypeName(module, earlier, decl), decl.multiplicity(), index);
    }

    private TypeRef resolveTypeName(AsdlAst.Module module, List<AsdlAst.Module> earlier, AsdlAst.FieldDecl decl) {
        final var name = decl.typeName();
        final var primitive = TypeRef.Primitive.lookup(name);
        if (primitive.isPresent()) {
            return primitive.get();
        }
        if (declares(module, name)) {
            return new TypeRef.Named(module.name(), name, readOnlyRegistry);
        }
        for (final var other : earlier) {
            if (declares(other, name)) {
                return new TypeRef.Named(other.name(), name, readOnlyRegistry);
            }
        }
        for (final var imported : imports) {
            for (final var other : imported.allModules()) {
                if (other.type(name).isPresent()) {
                    return new TypeRef.Named(other.name(), name, readOnlyRegistry);
                }
            }
        }
        throw new AsdlResolutionException(
            "unknown type '" + name + "' for field '" + decl.name() + "'", sourceName, decl.position());
    }

    private static boolean declares(AsdlAst.Module module, String name) {
        return module.types().stream().anyMatch(t -> t.name().equals(name));
    }

    // ------------------------------------------------------------------
    // Representability: only edges through single fields count
    // ------------------------------------------------------------------

    /// Rejects types of `module` that have no finite value.
    ///
    /// A product is finite when every single field's type is finite; a sum when at
    /// least one constructor is. Optional and repeated fields never block, since
    /// absence and the empty sequence end the recursion. Types imported from other
    /// models were checked when those models loaded.
    private void checkRepresentable(AsdlModule module) {
        final Set<String> finite = new HashSet<>();
        for (final var entry : registry.entrySet()) {
            if (!entry.getValue().module().equals(module.name())) {
                finite.add(entry.getKey());
            }
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (final var type : module.types()) {
                if (!finite.contains(type.qualifiedName()) && hasFiniteShape(type, finite)) {
                    finite.add(type.qualifiedName());
                    changed = true;
                }
            }
        }

        for (final var type : module.types()) {
            if (!finite.contains(type.qualifiedName())) {
                final var cycle = findCycle(type, finite);
                final var start = positions.get(cycle.get(0));
                final var names = cycle.stream().map(q -> registry.get(q).name()).toList();
                LOG.fine(() -> "Rejecting unrepresentable type " + type.name() + ", cycle " + names);
                throw new AsdlCycleException(names, sourceName, start);
            }
        }
    }

    private static boolean hasFiniteShape(AsdlType type, Set<String> finite) {
        for (final var shape : type.shapes()) {
            final boolean ok = singleEdges(shape).stream().allMatch(finite::contains);
            if (ok) {
                return true;
            }
        }
        return false;
    }

    /// Qualified names of declared types referenced through single fields, in declaration order.
    private static Set<String> singleEdges(List<Field> fields) {
        final var edges = new LinkedHashSet<String>();
        for (final var field : fields) {
            if (field.multiplicity() == Multiplicity.SINGLE && field.type() instanceof TypeRef.Named named) {
                edges.add(named.qualifiedName());
            }
        }
        return edges;
    }

    /// Depth-first search over single-field edges between non-finite types.
    /// Every non-finite type has such an edge, so a cycle is always reached.
    private List<String> findCycle(AsdlType start, Set<String> finite) {
        final var onPath = new ArrayList<String>();
        final Set<String> done = new HashSet<>();
        final var cycle = visit(start.qualifiedName(), finite, onPath, done);
        if (cycle == null) {
            throw new IllegalStateException("no cycle found from non-finite type " + start.qualifiedName());
        }
        return cycle;
    }

    private List<String> visit(String node, Set<String> finite, List<String> onPath, Set<String> done) {
        final int at = onPath.indexOf(node);
        if (at >= 0) {
            final var cycle = new ArrayList<>(onPath.subList(at, onPath.size()));
            cycle.add(node);
            return cycle;
        }
        if (!done.add(node)) {
            return null;
        }
        onPath.add(node);
        for (final var shape : registry.get(node).shapes()) {
            for (final var next : singleEdges(shape)) {
                if (finite.contains(next)) {
                    continue;
                }
                final var cycle = visit(next, finite, onPath, done);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        onPath.remove(onPath.size() - 1);
        return null;
    }
}
