package asdl.java21;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/// Builds nodes from caller-supplied field values.
///
/// Raw Java arguments are normalised first: `String`, `Byte`/`Short`/`Integer`/`Long`,
/// `Boolean`, `List` (repeated fields), `Optional` (optional fields) and any
/// [AsdlValue]. A bare value supplied for an optional field counts as present.
/// `null` is rejected everywhere.
final class NodeFactory {

    private static final Logger LOG = Logger.getLogger(NodeFactory.class.getName());

    private NodeFactory() {}

    static AsdlNode.Sum sum(SumType type, Constructor constructor, List<?> raw) {
        final var values = checkedValues(constructor.fields(), raw, constructor.name());
        final var node = new AsdlNode.Sum(type, constructor, values);
        LOG.finer(() -> "Constructed " + type.name() + "." + constructor.name() + " tag=" + constructor.tag());
        return node;
    }

    static AsdlNode.Product product(ProductType type, List<?> raw) {
        final var values = checkedValues(type.fields(), raw, type.name());
        final var node = new AsdlNode.Product(type, values);
        LOG.finer(() -> "Constructed " + type.name());
        return node;
    }

    /// Orders named arguments by declaration.
    /// Omitted optional fields become absent and omitted repeated fields empty.
    /// @throws AsdlArityException on an unknown name or an omitted single field
    static List<Object> positional(List<Field> fields, Map<String, ?> named, String label) {
        final var remaining = new LinkedHashMap<String, Object>(named);
        final var ordered = new ArrayList<Object>(fields.size());
        for (final var field : fields) {
            if (remaining.containsKey(field.name())) {
                ordered.add(remaining.remove(field.name()));
                continue;
            }
            switch (field.multiplicity()) {
                case OPTIONAL -> ordered.add(AsdlOptional.empty());
                case REPEATED -> ordered.add(AsdlSeq.empty());
                case SINGLE -> throw new AsdlArityException(
                    "required field '" + field.name() + "' was not supplied", label);
            }
        }
        if (!remaining.isEmpty()) {
            throw new AsdlArityException(
                label + " declares no field(s) named " + remaining.keySet(), label);
        }
        return ordered;
    }

    private static List<AsdlValue> checkedValues(List<Field> fields, List<?> raw, String label) {
        if (raw.size() != fields.size()) {
            throw new AsdlArityException(
                label + " expects " + fields.size() + " field(s) " + fields + " but got " + raw.size(), label);
        }
        final var values = new ArrayList<AsdlValue>(raw.size());
        for (int i = 0; i < fields.size(); i++) {
            final var field = fields.get(i);
            values.add(normalise(raw.get(i), field, label + "." + field.name()));
        }
        AsdlValidator.validateFields(fields, values, label);
        return values;
    }

    private static AsdlValue normalise(Object raw, Field field, String path) {
        return switch (field.multiplicity()) {
            case SINGLE -> element(raw, field, path);
            case REPEATED -> {
                if (raw instanceof AsdlSeq seq) {
                    yield seq;
                }
                if (!(raw instanceof List<?> list)) {
                    throw new AsdlTypeMismatchException(
                        "expected sequence of " + field.type().typeName() + ", got " + describe(raw), path);
                }
                final var elements = new ArrayList<AsdlValue>(list.size());
                for (int i = 0; i < list.size(); i++) {
                    elements.add(element(list.get(i), field, path + "[" + i + "]"));
                }
                yield AsdlSeq.of(elements);
            }
            case OPTIONAL -> {
                if (raw instanceof AsdlOptional optional) {
                    yield optional;
                }
                if (raw instanceof Optional<?> optional) {
                    yield optional.isPresent()
                        ? AsdlOptional.of(element(optional.get(), field, path))
                        : AsdlOptional.empty();
                }
                yield AsdlOptional.of(element(raw, field, path));
            }
        };
    }

    private static AsdlValue element(Object raw, Field field, String path) {
        if (raw instanceof AsdlValue value) {
            return value;
        }
        if (raw instanceof String s) {
            return AsdlString.of(s);
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return AsdlInt.of(((Number) raw).longValue());
        }
        if (raw instanceof Boolean b) {
            return AsdlBool.of(b);
        }
        throw new AsdlTypeMismatchException(
            "expected " + field.type().typeName() + ", got " + describe(raw), path);
    }

    private static String describe(Object raw) {
        if (raw == null) {
            return "null";
        }
        return raw instanceof AsdlValue value ? value.kind() : raw.getClass().getSimpleName();
    }
}
