package asdl.java21;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Checks values against declared types.
///
/// Walks the value graph with an explicit work stack, so deeply nested values
/// do not consume Java stack. The first violation, in field declaration order,
/// is reported; nothing after it is examined.
public final class AsdlValidator {

    private static final Logger LOG = Logger.getLogger(AsdlValidator.class.getName());

    private AsdlValidator() {}

    /// Work item: a value expected to match `type` with `multiplicity`.
    /// When `descend` is false a node is checked for identity only, not for its fields.
    private record Frame(AsdlValue value, TypeRef type, Multiplicity multiplicity, String path, boolean descend) {}

    /// Validates a value against a type, recursing through every nested node.
    /// @throws AsdlTypeMismatchException on the first violation
    public static void validate(AsdlValue value, TypeRef type) {
        Objects.requireNonNull(type, "type must not be null");
        run(new Frame(value, type, Multiplicity.SINGLE, type.typeName(), true));
    }

    /// Validates the contents of a field, honouring its multiplicity.
    /// @throws AsdlTypeMismatchException on the first violation
    public static void validate(AsdlValue value, Field field) {
        Objects.requireNonNull(field, "field must not be null");
        run(new Frame(value, field.type(), field.multiplicity(), field.name(), true));
    }

    /// Like [#validate(AsdlValue, TypeRef)] but returns the outcome instead of throwing.
    public static ValidationResult check(AsdlValue value, TypeRef type) {
        try {
            validate(value, type);
            return ValidationResult.success();
        } catch (AsdlTypeMismatchException e) {
            return ValidationResult.failure(new ValidationError(e.path(), e.detail()));
        }
    }

    /// Checks freshly supplied field values during construction.
    ///
    /// Nested nodes are checked for type identity only: every node was itself
    /// checked when it was constructed.
    static void validateFields(List<Field> fields, List<AsdlValue> values, String label) {
        for (int i = 0; i < fields.size(); i++) {
            final var field = fields.get(i);
            run(new Frame(values.get(i), field.type(), field.multiplicity(), label + "." + field.name(), false));
        }
    }

    private static void run(Frame root) {
        final Deque<Frame> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            step(stack.pop(), stack);
        }
    }

    private static void step(Frame frame, Deque<Frame> stack) {
        final var value = frame.value();
        if (value == null) {
            throw mismatch("missing value, expected " + describe(frame.type(), frame.multiplicity()), frame);
        }
        LOG.finer(() -> "Validating " + value.kind() + " at " + frame.path());

        switch (frame.multiplicity()) {
            case REPEATED -> {
                if (!(value instanceof AsdlSeq seq)) {
                    throw mismatch("expected " + describe(frame.type(), Multiplicity.REPEATED) + ", got " + value.kind(), frame);
                }
                // reversed so elements are examined in order
                for (int i = seq.size() - 1; i >= 0; i--) {
                    stack.push(new Frame(seq.get(i), frame.type(), Multiplicity.SINGLE,
                        frame.path() + "[" + i + "]", frame.descend()));
                }
            }
            case OPTIONAL -> {
                if (!(value instanceof AsdlOptional optional)) {
                    throw mismatch("expected " + describe(frame.type(), Multiplicity.OPTIONAL) + ", got " + value.kind(), frame);
                }
                optional.value().ifPresent(inner -> stack.push(
                    new Frame(inner, frame.type(), Multiplicity.SINGLE, frame.path(), frame.descend())));
            }
            case SINGLE -> stepSingle(frame, stack);
        }
    }

    private static void stepSingle(Frame frame, Deque<Frame> stack) {
        final var value = frame.value();
        final var type = frame.type();

        if (type instanceof TypeRef.Primitive primitive) {
            final boolean ok = switch (primitive) {
                case STRING -> value instanceof AsdlString;
                case INT -> value instanceof AsdlInt;
                case BOOL -> value instanceof AsdlBool;
            };
            if (!ok) {
                throw mismatch("expected " + primitive.typeName() + ", got " + value.kind(), frame);
            }
            return;
        }

        final var expected = ((TypeRef.Named) type).target();
        if (!(value instanceof AsdlNode node)) {
            throw mismatch("expected " + expected.name() + ", got " + value.kind(), frame);
        }
        if (node.type() != expected) {
            throw mismatch("expected " + expected.qualifiedName() + ", got " + node.type().qualifiedName(), frame);
        }
        if (node instanceof AsdlNode.Sum sum) {
            final var sumType = (SumType) expected;
            final int tag = sum.tag();
            if (tag >= sumType.constructors().size() || sumType.constructor(tag) != sum.constructor()) {
                throw mismatch(sum.label() + " is not a constructor of " + sumType.name(), frame);
            }
        }
        if (!frame.descend()) {
            return;
        }

        final var fields = node.fields();
        final var values = node.values();
        if (fields.size() != values.size()) {
            throw mismatch(node.label() + " declares " + fields.size() + " field(s) but holds " + values.size(), frame);
        }
        for (int i = fields.size() - 1; i >= 0; i--) {
            final var field = fields.get(i);
            stack.push(new Frame(values.get(i), field.type(), field.multiplicity(),
                frame.path() + "." + field.name(), true));
        }
    }

    private static String describe(TypeRef type, Multiplicity multiplicity) {
        return switch (multiplicity) {
            case SINGLE -> type.typeName();
            case OPTIONAL -> "optional " + type.typeName();
            case REPEATED -> "sequence of " + type.typeName();
        };
    }

    private static AsdlTypeMismatchException mismatch(String message, Frame frame) {
        LOG.fine(() -> "Validation failed at " + frame.path() + ": " + message);
        return new AsdlTypeMismatchException(message, frame.path());
    }
}
