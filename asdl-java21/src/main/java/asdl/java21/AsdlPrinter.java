package asdl.java21;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/// Renders values in canonical text form.
///
/// - sum nodes: `Ctor(field1=v1, field2=v2)`, a field-less constructor as `Ctor()`
/// - product nodes: `(v1, v2)`
/// - strings: double quoted, JSON escaping
/// - `int` in decimal, `bool` as `true` / `false`
/// - repeated fields: `[e1, e2]`
/// - optional fields: the value, or `null` when absent
///
/// Output depends only on the value and declared field order. Nesting nodes,
/// sequences and present optionals deeper than [PrintPolicy#maxDepth()] raises
/// [AsdlRecursionLimitException].
public final class AsdlPrinter {

    static final String ABSENT = "null";

    private final PrintPolicy policy;

    private AsdlPrinter(PrintPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public static AsdlPrinter with(PrintPolicy policy) {
        return new AsdlPrinter(policy);
    }

    /// Canonical single-line form using the default policy.
    public static String print(AsdlValue value) {
        return with(PrintPolicy.defaults()).render(value);
    }

    /// Indented multi-line form using the default policy.
    public static String printTree(AsdlValue value) {
        return with(PrintPolicy.defaults()).renderTree(value);
    }

    public String render(AsdlValue value) {
        Objects.requireNonNull(value, "value must not be null");
        final var sb = new StringBuilder();
        new Walk().flat(value, 0, sb, Integer.MAX_VALUE);
        return sb.toString();
    }

    /// Renders sub-values on one line when they fit within the line width,
    /// otherwise one field or element per line.
    public String renderTree(AsdlValue value) {
        Objects.requireNonNull(value, "value must not be null");
        final var sb = new StringBuilder();
        new Walk().tree(value, 0, 0, 0, sb);
        return sb.toString();
    }

    /// Per-call state: the field path currently being rendered, for error messages.
    ///
    /// `depth` counts every enclosing node, sequence and present optional.
    private final class Walk {

        private final Deque<String> path = new ArrayDeque<>();

        /// Appends the single-line form of `value`.
        /// Returns false, leaving `sb` partly written, as soon as `sb` grows past `limit`.
        boolean flat(AsdlValue value, int depth, StringBuilder sb, int limit) {
            if (sb.length() > limit) {
                return false;
            }
            if (value instanceof AsdlNode node) {
                enter(node.label(), depth);
                final var fields = node.fields();
                final var values = node.values();
                if (node instanceof AsdlNode.Sum) {
                    sb.append(node.label());
                }
                sb.append('(');
                for (int i = 0; i < values.size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    final var name = i < fields.size() ? fields.get(i).name() : "#" + i;
                    if (node instanceof AsdlNode.Sum) {
                        sb.append(name).append('=');
                    }
                    path.addLast(name);
                    final boolean fits = flat(values.get(i), depth + 1, sb, limit);
                    path.removeLast();
                    if (!fits || sb.length() > limit) {
                        path.removeLast();
                        return false;
                    }
                }
                sb.append(')');
                path.removeLast();
            } else if (value instanceof AsdlSeq seq) {
                checkDepth(depth);
                sb.append('[');
                for (int i = 0; i < seq.size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    path.addLast("[" + i + "]");
                    final boolean fits = flat(seq.get(i), depth + 1, sb, limit);
                    path.removeLast();
                    if (!fits || sb.length() > limit) {
                        return false;
                    }
                }
                sb.append(']');
            } else if (value instanceof AsdlOptional optional) {
                if (!optional.isPresent()) {
                    sb.append(ABSENT);
                } else {
                    checkDepth(depth);
                    if (!flat(optional.value().orElseThrow(), depth + 1, sb, limit)) {
                        return false;
                    }
                }
            } else {
                appendScalar(value, sb);
            }
            return sb.length() <= limit;
        }

        void tree(AsdlValue value, int depth, int level, int column, StringBuilder sb) {
            final var line = new StringBuilder();
            if (flat(value, depth, line, policy.lineWidth() - column)) {
                sb.append(line);
                return;
            }
            if (value instanceof AsdlNode node) {
                enter(node.label(), depth);
                final var fields = node.fields();
                final var values = node.values();
                final boolean named = node instanceof AsdlNode.Sum;
                sb.append(named ? node.label() : "").append("(\n");
                for (int i = 0; i < values.size(); i++) {
                    final var name = i < fields.size() ? fields.get(i).name() : "#" + i;
                    final var prefix = named ? name + "=" : "";
                    pad(level + 1, sb).append(prefix);
                    path.addLast(name);
                    tree(values.get(i), depth + 1, level + 1, (level + 1) * policy.indent() + prefix.length(), sb);
                    path.removeLast();
                    sb.append(i + 1 < values.size() ? ",\n" : "\n");
                }
                pad(level, sb).append(')');
                path.removeLast();
            } else if (value instanceof AsdlSeq seq) {
                checkDepth(depth);
                sb.append("[\n");
                final List<AsdlValue> elements = seq.elements();
                for (int i = 0; i < elements.size(); i++) {
                    pad(level + 1, sb);
                    path.addLast("[" + i + "]");
                    tree(elements.get(i), depth + 1, level + 1, (level + 1) * policy.indent(), sb);
                    path.removeLast();
                    sb.append(i + 1 < elements.size() ? ",\n" : "\n");
                }
                pad(level, sb).append(']');
            } else if (value instanceof AsdlOptional optional && optional.isPresent()) {
                checkDepth(depth);
                tree(optional.value().orElseThrow(), depth + 1, level, column, sb);
            } else {
                // a scalar wider than the line has no shorter form
                final var whole = new StringBuilder();
                flat(value, depth, whole, Integer.MAX_VALUE);
                sb.append(whole);
            }
        }

        private void enter(String label, int depth) {
            checkDepth(depth);
            path.addLast(label);
        }

        private void checkDepth(int depth) {
            if (depth >= policy.maxDepth()) {
                throw new AsdlRecursionLimitException(
                    "value nesting exceeds print depth limit of " + policy.maxDepth(), String.join(".", path));
            }
        }

        private StringBuilder pad(int level, StringBuilder sb) {
            sb.append(" ".repeat(level * policy.indent()));
            return sb;
        }
    }

    private static void appendScalar(AsdlValue value, StringBuilder sb) {
        if (value instanceof AsdlString str) {
            appendQuoted(str.value(), sb);
        } else if (value instanceof AsdlInt i) {
            sb.append(i.value());
        } else if (value instanceof AsdlBool b) {
            sb.append(b.value());
        } else {
            throw new IllegalStateException("not a scalar: " + value.kind());
        }
    }

    static void appendQuoted(String s, StringBuilder sb) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            final char ch = s.charAt(i);
            switch (ch) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (ch < 0x20 || ch > 0x7e) {
                        sb.append("\\u").append(String.format("%04x", (int) ch));
                    } else {
                        sb.append(ch);
                    }
                }
            }
        }
        sb.append('"');
    }
}
