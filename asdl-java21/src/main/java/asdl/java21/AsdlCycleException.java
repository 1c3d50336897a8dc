package asdl.java21;

import java.util.List;

/// Raised when a declared type can only be built by embedding itself through
/// single fields, so no finite value of it exists.
public final class AsdlCycleException extends AsdlSchemaException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public AsdlCycleException(List<String> cycle, String sourceName, SourcePosition position) {
        super("illegal recursion without optional or repeated field: " + String.join(" -> ", cycle),
            sourceName, position);
        this.cycle = List.copyOf(cycle);
    }

    /// Returns the type names along the cycle; the first name is repeated at the end.
    public List<String> cycle() {
        return cycle;
    }
}
