package asdl.java21;

/// How many values a field holds.
public enum Multiplicity {
    /// Exactly one value.
    SINGLE(""),
    /// Zero or one value, written `type? name`.
    OPTIONAL("?"),
    /// Zero or more values in order, written `type* name`.
    REPEATED("*");

    private final String symbol;

    Multiplicity(String symbol) {
        this.symbol = symbol;
    }

    /// Returns the suffix used after the type name in schema text.
    public String symbol() {
        return symbol;
    }
}
