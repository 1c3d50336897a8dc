package asdl.java21;

/// An `int` value; 64-bit signed.
public record AsdlInt(long value) implements AsdlValue {

    public static AsdlInt of(long value) {
        return new AsdlInt(value);
    }

    @Override
    public String kind() {
        return "int";
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
