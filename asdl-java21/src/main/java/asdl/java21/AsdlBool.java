package asdl.java21;

/// A `bool` value.
public record AsdlBool(boolean value) implements AsdlValue {

    public static final AsdlBool TRUE = new AsdlBool(true);
    public static final AsdlBool FALSE = new AsdlBool(false);

    public static AsdlBool of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public String kind() {
        return "bool";
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
