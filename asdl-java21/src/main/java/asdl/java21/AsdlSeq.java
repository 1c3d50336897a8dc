package asdl.java21;

import java.util.List;

/// Contents of a repeated field, in order. An empty sequence is distinct from an absent optional.
public record AsdlSeq(List<AsdlValue> elements) implements AsdlValue {

    private static final AsdlSeq EMPTY = new AsdlSeq(List.of());

    public AsdlSeq {
        elements = List.copyOf(elements);
    }

    public static AsdlSeq empty() {
        return EMPTY;
    }

    public static AsdlSeq of(List<? extends AsdlValue> elements) {
        return elements.isEmpty() ? EMPTY : new AsdlSeq(List.copyOf(elements));
    }

    public static AsdlSeq of(AsdlValue... elements) {
        return of(List.of(elements));
    }

    public int size() {
        return elements.size();
    }

    public AsdlValue get(int index) {
        return elements.get(index);
    }

    @Override
    public String kind() {
        return "sequence";
    }

    @Override
    public String toString() {
        return AsdlPrinter.print(this);
    }
}
