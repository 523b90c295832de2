package ivl.model;

public class BooleanElement extends Element {

    private final boolean value;

    public BooleanElement(boolean value) {
        this.value = value;
    }

    @Override
    public boolean asBoolean() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof BooleanElement) && ((BooleanElement)o).value == value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
