package ivl.model;

import java.math.BigInteger;

public class NumberElement extends Element {

    private final BigInteger value;

    public NumberElement(BigInteger value) {
        this.value = value;
    }

    @Override
    public BigInteger asNumber() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof NumberElement) && ((NumberElement)o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
