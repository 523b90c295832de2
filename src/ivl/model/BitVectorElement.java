package ivl.model;

import java.math.BigInteger;

/** Unsigned bit-vector numeral <b>NbvW</b>. */
public class BitVectorElement extends Element {

    private final BigInteger value;
    private final int bits;

    public BitVectorElement(BigInteger value, int bits) {
        this.value = value;
        this.bits = bits;
    }

    public int getBits() {
        return bits;
    }

    @Override
    public BigInteger asNumber() {
        return value;
    }

    /** Returns the value read as a two's complement number of the given width. */
    public BigInteger asSigned(int width) {
        BigInteger modulus = BigInteger.ONE.shiftLeft(width);
        BigInteger v = value.mod(modulus);
        if (v.testBit(width - 1)) {
            v = v.subtract(modulus);
        }
        return v;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BitVectorElement)) {
            return false;
        }
        BitVectorElement other = (BitVectorElement)o;
        return other.bits == bits && other.value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode() * 31 + bits;
    }

    @Override
    public String toString() {
        return value + "bv" + bits;
    }
}
