package ivl.hir;

/** A fixed-width bit-vector type, printed as <b>bvN</b>. */
public final class BvType extends Type {

    private final int bits;

    public BvType(int bits) {
        if (bits <= 0) {
            throw new IllegalArgumentException("bit-vector width must be positive: " + bits);
        }
        this.bits = bits;
    }

    @Override
    public boolean isBv() {
        return true;
    }

    @Override
    public int getBvBits() {
        return bits;
    }

    @Override
    public String toString() {
        return "bv" + bits;
    }
}
