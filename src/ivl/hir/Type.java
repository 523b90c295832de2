package ivl.hir;

/**
 * Semantic type of a variable, function or expression: boolean, mathematical
 * integer, fixed-width bit-vector, or a map over other types. Types are
 * immutable and compare by their printed form.
 */
public abstract class Type {

    protected Type() {
    }

    public boolean isBool() {
        return false;
    }

    public boolean isInt() {
        return false;
    }

    public boolean isBv() {
        return false;
    }

    public boolean isMap() {
        return false;
    }

    /** Returns the width of a bit-vector type, or 0 for other types. */
    public int getBvBits() {
        return 0;
    }

    /** Returns the bit-vector type of the given width. */
    public static BvType getBvType(int bits) {
        return new BvType(bits);
    }

    @Override
    public abstract String toString();

    @Override
    public boolean equals(Object o) {
        return (o instanceof Type) && toString().equals(o.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }
}
