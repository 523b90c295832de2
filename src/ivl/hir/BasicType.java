package ivl.hir;

/** The built-in types <b>bool</b> and <b>int</b>. */
public final class BasicType extends Type {

    public static final BasicType BOOL = new BasicType("bool");

    public static final BasicType INT = new BasicType("int");

    private final String name;

    private BasicType(String name) {
        this.name = name;
    }

    @Override
    public boolean isBool() {
        return this == BOOL;
    }

    @Override
    public boolean isInt() {
        return this == INT;
    }

    @Override
    public String toString() {
        return name;
    }
}
