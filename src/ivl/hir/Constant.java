package ivl.hir;

public class Constant extends Variable {

    private final boolean unique;

    public Constant(String name, Type type, Attributes attributes, boolean unique) {
        super(name, type, attributes);
        this.unique = unique;
    }

    public Constant(String name, Type type, Attributes attributes) {
        this(name, type, attributes, false);
    }

    public boolean isUnique() {
        return unique;
    }

    @Override
    public Constant copy(String new_name, Type new_type) {
        return finishCopy(new Constant(new_name, new_type, getAttributes().clone(), unique));
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("const ").append(getAttributes());
        if (unique) {
            sb.append("unique ");
        }
        sb.append(getName()).append(": ").append(getType()).append(";");
    }
}
