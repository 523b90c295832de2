package ivl.hir;

/**
 * A named, typed storage location: a mutable global, a constant, a local of
 * an implementation, or a formal parameter. Variables are never renamed in
 * place; {@link #copy} produces a fresh declaration.
 */
public abstract class Variable extends Declaration {

    private final String name;
    private final Type type;

    protected Variable(String name, Type type, Attributes attributes) {
        super(attributes);
        this.name = name;
        this.type = type;
    }

    @Override
    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    /** Returns a fresh variable of the same kind with cloned attributes. */
    public abstract Variable copy(String new_name, Type new_type);

    public Variable rename(String new_name) {
        return copy(new_name, type);
    }

    protected <T extends Variable> T finishCopy(T v) {
        v.setPosition(getPosition());
        return v;
    }

    /** Prints <b>{:attrs} name: type</b>. */
    protected void printTypedIdent(StringBuilder sb) {
        sb.append(getAttributes()).append(name).append(": ").append(type);
    }
}
