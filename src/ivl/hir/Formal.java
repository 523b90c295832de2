package ivl.hir;

/** An input or output parameter of a procedure, implementation or function. */
public class Formal extends Variable {

    private final boolean incoming;

    public Formal(String name, Type type, Attributes attributes, boolean incoming) {
        super(name, type, attributes);
        this.incoming = incoming;
    }

    public Formal(String name, Type type, boolean incoming) {
        this(name, type, null, incoming);
    }

    public boolean isIncoming() {
        return incoming;
    }

    @Override
    public Formal copy(String new_name, Type new_type) {
        return finishCopy(new Formal(new_name, new_type, getAttributes().clone(), incoming));
    }

    @Override
    public void print(StringBuilder sb) {
        if (getName() == null || getName().isEmpty()) {
            sb.append(getType());
        } else {
            printTypedIdent(sb);
        }
    }
}
