package ivl.hir;

public class LocalVariable extends Variable {

    public LocalVariable(String name, Type type, Attributes attributes) {
        super(name, type, attributes);
    }

    public LocalVariable(String name, Type type) {
        this(name, type, null);
    }

    @Override
    public LocalVariable copy(String new_name, Type new_type) {
        return finishCopy(new LocalVariable(new_name, new_type, getAttributes().clone()));
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("var ");
        printTypedIdent(sb);
        sb.append(";");
    }
}
