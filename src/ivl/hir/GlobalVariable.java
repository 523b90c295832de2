package ivl.hir;

public class GlobalVariable extends Variable {

    public GlobalVariable(String name, Type type, Attributes attributes) {
        super(name, type, attributes);
    }

    @Override
    public GlobalVariable copy(String new_name, Type new_type) {
        return finishCopy(new GlobalVariable(new_name, new_type, getAttributes().clone()));
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("var ");
        printTypedIdent(sb);
        sb.append(";");
    }
}
