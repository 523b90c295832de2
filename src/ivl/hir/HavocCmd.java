package ivl.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class HavocCmd extends Cmd {

    private final List<IdentifierExpr> vars;

    public HavocCmd(List<IdentifierExpr> vars, Attributes attributes) {
        super(attributes);
        this.vars = new ArrayList<IdentifierExpr>(vars);
    }

    public HavocCmd(List<IdentifierExpr> vars) {
        this(vars, null);
    }

    public List<IdentifierExpr> getVars() {
        return Collections.unmodifiableList(vars);
    }

    @Override
    public List<IdentifierExpr> getChildren() {
        return getVars();
    }

    @Override
    public HavocCmd clone() {
        List<IdentifierExpr> copied = new ArrayList<IdentifierExpr>(vars.size());
        for (IdentifierExpr v : vars) {
            copied.add(v.clone());
        }
        return finishClone(new HavocCmd(copied, getAttributes().clone()));
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("havoc ");
        IRTools.printList(sb, vars);
        sb.append(";");
    }
}
