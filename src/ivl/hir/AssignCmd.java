package ivl.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Simultaneous assignment <b>l1, ..., ln := e1, ..., en;</b> */
public class AssignCmd extends Cmd {

    private final List<AssignLhs> lhss;
    private final List<Expr> rhss;

    public AssignCmd(List<AssignLhs> lhss, List<Expr> rhss, Attributes attributes) {
        super(attributes);
        if (lhss.size() != rhss.size()) {
            throw new IllegalArgumentException("[ERROR in AssignCmd] " + lhss.size()
                    + " left-hand sides but " + rhss.size() + " right-hand sides");
        }
        this.lhss = new ArrayList<AssignLhs>(lhss);
        this.rhss = new ArrayList<Expr>(rhss);
    }

    public AssignCmd(List<AssignLhs> lhss, List<Expr> rhss) {
        this(lhss, rhss, null);
    }

    /** Convenience constructor for <b>x := e;</b> */
    public AssignCmd(IdentifierExpr lhs, Expr rhs) {
        this(Collections.<AssignLhs>singletonList(new SimpleAssignLhs(lhs)),
                Collections.singletonList(rhs), null);
    }

    public List<AssignLhs> getLhss() {
        return Collections.unmodifiableList(lhss);
    }

    public List<Expr> getRhss() {
        return Collections.unmodifiableList(rhss);
    }

    @Override
    public List<Traversable> getChildren() {
        List<Traversable> ret = new ArrayList<Traversable>();
        ret.addAll(lhss);
        ret.addAll(rhss);
        return ret;
    }

    @Override
    public AssignCmd clone() {
        List<AssignLhs> l = new ArrayList<AssignLhs>(lhss.size());
        for (AssignLhs a : lhss) {
            l.add(a.clone());
        }
        List<Expr> r = new ArrayList<Expr>(rhss.size());
        for (Expr e : rhss) {
            r.add(e.clone());
        }
        return finishClone(new AssignCmd(l, r, getAttributes().clone()));
    }

    @Override
    public void print(StringBuilder sb) {
        for (int i = 0; i < lhss.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            lhss.get(i).print(sb);
        }
        sb.append(" := ");
        IRTools.printList(sb, rhss);
        sb.append(";");
    }
}
