package ivl.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** <b>m[i1, ..., in]</b> on the left of an assignment. */
public class MapAssignLhs extends AssignLhs {

    private final AssignLhs map;
    private final List<Expr> indexes;

    public MapAssignLhs(AssignLhs map, List<Expr> indexes) {
        this.map = map;
        this.indexes = new ArrayList<Expr>(indexes);
    }

    public AssignLhs getMap() {
        return map;
    }

    public List<Expr> getIndexes() {
        return Collections.unmodifiableList(indexes);
    }

    @Override
    public IdentifierExpr getAssignedVariable() {
        return map.getAssignedVariable();
    }

    @Override
    public Expr asExpr() {
        return new MapSelectExpr(map.asExpr(), indexes);
    }

    @Override
    public List<Traversable> getChildren() {
        List<Traversable> ret = new ArrayList<Traversable>();
        ret.add(map);
        ret.addAll(indexes);
        return ret;
    }

    @Override
    public MapAssignLhs clone() {
        List<Expr> copied = new ArrayList<Expr>(indexes.size());
        for (Expr e : indexes) {
            copied.add(e.clone());
        }
        return new MapAssignLhs(map.clone(), copied);
    }

    @Override
    public void print(StringBuilder sb) {
        map.print(sb);
        sb.append("[");
        IRTools.printList(sb, indexes);
        sb.append("]");
    }
}
