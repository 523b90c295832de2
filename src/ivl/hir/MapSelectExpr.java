package ivl.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Map (array) read, <b>m[i1, ..., in]</b>. */
public class MapSelectExpr extends Expr {

    private final Expr map;
    private final List<Expr> indexes;

    public MapSelectExpr(Expr map, List<Expr> indexes) {
        this.map = map;
        this.indexes = new ArrayList<Expr>(indexes);
    }

    public MapSelectExpr(Expr map, Expr index) {
        this(map, Collections.singletonList(index));
    }

    public Expr getMap() {
        return map;
    }

    public List<Expr> getIndexes() {
        return Collections.unmodifiableList(indexes);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.MAP_SELECT;
    }

    @Override
    public Type getType() {
        Type t = map.getType();
        return (t instanceof MapType) ? ((MapType)t).getResult() : null;
    }

    @Override
    public List<Expr> getChildren() {
        List<Expr> ret = new ArrayList<Expr>(indexes.size() + 1);
        ret.add(map);
        ret.addAll(indexes);
        return ret;
    }

    @Override
    public MapSelectExpr clone() {
        List<Expr> copied = new ArrayList<Expr>(indexes.size());
        for (Expr i : indexes) {
            copied.add(i.clone());
        }
        MapSelectExpr o = new MapSelectExpr(map.clone(), copied);
        o.setPosition(getPosition());
        return o;
    }

    @Override
    protected int precedence() {
        return PREC_ATOM;
    }

    @Override
    public void print(StringBuilder sb) {
        printOperand(sb, map, PREC_ATOM);
        sb.append("[");
        IRTools.printList(sb, indexes);
        sb.append("]");
    }
}
