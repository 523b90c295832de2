package ivl.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Functional map update, <b>m[i1, ..., in := v]</b>. */
public class MapStoreExpr extends Expr {

    private final Expr map;
    private final List<Expr> indexes;
    private final Expr value;

    public MapStoreExpr(Expr map, List<Expr> indexes, Expr value) {
        this.map = map;
        this.indexes = new ArrayList<Expr>(indexes);
        this.value = value;
    }

    public Expr getMap() {
        return map;
    }

    public List<Expr> getIndexes() {
        return Collections.unmodifiableList(indexes);
    }

    public Expr getValue() {
        return value;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.MAP_STORE;
    }

    @Override
    public Type getType() {
        return map.getType();
    }

    @Override
    public List<Expr> getChildren() {
        List<Expr> ret = new ArrayList<Expr>(indexes.size() + 2);
        ret.add(map);
        ret.addAll(indexes);
        ret.add(value);
        return ret;
    }

    @Override
    public MapStoreExpr clone() {
        List<Expr> copied = new ArrayList<Expr>(indexes.size());
        for (Expr i : indexes) {
            copied.add(i.clone());
        }
        MapStoreExpr o = new MapStoreExpr(map.clone(), copied, value.clone());
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
        sb.append(" := ");
        value.print(sb);
        sb.append("]");
    }
}
