package ivl.hir;

import java.util.List;

public class OldExpr extends Expr {

    private final Expr expr;

    public OldExpr(Expr expr) {
        this.expr = expr;
    }

    public Expr getExpr() {
        return expr;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.OLD;
    }

    @Override
    public Type getType() {
        return expr.getType();
    }

    @Override
    public List<Expr> getChildren() {
        return children(expr);
    }

    @Override
    public OldExpr clone() {
        OldExpr o = new OldExpr(expr.clone());
        o.setPosition(getPosition());
        return o;
    }

    @Override
    protected int precedence() {
        return PREC_ATOM;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("old(");
        expr.print(sb);
        sb.append(")");
    }
}
