package ivl.hir;

import java.util.List;

public class IfThenElseExpr extends Expr {

    private final Expr condition;
    private final Expr then_expr;
    private final Expr else_expr;

    public IfThenElseExpr(Expr condition, Expr then_expr, Expr else_expr) {
        this.condition = condition;
        this.then_expr = then_expr;
        this.else_expr = else_expr;
    }

    public Expr getCondition() {
        return condition;
    }

    public Expr getThenExpr() {
        return then_expr;
    }

    public Expr getElseExpr() {
        return else_expr;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.IF_THEN_ELSE;
    }

    @Override
    public Type getType() {
        Type t = then_expr.getType();
        return (t != null) ? t : else_expr.getType();
    }

    @Override
    public List<Expr> getChildren() {
        return children(condition, then_expr, else_expr);
    }

    @Override
    public IfThenElseExpr clone() {
        IfThenElseExpr o = new IfThenElseExpr(condition.clone(), then_expr.clone(), else_expr.clone());
        o.setPosition(getPosition());
        return o;
    }

    @Override
    protected int precedence() {
        return PREC_ITE;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("if ");
        condition.print(sb);
        sb.append(" then ");
        then_expr.print(sb);
        sb.append(" else ");
        else_expr.print(sb);
    }
}
