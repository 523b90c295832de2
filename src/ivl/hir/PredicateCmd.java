package ivl.hir;

import java.util.Collections;
import java.util.List;

/** Common base of assert and assume. */
public abstract class PredicateCmd extends Cmd {

    private final Expr expr;

    protected PredicateCmd(Expr expr, Attributes attributes) {
        super(attributes);
        this.expr = expr;
    }

    public Expr getExpr() {
        return expr;
    }

    protected abstract String getKeyword();

    @Override
    public List<Expr> getChildren() {
        return Collections.singletonList(expr);
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append(getKeyword()).append(" ").append(getAttributes());
        expr.print(sb);
        sb.append(";");
    }
}
