package ivl.hir;

import java.util.Collections;
import java.util.List;

public class Axiom extends Declaration {

    private Expr expr;

    public Axiom(Expr expr, Attributes attributes) {
        super(attributes);
        this.expr = expr;
    }

    @Override
    public String getName() {
        return null;
    }

    public Expr getExpr() {
        return expr;
    }

    public void setExpr(Expr expr) {
        this.expr = expr;
    }

    @Override
    public List<? extends Traversable> getChildren() {
        return Collections.singletonList(expr);
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("axiom ").append(getAttributes());
        expr.print(sb);
        sb.append(";");
    }
}
