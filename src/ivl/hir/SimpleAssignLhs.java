package ivl.hir;

import java.util.Collections;
import java.util.List;

public class SimpleAssignLhs extends AssignLhs {

    private final IdentifierExpr variable;

    public SimpleAssignLhs(IdentifierExpr variable) {
        this.variable = variable;
    }

    @Override
    public IdentifierExpr getAssignedVariable() {
        return variable;
    }

    @Override
    public Expr asExpr() {
        return variable;
    }

    @Override
    public List<Expr> getChildren() {
        return Collections.<Expr>singletonList(variable);
    }

    @Override
    public SimpleAssignLhs clone() {
        return new SimpleAssignLhs(variable.clone());
    }

    @Override
    public void print(StringBuilder sb) {
        variable.print(sb);
    }
}
