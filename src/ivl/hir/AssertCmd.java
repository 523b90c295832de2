package ivl.hir;

public class AssertCmd extends PredicateCmd {

    public AssertCmd(Expr expr, Attributes attributes) {
        super(expr, attributes);
    }

    public AssertCmd(Expr expr) {
        this(expr, null);
    }

    @Override
    protected String getKeyword() {
        return "assert";
    }

    @Override
    public AssertCmd clone() {
        return finishClone(new AssertCmd(getExpr().clone(), getAttributes().clone()));
    }
}
