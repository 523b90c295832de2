package ivl.hir;

public class AssumeCmd extends PredicateCmd {

    public AssumeCmd(Expr expr, Attributes attributes) {
        super(expr, attributes);
    }

    public AssumeCmd(Expr expr) {
        this(expr, null);
    }

    @Override
    protected String getKeyword() {
        return "assume";
    }

    @Override
    public AssumeCmd clone() {
        return finishClone(new AssumeCmd(getExpr().clone(), getAttributes().clone()));
    }
}
