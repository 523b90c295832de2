package ivl.hir;

public class Requires extends Specification {

    public Requires(boolean free, Expr condition, Attributes attributes) {
        super(free, condition, attributes);
    }

    @Override
    protected String getKeyword() {
        return "requires";
    }
}
