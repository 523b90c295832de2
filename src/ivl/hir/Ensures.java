package ivl.hir;

public class Ensures extends Specification {

    public Ensures(boolean free, Expr condition, Attributes attributes) {
        super(free, condition, attributes);
    }

    @Override
    protected String getKeyword() {
        return "ensures";
    }
}
