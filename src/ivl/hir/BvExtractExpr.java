package ivl.hir;

import java.util.List;

/** Bit-vector extraction <b>e[end:start]</b>, end exclusive. */
public class BvExtractExpr extends Expr {

    private final Expr bitvector;
    private final int end;
    private final int start;

    public BvExtractExpr(Expr bitvector, int end, int start) {
        this.bitvector = bitvector;
        this.end = end;
        this.start = start;
    }

    public Expr getBitvector() {
        return bitvector;
    }

    public int getEnd() {
        return end;
    }

    public int getStart() {
        return start;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.BV_EXTRACT;
    }

    @Override
    public Type getType() {
        return Type.getBvType(end - start);
    }

    @Override
    public List<Expr> getChildren() {
        return children(bitvector);
    }

    @Override
    public BvExtractExpr clone() {
        BvExtractExpr o = new BvExtractExpr(bitvector.clone(), end, start);
        o.setPosition(getPosition());
        return o;
    }

    @Override
    protected int precedence() {
        return PREC_ATOM;
    }

    @Override
    public void print(StringBuilder sb) {
        printOperand(sb, bitvector, PREC_ATOM);
        sb.append("[").append(end).append(":").append(start).append("]");
    }
}
