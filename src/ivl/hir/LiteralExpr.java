package ivl.hir;

import java.math.BigInteger;
import java.util.List;

/** Boolean, integer and bit-vector literals. */
public class LiteralExpr extends Expr {

    public static final LiteralExpr TRUE = new LiteralExpr(Boolean.TRUE, null, 0);

    public static final LiteralExpr FALSE = new LiteralExpr(Boolean.FALSE, null, 0);

    private final Boolean bool_value;
    private final BigInteger value;
    // 0 for mathematical integers
    private final int bits;

    private LiteralExpr(Boolean bool_value, BigInteger value, int bits) {
        this.bool_value = bool_value;
        this.value = value;
        this.bits = bits;
    }

    public static LiteralExpr bool(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static LiteralExpr integer(BigInteger value) {
        return new LiteralExpr(null, value, 0);
    }

    public static LiteralExpr integer(long value) {
        return integer(BigInteger.valueOf(value));
    }

    /** Bit-vector literal; the value is reduced modulo 2^bits. */
    public static LiteralExpr bv(BigInteger value, int bits) {
        BigInteger modulus = BigInteger.ONE.shiftLeft(bits);
        return new LiteralExpr(null, value.mod(modulus), bits);
    }

    public static LiteralExpr bv(long value, int bits) {
        return bv(BigInteger.valueOf(value), bits);
    }

    public boolean isBool() {
        return bool_value != null;
    }

    public boolean isBv() {
        return bits > 0;
    }

    public boolean isTrue() {
        return Boolean.TRUE.equals(bool_value);
    }

    public boolean isFalse() {
        return Boolean.FALSE.equals(bool_value);
    }

    /** Returns the numeric value, or null for boolean literals. */
    public BigInteger getValue() {
        return value;
    }

    public int getBits() {
        return bits;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.LITERAL;
    }

    @Override
    public Type getType() {
        if (isBool()) {
            return BasicType.BOOL;
        }
        return (bits > 0) ? Type.getBvType(bits) : BasicType.INT;
    }

    @Override
    public List<Expr> getChildren() {
        return null;
    }

    @Override
    public LiteralExpr clone() {
        // literals are immutable
        return this;
    }

    @Override
    protected int precedence() {
        return (value != null && value.signum() < 0) ? PREC_UNARY : PREC_ATOM;
    }

    @Override
    public void print(StringBuilder sb) {
        if (isBool()) {
            sb.append(bool_value.booleanValue() ? "true" : "false");
        } else if (bits > 0) {
            sb.append(value).append("bv").append(bits);
        } else {
            sb.append(value);
        }
    }
}
