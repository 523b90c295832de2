package ivl.hir;

import java.util.List;

public class BinaryExpr extends Expr {

    private final BinaryOperator op;
    private final Expr lhs;
    private final Expr rhs;

    public BinaryExpr(BinaryOperator op, Expr lhs, Expr rhs) {
        this.op = op;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public BinaryOperator getOperator() {
        return op;
    }

    public Expr getLHS() {
        return lhs;
    }

    public Expr getRHS() {
        return rhs;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.BINARY;
    }

    @Override
    public Type getType() {
        if (op.isBoolean() || op.isRelational()) {
            return BasicType.BOOL;
        }
        if (op == BinaryOperator.CONCAT) {
            Type l = lhs.getType();
            Type r = rhs.getType();
            if (l != null && r != null) {
                return Type.getBvType(l.getBvBits() + r.getBvBits());
            }
            return null;
        }
        return lhs.getType();
    }

    @Override
    public List<Expr> getChildren() {
        return children(lhs, rhs);
    }

    @Override
    public BinaryExpr clone() {
        BinaryExpr o = new BinaryExpr(op, lhs.clone(), rhs.clone());
        o.setPosition(getPosition());
        return o;
    }

    @Override
    protected int precedence() {
        return op.getPrecedence();
    }

    @Override
    public void print(StringBuilder sb) {
        int prec = op.getPrecedence();
        printOperand(sb, lhs, op.isRightAssociative() ? prec + 1 : prec);
        sb.append(" ").append(op.getSymbol()).append(" ");
        printOperand(sb, rhs, op.isRightAssociative() ? prec : prec + 1);
    }
}
