package ivl.hir;

import java.util.List;

public class UnaryExpr extends Expr {

    private final UnaryOperator op;
    private final Expr operand;

    public UnaryExpr(UnaryOperator op, Expr operand) {
        this.op = op;
        this.operand = operand;
    }

    public UnaryOperator getOperator() {
        return op;
    }

    public Expr getOperand() {
        return operand;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.UNARY;
    }

    @Override
    public Type getType() {
        return (op == UnaryOperator.NOT) ? BasicType.BOOL : operand.getType();
    }

    @Override
    public List<Expr> getChildren() {
        return children(operand);
    }

    @Override
    public UnaryExpr clone() {
        UnaryExpr o = new UnaryExpr(op, operand.clone());
        o.setPosition(getPosition());
        return o;
    }

    @Override
    protected int precedence() {
        return PREC_UNARY;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append(op.getSymbol());
        printOperand(sb, operand, PREC_UNARY);
    }
}
