package ivl.hir;

import java.util.Arrays;
import java.util.List;

/**
 * Base class of all expressions. Expressions print themselves in the
 * concrete IVL syntax, inserting parentheses only where operator precedence
 * requires them, so that printing and re-parsing yields an equal tree.
 */
public abstract class Expr implements Traversable, Cloneable {

    /** Precedence of atoms and postfix forms. */
    protected static final int PREC_ATOM = 10;
    /** Precedence of prefix operators. */
    protected static final int PREC_UNARY = 9;
    /** Precedence of the conditional expression. */
    protected static final int PREC_ITE = 0;

    private Position position = Position.NONE;

    public abstract ExprKind getKind();

    /** Returns the type of this expression, or null if it cannot be derived. */
    public abstract Type getType();

    @Override
    public abstract List<Expr> getChildren();

    /** Deep copy. Identifier bindings are shared, not copied. */
    @Override
    public abstract Expr clone();

    protected abstract int precedence();

    public abstract void print(StringBuilder sb);

    public Position getPosition() {
        return position;
    }

    public void setPosition(Position position) {
        this.position = (position == null) ? Position.NONE : position;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb);
        return sb.toString();
    }

    protected static void printOperand(StringBuilder sb, Expr e, int min_prec) {
        if (e.precedence() < min_prec) {
            sb.append("(");
            e.print(sb);
            sb.append(")");
        } else {
            e.print(sb);
        }
    }

    protected static List<Expr> children(Expr... exprs) {
        return Arrays.asList(exprs);
    }

    /* Builders with the trivial simplifications the transformations rely on. */

    public static Expr and(Expr a, Expr b) {
        if (isTrue(a)) {
            return b;
        }
        if (isTrue(b)) {
            return a;
        }
        return new BinaryExpr(BinaryOperator.AND, a, b);
    }

    public static Expr or(Expr a, Expr b) {
        if (isFalse(a)) {
            return b;
        }
        if (isFalse(b)) {
            return a;
        }
        return new BinaryExpr(BinaryOperator.OR, a, b);
    }

    public static Expr implies(Expr a, Expr b) {
        if (isTrue(a)) {
            return b;
        }
        return new BinaryExpr(BinaryOperator.IMPLIES, a, b);
    }

    public static Expr not(Expr a) {
        if (isTrue(a)) {
            return LiteralExpr.FALSE;
        }
        if (isFalse(a)) {
            return LiteralExpr.TRUE;
        }
        return new UnaryExpr(UnaryOperator.NOT, a);
    }

    public static Expr eq(Expr a, Expr b) {
        return new BinaryExpr(BinaryOperator.EQ, a, b);
    }

    public static Expr neq(Expr a, Expr b) {
        return new BinaryExpr(BinaryOperator.NEQ, a, b);
    }

    public static Expr ite(Expr c, Expr t, Expr e) {
        return new IfThenElseExpr(c, t, e);
    }

    public static boolean isTrue(Expr e) {
        return (e instanceof LiteralExpr) && ((LiteralExpr)e).isTrue();
    }

    public static boolean isFalse(Expr e) {
        return (e instanceof LiteralExpr) && ((LiteralExpr)e).isFalse();
    }
}
