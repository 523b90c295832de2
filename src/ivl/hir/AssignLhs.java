package ivl.hir;

/**
 * Left-hand side of an assignment: either a variable or an element of a
 * (possibly nested) map variable.
 */
public abstract class AssignLhs implements Traversable, Cloneable {

    /** Returns the variable whose value the assignment changes. */
    public abstract IdentifierExpr getAssignedVariable();

    /** Returns the same location read as an expression. */
    public abstract Expr asExpr();

    @Override
    public abstract AssignLhs clone();

    public abstract void print(StringBuilder sb);

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb);
        return sb.toString();
    }
}
