package ivl.hir;

import java.util.Collections;
import java.util.List;

/**
 * A pre- or postcondition of a procedure. Free clauses are assumed but never
 * checked.
 */
public abstract class Specification implements Traversable {

    private final boolean free;
    private final Expr condition;
    private final Attributes attributes;
    private Position position = Position.NONE;

    protected Specification(boolean free, Expr condition, Attributes attributes) {
        this.free = free;
        this.condition = condition;
        this.attributes = (attributes == null) ? new Attributes() : attributes;
    }

    protected abstract String getKeyword();

    public boolean isFree() {
        return free;
    }

    public Expr getCondition() {
        return condition;
    }

    public Attributes getAttributes() {
        return attributes;
    }

    public Position getPosition() {
        return position;
    }

    public void setPosition(Position position) {
        this.position = (position == null) ? Position.NONE : position;
    }

    @Override
    public List<Expr> getChildren() {
        return Collections.singletonList(condition);
    }

    public void print(StringBuilder sb) {
        if (free) {
            sb.append("free ");
        }
        sb.append(getKeyword()).append(" ").append(attributes);
        condition.print(sb);
        sb.append(";");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb);
        return sb.toString();
    }
}
