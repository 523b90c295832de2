package ivl.hir;

import java.util.List;

/** Base class of top-level and local declarations. */
public abstract class Declaration implements Traversable {

    private Position position = Position.NONE;
    private Attributes attributes;

    protected Declaration(Attributes attributes) {
        this.attributes = (attributes == null) ? new Attributes() : attributes;
    }

    /** Returns the declared name, or null for anonymous declarations. */
    public abstract String getName();

    public abstract void print(StringBuilder sb);

    public Attributes getAttributes() {
        return attributes;
    }

    public void setAttributes(Attributes attributes) {
        this.attributes = (attributes == null) ? new Attributes() : attributes;
    }

    public Position getPosition() {
        return position;
    }

    public void setPosition(Position position) {
        this.position = (position == null) ? Position.NONE : position;
    }

    @Override
    public List<? extends Traversable> getChildren() {
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb);
        return sb.toString();
    }
}
