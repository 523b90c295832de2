package ivl.hir;

import java.util.List;

/** Base class of the non-transfer commands of a basic block. */
public abstract class Cmd implements Traversable, Cloneable {

    private Position position = Position.NONE;
    private Attributes attributes;

    protected Cmd(Attributes attributes) {
        this.attributes = (attributes == null) ? new Attributes() : attributes;
    }

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

    /** Deep copy, including attributes; the position is shared. */
    @Override
    public abstract Cmd clone();

    public abstract void print(StringBuilder sb);

    @Override
    public abstract List<? extends Traversable> getChildren();

    protected <T extends Cmd> T finishClone(T c) {
        c.setPosition(position);
        return c;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb);
        return sb.toString();
    }
}
