package ivl.hir;

/** The command ending a basic block. */
public abstract class TransferCmd implements Cloneable {

    private Position position = Position.NONE;

    public Position getPosition() {
        return position;
    }

    public void setPosition(Position position) {
        this.position = (position == null) ? Position.NONE : position;
    }

    @Override
    public abstract TransferCmd clone();

    public abstract void print(StringBuilder sb);

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb);
        return sb.toString();
    }
}
