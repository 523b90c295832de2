package ivl.base;

import ivl.hir.Position;

/** Thrown when an intermediate program is syntactically or semantically malformed. */
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Position position;

    public ParseException(String message, Position position) {
        super(position + ": " + message);
        this.position = position;
    }

    public Position getPosition() {
        return position;
    }
}
