package ivl.hir;

/**
 * A position in an intermediate program file, recorded by the parser on
 * every declaration and command. Diagnosis falls back to it when the
 * side-table of source locations cannot be consulted.
 */
public final class Position {

    /** Position of synthesized IR that has no textual origin. */
    public static final Position NONE = new Position("", 0, 0);

    private final String file;
    private final int line;
    private final int column;

    public Position(String file, int line, int column) {
        this.file = (file == null) ? "" : file;
        this.line = line;
        this.column = column;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return file + "(" + line + "," + column + ")";
    }
}
