package ivl.hir;

/** Process-level helpers. */
public final class Tools {

    private Tools() {
    }

    /** Prints the message to standard error and exits with status 1. */
    public static void exit(String msg) {
        System.err.println(msg);
        System.exit(1);
    }

    /** Prints the message to standard error and exits with the given status. */
    public static void exit(String msg, int status) {
        System.err.println(msg);
        System.exit(status);
    }

    public static void exit(int status) {
        System.exit(status);
    }
}
