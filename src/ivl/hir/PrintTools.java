package ivl.hir;

import java.util.Collection;
import java.util.Iterator;

/**
* Tools for printing diagnostic messages at a selected verbosity level.
* Level 0 messages are always printed.
*/
public final class PrintTools {

    /** Platform line separator. */
    public static final String line_sep = System.getProperty("line.separator");

    private static int verbosity = 0;

    private PrintTools() {
    }

    public static int getVerbosity() {
        return verbosity;
    }

    public static void setVerbosity(int level) {
        verbosity = level;
    }

    /**
    * Prints a string to standard error if the verbosity level is high
    * enough, followed by a line separator.
    */
    public static void println(String s, int min_verbosity) {
        if (verbosity >= min_verbosity) {
            System.err.println(s);
        }
    }

    public static void print(String s, int min_verbosity) {
        if (verbosity >= min_verbosity) {
            System.err.print(s);
        }
    }

    /** Prints a status line to standard output. */
    public static void printlnStatus(String s, int min_verbosity) {
        if (verbosity >= min_verbosity) {
            System.out.println(s);
        }
    }

    /** Prints a level-0 warning. */
    public static void printlnWarning(String s) {
        println("[WARNING] " + s, 0);
    }

    /**
    * Converts a collection of objects to a string with the given separator.
    */
    public static String listToString(Collection<?> coll, String separator) {
        StringBuilder sb = new StringBuilder(80);
        Iterator<?> iter = coll.iterator();
        if (iter.hasNext()) {
            sb.append(iter.next());
            while (iter.hasNext()) {
                sb.append(separator).append(iter.next());
            }
        }
        return sb.toString();
    }
}
