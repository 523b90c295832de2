package ivl.exec;

import ivl.base.ProgramParser;
import ivl.hir.PrintTools;
import ivl.hir.Program;
import ivl.hir.Tools;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Implements the command line parser and the option-file handling shared by
 * the tools built on the IVL layer. Derived classes register their own
 * options in their constructor, override {@link #runPasses} and pass an
 * instance of themselves to {@link #run}. Derived classes have access to a
 * protected {@link Program} object.
 */
public class Driver {

    /** The set of options of the running tool. */
    protected static CommandLineOptionSet options = new CommandLineOptionSet();

    /** Input files given on the command line. */
    protected List<String> filenames;

    /** The program being processed. */
    protected Program program;

    protected Driver() {
        options = new CommandLineOptionSet();
        filenames = new ArrayList<String>();

        options.add(options.UTILITY, "help",
            "Print this message");
        options.add(options.UTILITY, "version",
            "Print the version information");
        options.add(options.UTILITY, "dump-options",
            "Create file options.cfg with default options");
        options.add(options.UTILITY, "verbosity", "0", "N",
            "Degree of status messages (0-4) that you wish to see (default is 0)");
        options.add(options.UTILITY, "optionsFile", "FILE",
            "Read options from FILE, one option per line; options given on the command line take precedence");
        options.add(options.UTILITY, "outfile", "FILE",
            "Write the transformed program to FILE instead of standard output");
    }

    /**
     * Parses command line options and input files. Options have the form
     * <b>-name</b> or <b>-name=value</b>; every other argument is an input
     * file.
     *
     * @param args the command line.
     */
    public void parseCommandLine(String[] args) {
        for (String arg : args) {
            if (arg.length() > 1 && arg.charAt(0) == '-') {
                String opt = arg.substring(1);
                int eq = opt.indexOf('=');
                String option_name = (eq == -1) ? opt : opt.substring(0, eq);
                if (!options.contains(option_name)) {
                    commandLineError("unrecognized option " + arg);
                    return;
                }
                if (eq == -1) {
                    /* no value on the command line, so just turn it on */
                    options.setValue(option_name);
                } else {
                    options.setValue(option_name, opt.substring(eq + 1));
                }
            } else {
                filenames.add(arg);
            }
        }
        String verbosity = getOptionValue("verbosity");
        if (verbosity != null) {
            try {
                PrintTools.setVerbosity(Integer.parseInt(verbosity));
            } catch (NumberFormatException e) {
                commandLineError("-verbosity expects an integer, found " + verbosity);
            }
        }
    }

    /**
     * Reads the file named by <b>-optionsFile</b>. Blank lines and lines
     * starting with <b>#</b> are ignored. Values already set on the command
     * line win over values in the file.
     */
    protected void parseOptionsFile() {
        String value = getOptionValue("optionsFile");
        if (value == null) {
            return;
        }
        if (value.equals("1")) {
            PrintTools.printlnWarning("no options file is specified; optionsFile option will be ignored.");
            return;
        }
        try (BufferedReader br = new BufferedReader(new FileReader(value))) {
            String inputLine = null;
            while ((inputLine = br.readLine()) != null) {
                String opt = inputLine.trim();
                if (opt.length() == 0 || opt.charAt(0) == '#') {
                    continue;
                }
                if (opt.charAt(0) == '-') {
                    opt = opt.substring(1);
                }
                int eq = opt.indexOf('=');
                String option_name = (eq == -1) ? opt : opt.substring(0, eq);
                if (!options.contains(option_name)) {
                    PrintTools.printlnWarning("ignoring unrecognized option " + option_name
                            + " in " + value);
                    continue;
                }
                // Commandline input has higher priority than this configuration input.
                if (getOptionValue(option_name) != null && !option_name.equals("verbosity")) {
                    continue;
                }
                if (eq == -1) {
                    options.setValue(option_name);
                } else {
                    options.setValue(option_name, opt.substring(eq + 1));
                }
            }
        } catch (IOException e) {
            commandLineError("could not read options file " + value + ": " + e.getMessage());
        }
    }

    /**
     * Handles utility options (help, version, dump-options) and reports
     * whether the tool should continue.
     */
    protected boolean handleUtilityOptions() {
        if (getOptionValue("help") != null) {
            printUsage();
            return false;
        }
        if (getOptionValue("version") != null) {
            printVersion();
            return false;
        }
        if (getOptionValue("dump-options") != null) {
            setOptionValue("dump-options", null);
            dumpOptionsFile();
            return false;
        }
        return true;
    }

    /** Parses the single input file into {@link #program}. */
    protected void parseFiles() throws IOException {
        if (filenames.size() != 1) {
            commandLineError("exactly one input file expected, found " + filenames.size());
            return;
        }
        program = ProgramParser.parseFile(new File(filenames.get(0)));
    }

    /** Runs the passes of the tool; the default does nothing. */
    public void runPasses() {
    }

    /**
     * Reports a command line error and exits. Derived classes may override
     * this to select their own exit status.
     */
    protected void commandLineError(String msg) {
        Tools.exit("[ERROR] " + msg, 1);
    }

    /** Returns the name printed by -help and -version. */
    protected String getToolName() {
        return getClass().getName();
    }

    /** Returns the version printed by -version. */
    protected String getVersion() {
        return "unknown";
    }

    /**
     * Prints the list of options that the tool accepts.
     */
    public void printUsage() {
        String usage = PrintTools.line_sep + getToolName() + " [option]... [file]" + PrintTools.line_sep;
        usage += options.getUsage();
        System.err.println(usage);
    }

    public void printVersion() {
        System.err.println(getToolName() + " " + getVersion());
    }

    /** Writes options.cfg with the current values of all options. */
    public void dumpOptionsFile() {
        File file = new File("options.cfg");
        try (PrintWriter out = new PrintWriter(file, "UTF-8")) {
            out.print(options.dumpOptions());
        } catch (IOException e) {
            commandLineError("could not write " + file + ": " + e.getMessage());
        }
    }

    /**
     * Returns the value of the given key or null if the value is not set.
     * Key values are set on the command line as <b>-option_name=value</b>.
     *
     * @param key the option name.
     * @return the value of the option, or null.
     */
    public static String getOptionValue(String key) {
        return options.getValue(key);
    }

    /** Sets the value of the option represented by key. */
    public static void setOptionValue(String key, String value) {
        options.setValue(key, value);
    }

    public Program getProgram() {
        return program;
    }
}
