package ivl.exec;

import java.util.*;
import ivl.hir.PrintTools;

/**
* Class for registering and managing information of options.
*/
public class CommandLineOptionSet {

    public final int UTILITY = 1;
    public final int ANALYSIS = 2;
    public final int TRANSFORM = 3;
    public final int DIAGNOSIS = 4;
    private final String[] type_name =
            {"UTILITY", "ANALYSIS", "TRANSFORM", "DIAGNOSIS"};

    private static class OptionRecord {

        int option_type;
        String value;
        // example argument printed in the usage, null for flags
        String arg;
        String usage;
        // value used when the option is turned on without a value
        String value_on;

        OptionRecord(int type, String value, String arg, String usage) {
            this.option_type = type;
            this.value = value;
            this.arg = arg;
            this.usage = usage;
            this.value_on = null;
        }
    }

    /** Storage for the entire set of options. */
    private final TreeMap<String, OptionRecord> name_to_record;

    /** Default constructor */
    public CommandLineOptionSet() {
        name_to_record = new TreeMap<String, OptionRecord>();
    }

    /**
    * Registers a new UTILITY flag with the given usage information.
    * @param name the name of the option.
    * @param usage the usage of the option.
    */
    public void add(String name, String usage) {
        add(UTILITY, name, null, null, usage);
    }

    /**
    * Registers a new flag with the given type and usage information.
    * @param type the category to which the option belongs.
    * @param name the name of the option.
    * @param usage the usage of the option.
    */
    public void add(int type, String name, String usage) {
        add(type, name, null, null, usage);
    }

    /**
    * Registers a new option with the given type, argument, and usage.
    * @param type the category to which the option belongs.
    * @param name the name of the option.
    * @param arg the argument allowed for the option.
    * @param usage the usage of the option.
    */
    public void add(int type, String name, String arg, String usage) {
        add(type, name, null, arg, usage);
    }

    /**
    * Registers a new option with the given type, default value, argument,
    * and usage.
    * @param type the category to which the option belongs.
    * @param name the name of the option.
    * @param value the default value of the option.
    * @param arg the argument allowed for the option.
    * @param usage the usage of the option.
    */
    public void add(int type, String name, String value, String arg, String usage) {
        name_to_record.put(name, new OptionRecord(type, value, arg, usage));
    }

    /**
    * Registers a new option with the given type, value, turn-on value,
    * argument, and usage.
    * @param value_on the value used when the option is turned on without
    *                 a value.
    */
    public void add(int type, String name,
                    String value, String value_on, String arg, String usage) {
        OptionRecord record = new OptionRecord(type, value, arg, usage);
        record.value_on = value_on;
        name_to_record.put(name, record);
    }

    /**
    * Checks if the option set contains an option with the specified name.
    * @param name the name to be searched for.
    * @return true if such an option exists.
    */
    public boolean contains(String name) {
        return name_to_record.containsKey(name);
    }

    /**
    * Returns a string dump of the options in the format accepted by an
    * options file.
    */
    public String dumpOptions() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
            OptionRecord record = entry.getValue();
            sb.append("#Option: ").append(entry.getKey()).append("\n#");
            sb.append(entry.getKey());
            if (record.arg != null) {
                sb.append("=").append(record.arg);
            }
            sb.append("\n#").append(record.usage.replaceAll("\n", "\n#")).append("\n");
            if (record.value == null) {
                sb.append("#");
            }
            sb.append(entry.getKey());
            if (record.value != null) {
                sb.append("=").append(record.value);
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    /**
    * Returns the usage information for the entire option set.
    */
    public String getUsage() {
        StringBuilder sb = new StringBuilder(4000);
        String sep = PrintTools.line_sep;
        for (int j = UTILITY; j <= DIAGNOSIS; j++) {
            String usage = getUsage(j);
            if (usage.isEmpty()) {
                continue;
            }
            for (int i = 0; i < 80; i++) sb.append("-");
            sb.append(sep).append(type_name[j-1]).append(sep);
            for (int i = 0; i < 80; i++) sb.append("-");
            sb.append(sep).append(usage);
        }
        return sb.toString();
    }

    /**
    * Returns the usage information for the specified option type.
    */
    public String getUsage(int type) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
            OptionRecord record = entry.getValue();
            if (record.option_type == type) {
                sb.append("-").append(entry.getKey());
                if (record.arg != null) {
                    sb.append("=").append(record.arg);
                }
                sb.append("\n    ").append(record.usage).append("\n\n");
            }
        }
        return sb.toString();
    }

    /**
    * Returns the value of the specified option name.
    */
    public String getValue(String name) {
        OptionRecord record = name_to_record.get(name);
        if (record == null) {
            return null;
        } else {
            return record.value;
        }
    }

    /**
    * Sets a new value for the specified option name.
    */
    public void setValue(String name, String value) {
        OptionRecord record = name_to_record.get(name);
        if (record != null) {
            record.value = value;
        }
    }

    /**
    * Turns on the option with its predefined value. This is necessary for a
    * case where user does not specify a value but just turns on the option.
    */
    public void setValue(String name) {
        OptionRecord record = name_to_record.get(name);
        if (record != null) {
            if (record.value_on == null) {
                record.value = "1";
            } else {
                record.value = record.value_on;
            }
        }
    }

    /**
    * Returns the type of the specified option name.
    */
    public int getType(String name) {
        OptionRecord record = name_to_record.get(name);
        if (record == null) {
            return 0;
        } else {
            return record.option_type;
        }
    }
}
