package net.vcc.util.argparse;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal command-line parser.
 *
 * Options are given as "--name" or "-x" and take at most one value (the
 * next argument). Everything else is assigned to the positional arguments
 * in order; "--" ends option processing. The result maps option and
 * argument names to their values (null for options without a value).
 */
public class ArgParser {

    public static class ParsingException extends Exception {

        public ParsingException(String message) {
            super(message);
        }

    }

    public abstract static class Parameter {

        private final String name;
        private final String description;

        protected Parameter(String name, String description) {
            if (name == null)
                throw new NullPointerException(
                    "Parameter name may not be null");
            this.name = name;
            this.description = description;
        }

        public String getName() {
            return name;
        }

        public String getDescription() {
            return description;
        }

        /**
         * How the parameter is referred to in error messages.
         */
        public abstract String getFullName();

        /**
         * How the parameter is shown in the usage line and help table.
         */
        public abstract String getLabel();

    }

    public static class Option extends Parameter {

        private final Character letter;
        private final String placeholder;

        public Option(String name, Character letter, String placeholder,
                      String description) {
            super(name, description);
            this.letter = letter;
            this.placeholder = placeholder;
        }

        public Character getLetter() {
            return letter;
        }

        /**
         * The value's stand-in in help texts, or null for flags.
         */
        public String getPlaceholder() {
            return placeholder;
        }

        public boolean takesValue() {
            return (placeholder != null);
        }

        public String getFullName() {
            return "option --" + getName();
        }

        public String getLabel() {
            String ret = "--" + getName();
            if (letter != null) ret += "|-" + letter;
            if (takesValue()) ret += " " + placeholder;
            return ret;
        }

    }

    public static class Argument extends Parameter {

        private final boolean optional;

        public Argument(String name, boolean optional, String description) {
            super(name, description);
            this.optional = optional;
        }

        public boolean isOptional() {
            return optional;
        }

        public String getFullName() {
            return "argument " + getLabel();
        }

        public String getLabel() {
            return "<" + getName() + ">";
        }

    }

    private final String programName;
    private final Map<String, Option> options;
    private final Map<Character, Option> letters;
    private final List<Argument> arguments;

    public ArgParser(String programName) {
        this.programName = programName;
        this.options = new LinkedHashMap<String, Option>();
        this.letters = new HashMap<Character, Option>();
        this.arguments = new ArrayList<Argument>();
    }

    /**
     * Declare an option taking a value, shown as placeholder in the help.
     */
    public Option addOption(String name, Character letter, String placeholder,
                            String description) {
        if (options.containsKey(name))
            throw new IllegalArgumentException("Duplicate option --" + name);
        if (letter != null && letters.containsKey(letter))
            throw new IllegalArgumentException("Duplicate option -" +
                                               letter);
        Option opt = new Option(name, letter, placeholder, description);
        options.put(name, opt);
        if (letter != null) letters.put(letter, opt);
        return opt;
    }
    public Option addFlag(String name, Character letter,
                          String description) {
        return addOption(name, letter, null, description);
    }

    public Argument addArgument(String name, boolean optional,
                                String description) {
        Argument arg = new Argument(name, optional, description);
        arguments.add(arg);
        return arg;
    }

    public void writeUsage(PrintWriter drain) {
        drain.append("USAGE: ").append(programName);
        for (Option opt : options.values()) {
            drain.append(" [").append(opt.getLabel()).append("]");
        }
        for (Argument arg : arguments) {
            drain.append(" ").append((arg.isOptional()) ?
                "[" + arg.getLabel() + "]" : arg.getLabel());
        }
        drain.println();
    }

    public void writeHelp(PrintWriter drain) {
        List<Parameter> params = new ArrayList<Parameter>(options.values());
        params.addAll(arguments);
        int width = 0;
        for (Parameter p : params) {
            width = Math.max(width, helpLabel(p).length());
        }
        String format = "%-" + Math.max(width, 1) + "s : %s%n";
        for (Parameter p : params) {
            drain.printf(format, helpLabel(p), p.getDescription());
        }
    }

    public String formatHelp() {
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        writeUsage(pw);
        writeHelp(pw);
        pw.flush();
        return sw.toString();
    }

    public Map<String, String> parse(Iterable<String> values)
            throws ParsingException {
        Map<String, String> ret = new LinkedHashMap<String, String>();
        Iterator<String> it = values.iterator();
        Iterator<Argument> pending = arguments.iterator();
        boolean optionsDone = false;
        while (it.hasNext()) {
            String value = it.next();
            if (! optionsDone && value.equals("--")) {
                optionsDone = true;
            } else if (! optionsDone && isOption(value)) {
                Option opt = lookupOption(value);
                ret.put(opt.getName(), readValue(opt, it));
            } else if (pending.hasNext()) {
                ret.put(pending.next().getName(), value);
            } else {
                throw new ParsingException("Superfluous argument " + value);
            }
        }
        while (pending.hasNext()) {
            Argument arg = pending.next();
            if (! arg.isOptional())
                throw new ParsingException("Missing value for required " +
                    arg.getFullName());
        }
        return ret;
    }
    public Map<String, String> parse(String... values)
            throws ParsingException {
        return parse(Arrays.asList(values));
    }

    private Option lookupOption(String value) throws ParsingException {
        Option ret;
        if (value.startsWith("--")) {
            ret = options.get(value.substring(2));
        } else if (value.length() == 2) {
            ret = letters.get(value.charAt(1));
        } else {
            ret = null;
        }
        if (ret == null)
            throw new ParsingException("Unrecognized option " + value);
        return ret;
    }

    private static boolean isOption(String value) {
        // A lone "-" conventionally names standard input.
        return value.startsWith("-") && value.length() > 1;
    }

    private static String readValue(Option opt, Iterator<String> it)
            throws ParsingException {
        if (! opt.takesValue()) return null;
        if (! it.hasNext())
            throw new ParsingException("Missing required value for " +
                opt.getFullName());
        return it.next();
    }

    private static String helpLabel(Parameter p) {
        return (p instanceof Argument) ? p.getLabel() + ":" : p.getLabel();
    }

}
