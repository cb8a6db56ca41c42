package net.vcc;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.vcc.api.parser.ParserException;
import net.vcc.output.GraphSerializer;
import net.vcc.parser.UnexpectedTokenException;
import net.vcc.util.Logging;
import net.vcc.util.argparse.ArgParser;
import net.vcc.util.config.DynamicConfiguration;
import net.vcc.util.config.PropertiesConfiguration;

/**
 * Command-line driver: reads a source file, runs the front end, and
 * writes the C translation (plus optional debugging dumps).
 */
public class Main implements Runnable {

    public static final String APPNAME = "vcc";
    public static final String VERSION = "0.1.0";
    public static final String DESCRIPTION = "Translates V source code " +
        "into C.";

    public static final int EXIT_OK = 0;
    public static final int EXIT_COMPILE_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    public static final String DEFAULT_LOG_LEVEL = "WARNING";

    private static final int BUFFER_SIZE = 8192;

    private static final Logger LOGGER;

    static {
        Logging.initFormat();
        LOGGER = Logger.getLogger("Main");
    }

    private final String[] args;
    private final InputStream stdin;
    private final PrintStream stdout;
    private final PrintStream stderr;

    public Main(String[] args, InputStream stdin, PrintStream stdout,
                PrintStream stderr) {
        this.args = args;
        this.stdin = stdin;
        this.stdout = stdout;
        this.stderr = stderr;
    }
    public Main(String[] args) {
        this(args, System.in, System.out, System.err);
    }

    protected ArgParser createParser() {
        ArgParser p = new ArgParser(APPNAME);
        p.addFlag("help", '?', "Display help.");
        p.addFlag("version", 'V', "Display version.");
        p.addFlag("tokens", 't', "Print the token list.");
        p.addFlag("graph", 'g', "Print the program graph.");
        p.addFlag("json", 'j', "Print the program graph as JSON.");
        p.addOption("output", 'o', "<FILE>",
                    "Write C code to this file (\"-\" = standard output).");
        p.addOption("tab-size", 'T', "<N>", "Columns per tab stop.");
        p.addOption("config", 'C', "<FILE>", "Configuration file.");
        p.addOption("log-level", 'L', "<LEVEL>", "Logging level.");
        p.addArgument("source", true,
                      "Source file (\"-\" or absent = standard input).");
        return p;
    }

    public void run() {
        System.exit(execute());
    }

    /**
     * Do everything run() does except exiting; returns the exit status.
     */
    public int execute() {
        ArgParser parser = createParser();
        Map<String, String> opts;
        DynamicConfiguration config;
        try {
            opts = parser.parse(args);
            if (opts.containsKey("help")) {
                stderr.print(parser.formatHelp());
                stderr.println(DESCRIPTION);
                return EXIT_OK;
            } else if (opts.containsKey("version")) {
                stderr.println(APPNAME + " " + VERSION);
                return EXIT_OK;
            }
            config = createConfig(opts);
            Logging.redirectToStream(stderr);
            Logging.setLevel(Logging.parseLevel(
                config.get(Compiler.KEY_LOG_LEVEL, DEFAULT_LOG_LEVEL)));
        } catch (ArgParser.ParsingException exc) {
            stderr.println(APPNAME + ": " + exc.getMessage());
            return EXIT_USAGE;
        } catch (IllegalArgumentException exc) {
            stderr.println(APPNAME + ": " + exc.getMessage());
            return EXIT_USAGE;
        } catch (IOException exc) {
            stderr.println(APPNAME + ": cannot read configuration: " +
                           exc.getMessage());
            return EXIT_USAGE;
        }
        String source;
        try {
            source = readSource(opts.get("source"));
        } catch (IOException exc) {
            stderr.println(APPNAME + ": cannot read source: " +
                           exc.getMessage());
            return EXIT_USAGE;
        }
        Compilation result;
        try {
            result = new Compiler(config).compile(source);
        } catch (UnexpectedTokenException exc) {
            if (exc.getDetail() != null)
                LOGGER.fine("Parsing failed: " + exc.getDetail());
            stderr.println("error: " + exc.getMessage());
            return EXIT_COMPILE_ERROR;
        } catch (ParserException exc) {
            stderr.println("error: " + exc.getMessage());
            return EXIT_COMPILE_ERROR;
        } catch (IllegalArgumentException exc) {
            stderr.println(APPNAME + ": " + exc.getMessage());
            return EXIT_USAGE;
        }
        if (opts.containsKey("tokens")) stdout.print(result.formatTokens());
        if (opts.containsKey("graph")) stdout.print(result.formatGraph());
        if (opts.containsKey("json"))
            stdout.println(GraphSerializer.toJSON(result.getPackage())
                           .toString(2));
        try {
            writeOutput(opts.get("output"), result.translate());
        } catch (IOException exc) {
            LOGGER.log(Level.SEVERE, "Could not write output:", exc);
            return EXIT_USAGE;
        }
        return EXIT_OK;
    }

    protected DynamicConfiguration createConfig(Map<String, String> opts)
            throws IOException {
        DynamicConfiguration ret = new DynamicConfiguration();
        String path = opts.get("config");
        if (path != null)
            ret.addSource(PropertiesConfiguration.load(new File(path)));
        ret.addSource(DynamicConfiguration.PROPERTY_SOURCE);
        ret.addSource(DynamicConfiguration.ENV_SOURCE);
        if (opts.get("tab-size") != null)
            ret.put(Compiler.KEY_TAB_SIZE, opts.get("tab-size"));
        if (opts.get("log-level") != null)
            ret.put(Compiler.KEY_LOG_LEVEL, opts.get("log-level"));
        return ret;
    }

    protected String readSource(String path) throws IOException {
        if (path == null || path.equals("-")) {
            LOGGER.fine("Reading source from standard input");
            return readAll(stdin);
        }
        LOGGER.fine("Reading source from " + path);
        InputStream in = new FileInputStream(path);
        try {
            return readAll(in);
        } finally {
            in.close();
        }
    }

    protected void writeOutput(String path, String code) throws IOException {
        if (path == null || path.equals("-")) {
            stdout.print(code);
            stdout.flush();
            return;
        }
        OutputStream os = new FileOutputStream(path);
        try {
            Writer w = new OutputStreamWriter(os, StandardCharsets.UTF_8);
            w.write(code);
            w.flush();
        } finally {
            os.close();
        }
        LOGGER.info("Wrote " + path);
    }

    private static String readAll(InputStream in) throws IOException {
        Reader r = new InputStreamReader(in, StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder();
        char[] buf = new char[BUFFER_SIZE];
        for (;;) {
            int rd = r.read(buf);
            if (rd == -1) break;
            sb.append(buf, 0, rd);
        }
        return sb.toString();
    }

    public static void main(String[] args) {
        new Main(args).run();
    }

}
