package net.vcc;

import java.util.List;
import java.util.logging.Logger;
import net.vcc.api.parser.ParserException;
import net.vcc.graph.PackageEntity;
import net.vcc.lexer.Lexer;
import net.vcc.lexer.LexerException;
import net.vcc.lexer.Token;
import net.vcc.parser.Parser;
import net.vcc.util.config.Configuration;
import net.vcc.util.config.DynamicConfiguration;

/**
 * Runs the front end phases over a source text.
 * Lexing completes before parsing starts; failures are reported as
 * exceptions and never terminate the process.
 */
public class Compiler {

    public static final String KEY_TAB_SIZE = "vcc.tabSize";
    public static final String KEY_LOG_LEVEL = "vcc.logLevel";

    private static final Logger LOGGER = Logger.getLogger("Compiler");

    private int tabSize;

    public Compiler() {
        tabSize = Lexer.DEFAULT_TAB_SIZE;
    }
    public Compiler(Configuration config) {
        this();
        configure(config);
    }

    public int getTabSize() {
        return tabSize;
    }
    public void setTabSize(int ts) {
        if (ts <= 0)
            throw new IllegalArgumentException("Invalid tab size " + ts);
        tabSize = ts;
    }

    public void configure(Configuration config) {
        DynamicConfiguration view;
        if (config instanceof DynamicConfiguration) {
            view = (DynamicConfiguration) config;
        } else {
            view = new DynamicConfiguration();
            view.addSource(config);
        }
        setTabSize(view.getInt(KEY_TAB_SIZE, tabSize));
    }

    public List<Token> tokenize(String source) throws LexerException {
        Lexer lexer = new Lexer(source);
        lexer.setTabSize(tabSize);
        return lexer.run();
    }

    public Compilation compile(String source) throws ParserException {
        List<Token> tokens = tokenize(source);
        PackageEntity pkg = new Parser(tokens).run();
        LOGGER.fine("Compiled package " + pkg.getName() + " with " +
            pkg.getFunctions().size() + " functions");
        return new Compilation(tokens, pkg);
    }

}
