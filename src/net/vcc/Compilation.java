package net.vcc;

import java.util.List;
import net.vcc.graph.PackageEntity;
import net.vcc.lexer.Token;
import net.vcc.output.CTranslator;
import net.vcc.output.GraphPrinter;

/**
 * The products of one successful front end run.
 */
public class Compilation {

    private final List<Token> tokens;
    private final PackageEntity pkg;

    public Compilation(List<Token> tokens, PackageEntity pkg) {
        this.tokens = tokens;
        this.pkg = pkg;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public PackageEntity getPackage() {
        return pkg;
    }

    public String formatTokens() {
        StringBuilder sb = new StringBuilder();
        for (Token tok : tokens) {
            sb.append(tok).append('\n');
        }
        return sb.toString();
    }

    public String formatGraph() {
        return GraphPrinter.print(pkg);
    }

    public String translate() {
        return CTranslator.translate(pkg);
    }

}
