package net.vcc.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import net.vcc.api.parser.ParserException;
import net.vcc.graph.ClassEntity;
import net.vcc.graph.FunctionEntity;
import net.vcc.graph.ObjectEntity;
import net.vcc.graph.ObjectExpression;
import net.vcc.graph.OperatorExpression;
import net.vcc.graph.OperatorType;
import net.vcc.graph.PackageEntity;
import net.vcc.graph.ReturnStatement;
import net.vcc.lexer.Token;
import net.vcc.lexer.TokenType;

/**
 * Converts a list of tokens into a program graph.
 *
 * The parser is a state machine with the following properties:
 * <ul>
 * <li>A cursor into the token list designates the current token. It only
 *     ever moves forward, and never past the terminating END token.</li>
 * <li>Every transition consumes zero or one tokens.</li>
 * <li>A token the current state does not expect aborts the run with an
 *     {@link UnexpectedTokenException}; there is no recovery.</li>
 * <li>While the graph is being built, the entities new entities should
 *     be attached to (the current function, statement, etc.) are kept in
 *     fields.</li>
 * </ul>
 * Names are resolved immediately: a class or object must have been
 * declared before it is used.
 */
public class Parser {

    public enum State {
        // Start of a new top-level entity
        START,
        // Expecting a function name
        FUNC_NAME,
        // Expecting a function parameter list
        FUNC_PARAMS_START,
        // Expecting a function parameter or an empty parameter list
        FUNC_PARAM_OR_END,
        // Expecting a function parameter, starting with its class
        FUNC_PARAM,
        // Expecting a function parameter name
        FUNC_PARAM_NAME,
        // Expecting another function parameter or the end of the list
        FUNC_PARAMS_NEXT_OR_END,
        // Expecting a function return clause or the function body
        FUNC_RETURN_CLAUSE,
        // Expecting a class in the function return clause
        FUNC_RETURN_TYPE,
        // Expecting a function body
        FUNC_BODY,
        // Expecting a statement or the end of the block
        STATEMENT,
        // Inside an expression, expecting a value
        EXPRESSION_VALUE,
        // Inside an expression, expecting an operator
        EXPRESSION_OPERATOR
    }

    private static final Logger LOGGER = Logger.getLogger("Parser");

    private final List<Token> tokens;
    private final PackageEntity pkg;
    private State state;
    private int index;
    private boolean done;

    private FunctionEntity function;
    private ObjectEntity object;
    private ReturnStatement returnStatement;
    private ObjectExpression objectExpression;
    private OperatorExpression operatorExpression;

    public Parser(List<Token> tokens, PackageEntity pkg) {
        if (tokens == null || pkg == null)
            throw new NullPointerException(
                "Parser arguments may not be null");
        if (tokens.isEmpty() ||
                ! tokens.get(tokens.size() - 1).is(TokenType.END))
            throw new IllegalArgumentException(
                "Token list must be terminated by an end token");
        this.tokens = Collections.unmodifiableList(
            new ArrayList<Token>(tokens));
        this.pkg = pkg;
        this.state = State.START;
        this.index = 0;
        this.done = false;
    }
    public Parser(List<Token> tokens) {
        this(tokens, PackageEntity.createDefault());
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public PackageEntity getPackage() {
        return pkg;
    }

    public State getState() {
        return state;
    }

    public Token getCurrentToken() {
        return tokens.get(index);
    }

    public boolean isDone() {
        return done;
    }

    /**
     * Run the parser to completion, returning the package.
     */
    public PackageEntity run() throws ParserException {
        while (! done) {
            step();
        }
        return pkg;
    }

    /**
     * Perform a single state transition.
     */
    public void step() throws ParserException {
        if (done)
            throw new IllegalStateException("Parser has finished");
        Token token = getCurrentToken();
        switch (state) {
            case START:
                switch (token.getType()) {
                    case END:
                        done = true;
                        break;
                    case FUNC_KEYWORD:
                        function = new FunctionEntity();
                        state = State.FUNC_NAME;
                        advance();
                        break;
                    default:
                        throw unexpected(token);
                }
                break;
            case FUNC_NAME:
                expect(token, TokenType.IDENTIFIER);
                if (pkg.getFunction(token.getContent()) != null)
                    throw new DuplicateNameException(token, "function");
                function.setName(token.getContent());
                pkg.addFunction(function);
                state = State.FUNC_PARAMS_START;
                advance();
                break;
            case FUNC_PARAMS_START:
                expect(token, TokenType.LEFT_PAREN);
                state = State.FUNC_PARAM_OR_END;
                advance();
                break;
            case FUNC_PARAM_OR_END:
                if (token.is(TokenType.RIGHT_PAREN)) {
                    state = State.FUNC_RETURN_CLAUSE;
                    advance();
                } else {
                    state = State.FUNC_PARAM;
                }
                break;
            case FUNC_PARAM:
                expect(token, TokenType.IDENTIFIER);
                object = new ObjectEntity(resolveClass(token));
                state = State.FUNC_PARAM_NAME;
                advance();
                break;
            case FUNC_PARAM_NAME:
                expect(token, TokenType.IDENTIFIER);
                if (function.getObject(token.getContent()) != null)
                    throw new DuplicateNameException(token, "object");
                object.setName(token.getContent());
                function.addObject(object);
                object = null;
                state = State.FUNC_PARAMS_NEXT_OR_END;
                advance();
                break;
            case FUNC_PARAMS_NEXT_OR_END:
                switch (token.getType()) {
                    case COMMA:
                        state = State.FUNC_PARAM;
                        advance();
                        break;
                    case RIGHT_PAREN:
                        state = State.FUNC_RETURN_CLAUSE;
                        advance();
                        break;
                    default:
                        throw unexpected(token);
                }
                break;
            case FUNC_RETURN_CLAUSE:
                if (token.is(TokenType.ARROW)) {
                    state = State.FUNC_RETURN_TYPE;
                    advance();
                } else {
                    state = State.FUNC_BODY;
                }
                break;
            case FUNC_RETURN_TYPE:
                expect(token, TokenType.IDENTIFIER);
                function.returnsValue(resolveClass(token));
                state = State.FUNC_BODY;
                advance();
                break;
            case FUNC_BODY:
                expect(token, TokenType.LEFT_CURLY);
                state = State.STATEMENT;
                advance();
                break;
            case STATEMENT:
                switch (token.getType()) {
                    case RIGHT_CURLY:
                        LOGGER.fine("Parsed function " + function.getName() +
                            " with " + function.getObjects().size() +
                            " parameters and " +
                            function.getStatements().size() +
                            " statements");
                        function = null;
                        state = State.START;
                        advance();
                        break;
                    case RETURN_KEYWORD:
                        returnStatement = new ReturnStatement();
                        function.addStatement(returnStatement);
                        state = State.EXPRESSION_VALUE;
                        advance();
                        break;
                    default:
                        throw unexpected(token);
                }
                break;
            case EXPRESSION_VALUE:
                switch (token.getType()) {
                    case IDENTIFIER:
                        objectExpression = new ObjectExpression(
                            resolveObject(token));
                        state = State.EXPRESSION_OPERATOR;
                        advance();
                        break;
                    case SEMICOLON:
                        // Only a bare "return;" may end here.
                        if (operatorExpression != null)
                            throw unexpected(token);
                        returnStatement = null;
                        state = State.STATEMENT;
                        advance();
                        break;
                    default:
                        throw unexpected(token);
                }
                break;
            case EXPRESSION_OPERATOR:
                switch (token.getType()) {
                    case SEMICOLON:
                        if (operatorExpression != null) {
                            operatorExpression.addOperand(objectExpression);
                            returnStatement.setExpression(
                                operatorExpression);
                        } else {
                            returnStatement.setExpression(objectExpression);
                        }
                        objectExpression = null;
                        operatorExpression = null;
                        returnStatement = null;
                        state = State.STATEMENT;
                        advance();
                        break;
                    case PLUS:
                        foldOperator(OperatorType.PLUS);
                        state = State.EXPRESSION_VALUE;
                        advance();
                        break;
                    default:
                        throw unexpected(token);
                }
                break;
        }
    }

    /**
     * Start a new operator expression on top of what has been parsed so
     * far. The just-completed operand closes the pending operator
     * expression, which then becomes the first operand of the new one;
     * this makes chains associate to the left.
     */
    private void foldOperator(OperatorType type) {
        OperatorExpression next = new OperatorExpression(type);
        if (operatorExpression != null) {
            operatorExpression.addOperand(objectExpression);
            next.addOperand(operatorExpression);
        } else {
            next.addOperand(objectExpression);
        }
        operatorExpression = next;
        objectExpression = null;
    }

    private ClassEntity resolveClass(Token token)
            throws UnresolvedNameException {
        ClassEntity ret = pkg.getClassEntity(token.getContent());
        if (ret == null) throw new UnresolvedNameException(token, "class");
        return ret;
    }

    private ObjectEntity resolveObject(Token token)
            throws UnresolvedNameException {
        ObjectEntity ret = function.getObject(token.getContent());
        if (ret == null) throw new UnresolvedNameException(token, "object");
        return ret;
    }

    private void expect(Token token, TokenType type)
            throws UnexpectedTokenException {
        if (! token.is(type)) throw unexpected(token);
    }

    private UnexpectedTokenException unexpected(Token token) {
        return new UnexpectedTokenException(token);
    }

    // The end token is never advanced past, so it can be re-checked.
    private void advance() {
        if (getCurrentToken().is(TokenType.END)) return;
        index++;
    }

}
