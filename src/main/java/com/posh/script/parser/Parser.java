package com.posh.script.parser;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.posh.script.parser.Expr.Binary;
import com.posh.script.parser.Expr.BlockLiteral;
import com.posh.script.parser.Expr.Call;
import com.posh.script.parser.Expr.ExprInterface;
import com.posh.script.parser.Expr.GetExpr;
import com.posh.script.parser.Expr.IndexExpr;
import com.posh.script.parser.Expr.Interpolation;
import com.posh.script.parser.Expr.Invoke;
import com.posh.script.parser.Expr.ListLiteral;
import com.posh.script.parser.Expr.Literal;
import com.posh.script.parser.Expr.Logical;
import com.posh.script.parser.Expr.PipelineExpr;
import com.posh.script.parser.Expr.RecordEntry;
import com.posh.script.parser.Expr.RecordLiteral;
import com.posh.script.parser.Expr.Unary;
import com.posh.script.parser.Expr.Variable;
import com.posh.script.parser.Statement.AssignStmt;
import com.posh.script.parser.Statement.ExprStmt;
import com.posh.script.parser.Statement.FunctionStmt;
import com.posh.script.parser.Statement.If;
import com.posh.script.parser.Statement.Parameter;
import com.posh.script.parser.Statement.PipelineStmt;
import com.posh.script.parser.Statement.ReturnStmt;
import com.posh.script.parser.Statement.Stmt;

public class Parser {
    private static final Set<TokenType> KEYWORDS = EnumSet.of(
            TokenType.IF, TokenType.ELSEIF, TokenType.ELSE, TokenType.FUNCTION, TokenType.RETURN);

    // Tokens that may continue an unquoted word argument such as ./data/file-1.txt
    private static final Set<TokenType> BARE_WORD_PARTS = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.DOT, TokenType.SLASH, TokenType.MINUS,
            TokenType.NUMBER, TokenType.STAR, TokenType.IF, TokenType.ELSEIF, TokenType.ELSE,
            TokenType.FUNCTION, TokenType.RETURN);

    private final List<Token> tokens;
    private final String source;
    private int current = 0;

    public Parser(List<Token> tokens) { this(tokens, null); }

    /** With the source text, block literals keep their exact text for display. */
    public Parser(List<Token> tokens, String source) {
        this.tokens = tokens;
        this.source = source;
    }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<>();
        skipTerminators();
        while (!isAtEnd()) {
            statements.add(statement());
            endOfStatement();
            skipTerminators();
        }
        return statements;
    }

    // -------------------------
    // Statements
    // -------------------------

    private Stmt statement() {
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.FUNCTION)) return functionDeclaration();
        if (match(TokenType.RETURN)) return returnStatement();
        if (check(TokenType.VARIABLE) && isAssignOperator(peekNext().type)) return assignment();

        List<ExprInterface> stages = pipeline();
        if (stages.size() == 1) return new ExprStmt(stages.get(0));
        return new PipelineStmt(stages);
    }

    private static boolean isAssignOperator(TokenType t) {
        return t == TokenType.EQUAL || t == TokenType.PLUS_EQUAL || t == TokenType.MINUS_EQUAL;
    }

    private Stmt assignment() {
        Token name = advance();
        Token op = advance();
        skipNewlines();
        ExprInterface value = pipelineExpression();
        if (op.type == TokenType.PLUS_EQUAL || op.type == TokenType.MINUS_EQUAL) {
            TokenType binary = op.type == TokenType.PLUS_EQUAL ? TokenType.PLUS : TokenType.MINUS;
            Token binOp = new Token(binary, op.lexeme.substring(0, 1), null, op.line, op.column);
            value = new Binary(new Variable(name), binOp, value);
        }
        return new AssignStmt(name, value);
    }

    private Stmt ifStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'if'.");
        skipNewlines();
        ExprInterface condition = pipelineExpression();
        skipNewlines();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after if condition.");
        List<Stmt> thenBranch = block();

        int mark = current;
        skipNewlines();
        if (match(TokenType.ELSEIF)) {
            List<Stmt> nested = new ArrayList<>();
            nested.add(ifStatement());
            return new If(condition, thenBranch, nested);
        }
        if (match(TokenType.ELSE)) {
            return new If(condition, thenBranch, block());
        }
        current = mark;
        return new If(condition, thenBranch, null);
    }

    private Stmt functionDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        List<Parameter> params = new ArrayList<>();
        if (match(TokenType.LEFT_PAREN)) params = parameterList();

        skipNewlines();
        consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");
        skipTerminators();
        // param( ... ) as the first body statement
        if (params.isEmpty() && check(TokenType.IDENTIFIER) && peek().lexeme.equalsIgnoreCase("param")
                && peekNext().type == TokenType.LEFT_PAREN) {
            advance();
            advance();
            params = parameterList();
        }
        List<Stmt> body = blockBody();
        return new FunctionStmt(name, params, body);
    }

    // After '('; consumes the closing ')'.
    private List<Parameter> parameterList() {
        List<Parameter> params = new ArrayList<>();
        skipNewlines();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                skipNewlines();
                Token p = consume(TokenType.VARIABLE, "Expect parameter name.");
                ExprInterface def = null;
                if (match(TokenType.EQUAL)) {
                    skipNewlines();
                    def = expression();
                }
                params.add(new Parameter(p, def));
                skipNewlines();
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        return params;
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        ExprInterface value = null;
        if (!isStatementEnd()) value = pipelineExpression();
        return new ReturnStmt(keyword, value);
    }

    private List<Stmt> block() {
        skipNewlines();
        consume(TokenType.LEFT_BRACE, "Expect '{'.");
        return blockBody();
    }

    // After '{'; consumes the closing '}'.
    private List<Stmt> blockBody() {
        List<Stmt> statements = new ArrayList<>();
        skipTerminators();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
            endOfStatement();
            skipTerminators();
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return statements;
    }

    private void endOfStatement() {
        if (isStatementEnd()) return;
        throw error(peek(), "Unexpected token '" + peek().lexeme + "'.");
    }

    private boolean isStatementEnd() {
        return check(TokenType.NEWLINE) || check(TokenType.SEMICOLON)
                || check(TokenType.RIGHT_BRACE) || isAtEnd();
    }

    // -------------------------
    // Pipelines
    // -------------------------

    private List<ExprInterface> pipeline() {
        List<ExprInterface> stages = new ArrayList<>();
        stages.add(commaExpression());
        while (match(TokenType.PIPE)) {
            skipNewlines();
            stages.add(commaExpression());
        }
        return stages;
    }

    private ExprInterface pipelineExpression() {
        List<ExprInterface> stages = pipeline();
        return stages.size() == 1 ? stages.get(0) : new PipelineExpr(stages);
    }

    /** {@code a, b, c} becomes a list literal. */
    private ExprInterface commaExpression() {
        ExprInterface first = expression();
        if (!check(TokenType.COMMA)) return first;
        List<ExprInterface> elements = new ArrayList<>();
        elements.add(first);
        while (match(TokenType.COMMA)) {
            skipNewlines();
            elements.add(expression());
        }
        return new ListLiteral(elements);
    }

    // -------------------------
    // Expressions
    // -------------------------

    public ExprInterface expression() { return or(); }

    private ExprInterface or() {
        ExprInterface expr = and();
        while (match(TokenType.OR)) {
            Token op = previous();
            skipNewlines();
            expr = new Logical(expr, op, and());
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = comparison();
        while (match(TokenType.AND)) {
            Token op = previous();
            skipNewlines();
            expr = new Logical(expr, op, comparison());
        }
        return expr;
    }

    private ExprInterface comparison() {
        ExprInterface expr = additive();
        while (match(TokenType.EQ, TokenType.NE, TokenType.GT, TokenType.LT, TokenType.GE, TokenType.LE)) {
            Token op = previous();
            skipNewlines();
            expr = new Binary(expr, op, additive());
        }
        return expr;
    }

    private ExprInterface additive() {
        ExprInterface expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            skipNewlines();
            expr = new Binary(expr, op, multiplicative());
        }
        return expr;
    }

    private ExprInterface multiplicative() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            skipNewlines();
            expr = new Binary(expr, op, unary());
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.MINUS, TokenType.BANG, TokenType.NOT)) {
            Token op = previous();
            return new Unary(op, unary());
        }
        return postfix();
    }

    private ExprInterface postfix() {
        ExprInterface expr = primary();
        while (true) {
            if (check(TokenType.DOT) && !peek().spaced) {
                advance();
                Token name = advance();
                if (name.type != TokenType.IDENTIFIER && !KEYWORDS.contains(name.type)) {
                    throw error(name, "Expect property name after '.'.");
                }
                expr = new GetExpr(expr, name);
            } else if (check(TokenType.LEFT_BRACKET) && !peek().spaced) {
                Token bracket = advance();
                skipNewlines();
                ExprInterface index = pipelineExpression();
                skipNewlines();
                consume(TokenType.RIGHT_BRACKET, "Expect ']' after index.");
                expr = new IndexExpr(expr, index, bracket);
            } else {
                return expr;
            }
        }
    }

    private ExprInterface primary() {
        if (match(TokenType.NUMBER, TokenType.STRING)) return new Literal(previous().literal);
        if (match(TokenType.TRUE)) return new Literal(Boolean.TRUE);
        if (match(TokenType.FALSE)) return new Literal(Boolean.FALSE);
        if (match(TokenType.NULL)) return new Literal(null);
        if (match(TokenType.INTERPOLATED_STRING)) return interpolation(previous());
        if (match(TokenType.VARIABLE)) return new Variable(previous());

        if (match(TokenType.LEFT_PAREN)) {
            skipNewlines();
            ExprInterface inner = pipelineExpression();
            skipNewlines();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return inner;
        }
        if (match(TokenType.AT_PAREN)) return listLiteral();
        if (match(TokenType.AT_BRACE)) return recordLiteral();
        if (match(TokenType.LEFT_BRACE)) return blockLiteral(previous());
        if (match(TokenType.IDENTIFIER)) return commandCall(previous());
        if (match(TokenType.AMPERSAND)) return invocation(previous());

        throw error(peek(), "Expect expression.");
    }

    private ExprInterface listLiteral() {
        List<ExprInterface> elements = new ArrayList<>();
        skipTerminators();
        while (!check(TokenType.RIGHT_PAREN) && !isAtEnd()) {
            ExprInterface first = expression();
            if (check(TokenType.PIPE) || first instanceof Call) {
                List<ExprInterface> stages = new ArrayList<>();
                stages.add(first);
                while (match(TokenType.PIPE)) {
                    skipNewlines();
                    stages.add(commaExpression());
                }
                // spliced into the list when evaluated
                elements.add(new PipelineExpr(stages));
            } else {
                elements.add(first);
            }
            if (match(TokenType.COMMA)) {
                skipNewlines();
            } else {
                skipTerminators();
            }
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after list.");
        return new ListLiteral(elements);
    }

    private ExprInterface recordLiteral() {
        List<RecordEntry> entries = new ArrayList<>();
        skipTerminators();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            Token key = advance();
            String keyText;
            if (key.type == TokenType.IDENTIFIER || KEYWORDS.contains(key.type)) {
                keyText = key.lexeme;
            } else if (key.type == TokenType.STRING) {
                keyText = (String) key.literal;
            } else if (key.type == TokenType.NUMBER) {
                keyText = Value.formatNumber((Double) key.literal);
            } else {
                throw error(key, "Expect record key.");
            }
            consume(TokenType.EQUAL, "Expect '=' after record key.");
            skipNewlines();
            entries.add(new RecordEntry(keyText, pipelineExpression()));
            endOfStatement();
            skipTerminators();
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after record.");
        return new RecordLiteral(entries);
    }

    private ExprInterface blockLiteral(Token open) {
        List<Stmt> body = blockBody();
        Token close = previous();
        String text;
        if (source != null && open.offset >= 0 && close.offset >= 0) {
            text = source.substring(open.offset, close.offset + 1);
        } else {
            StringBuilder sb = new StringBuilder();
            for (int i = tokens.indexOf(open); i < current; i++) {
                Token t = tokens.get(i);
                if (t.type == TokenType.NEWLINE) continue;
                if (sb.length() > 0 && t.spaced) sb.append(' ');
                sb.append(t.lexeme);
            }
            text = sb.toString();
        }
        return new BlockLiteral(body, text);
    }

    private ExprInterface interpolation(Token token) {
        List<ExprInterface> parts = new ArrayList<>();
        for (Object part : (List<?>) token.literal) {
            if (part instanceof String) {
                parts.add(new Literal(part));
            } else {
                parts.add(embedded((Lexer.Hole) part));
            }
        }
        return new Interpolation(parts);
    }

    private static ExprInterface embedded(Lexer.Hole hole) {
        Parser sub = new Parser(new Lexer(hole.source).tokenize(), hole.source);
        sub.skipTerminators();
        if (sub.isAtEnd()) return new Literal("");
        ExprInterface expr = sub.pipelineExpression();
        sub.skipTerminators();
        if (!sub.isAtEnd()) {
            throw new ParseException(hole.line, 1, "Unexpected token '" + sub.peek().lexeme + "' in string expression.");
        }
        return expr;
    }

    // -------------------------
    // Command calls
    // -------------------------

    private ExprInterface commandCall(Token name) {
        List<ExprInterface> args = new ArrayList<>();
        Map<String, ExprInterface> named = new LinkedHashMap<>();
        commandArguments(args, named);
        return new Call(name, args, named);
    }

    private ExprInterface invocation(Token ampersand) {
        ExprInterface target;
        if (match(TokenType.IDENTIFIER)) {
            target = new Literal(previous().lexeme);
        } else {
            target = postfix();
        }
        List<ExprInterface> args = new ArrayList<>();
        Map<String, ExprInterface> named = new LinkedHashMap<>();
        commandArguments(args, named);
        return new Invoke(ampersand, target, args, named);
    }

    private void commandArguments(List<ExprInterface> args, Map<String, ExprInterface> named) {
        while (true) {
            if (match(TokenType.PARAMETER)) {
                String param = (String) previous().literal;
                if (check(TokenType.PARAMETER) || !startsArgument()) {
                    named.put(param, new Literal(Boolean.TRUE));
                } else {
                    named.put(param, argumentList());
                }
            } else if (startsArgument()) {
                args.add(argumentList());
            } else {
                return;
            }
        }
    }

    private boolean startsArgument() {
        Token t = peek();
        switch (t.type) {
            case NUMBER: case STRING: case INTERPOLATED_STRING: case VARIABLE:
            case TRUE: case FALSE: case NULL:
            case LEFT_PAREN: case AT_PAREN: case AT_BRACE: case LEFT_BRACE:
            case IDENTIFIER:
                return true;
            case MINUS:
                return t.spaced && peekNext().type == TokenType.NUMBER && !peekNext().spaced;
            case DOT:
            case SLASH:
                return t.spaced && !peekNext().spaced && BARE_WORD_PARTS.contains(peekNext().type);
            default:
                return false;
        }
    }

    /** One argument, or several joined by commas into a list. */
    private ExprInterface argumentList() {
        ExprInterface first = commandArgument();
        if (!check(TokenType.COMMA)) return first;
        List<ExprInterface> elements = new ArrayList<>();
        elements.add(first);
        while (match(TokenType.COMMA)) {
            skipNewlines();
            elements.add(commandArgument());
        }
        return new ListLiteral(elements);
    }

    private ExprInterface commandArgument() {
        Token t = peek();
        if (t.type == TokenType.MINUS && peekNext().type == TokenType.NUMBER && !peekNext().spaced) {
            advance();
            return new Literal(-(Double) advance().literal);
        }
        if (t.type == TokenType.IDENTIFIER || t.type == TokenType.DOT || t.type == TokenType.SLASH) {
            return bareWord();
        }
        return postfix();
    }

    // Unquoted word: adjacent tokens with no whitespace between them form one string.
    private ExprInterface bareWord() {
        StringBuilder sb = new StringBuilder(advance().lexeme);
        while (!peek().spaced && BARE_WORD_PARTS.contains(peek().type)) {
            sb.append(advance().lexeme);
        }
        return new Literal(sb.toString());
    }

    // -------------------------
    // Token helpers
    // -------------------------

    private void skipNewlines() {
        while (match(TokenType.NEWLINE)) {
            // skip
        }
    }

    private void skipTerminators() {
        while (match(TokenType.NEWLINE, TokenType.SEMICOLON)) {
            // skip
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token peekNext() { return tokens.get(Math.min(current + 1, tokens.size() - 1)); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseException error(Token token, String message) {
        String where = token.type == TokenType.EOF ? "at end" : "at '" + token.lexeme + "'";
        return new ParseException(token.line, token.column, message + " (" + where + ")");
    }
}
