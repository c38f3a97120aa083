package dev.sfn.syntax;

import dev.sfn.exceptions.UnsupportedOperation;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the Python subset accepted in state machine source files.
 * <p>
 * Module level holds only function definitions (optionally decorated) and docstrings.
 * Function bodies hold simple statements, {@code if/elif/else} and {@code try/except}.
 * Expressions cover literals, names, subscripts, attribute access, calls, single
 * comparisons and boolean operators; arithmetic is rejected.
 */
public final class SourceParser {

    private static final Set<String> KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
        "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
        "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
        "return", "try", "while", "with", "yield");
    private static final Set<String> UNSUPPORTED_STATEMENTS = Set.of(
        "assert", "async", "break", "class", "continue", "del", "for", "from", "global",
        "import", "lambda", "nonlocal", "while", "with", "yield");
    private static final Set<String> COMPARISON_OPS = Set.of("==", "!=", "<", "<=", ">", ">=");
    private static final Set<String> AUGMENTED_OPS = Set.of("+=", "-=", "*=", "/=", "%=", "|=", "&=");
    private static final Set<String> ARITHMETIC_OPS = Set.of("+", "-", "*", "/", "%", "//", "**", "@", "|", "&", "^");

    private final List<Token> tokens;
    private int index;

    private SourceParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parse a complete source file.
     *
     * @param moduleName name the module is known by, usually the file stem
     * @param source     the file text
     * @throws UnsupportedOperation on invalid or unsupported syntax
     */
    public static SourceModule parse(String moduleName, String source) {
        var parser = new SourceParser(Tokenizer.tokenize(source));
        return new SourceModule(moduleName, parser.module());
    }

    private List<FunctionDef> module() {
        var functions = new ArrayList<FunctionDef>();
        var names = new HashSet<String>();
        while (!at(Token.Kind.END)) {
            Token token = peek();
            if (token.kind() == Token.Kind.NEWLINE) {
                advance();
            } else if (token.kind() == Token.Kind.STRING) {
                expression();
                expectNewline();
            } else if (token.isOp("@") || token.isName("def")) {
                FunctionDef function = functionDef(decorators());
                if (!names.add(function.name())) {
                    throw new UnsupportedOperation(
                        "Function '%s' is already defined".formatted(function.name()), function.position());
                }
                functions.add(function);
            } else {
                throw new UnsupportedOperation(
                    "Only function definitions are supported at module level", token.position());
            }
        }
        return functions;
    }

    private List<Decorator> decorators() {
        var decorators = new ArrayList<Decorator>();
        while (peek().isOp("@")) {
            var at = advance().position();
            var name = new StringBuilder(identifier());
            while (peek().isOp(".")) {
                advance();
                name.append('.').append(identifier());
            }
            var args = new ArrayList<Expr>();
            var keywords = new ArrayList<Keyword>();
            if (peek().isOp("(")) {
                advance();
                arguments(args, keywords);
            }
            expectNewline();
            decorators.add(new Decorator(name.toString(), args, keywords, at));
        }
        return decorators;
    }

    private FunctionDef functionDef(List<Decorator> decorators) {
        if (!peek().isName("def")) {
            throw syntaxError("expected 'def' after decorator");
        }
        var at = advance().position();
        String name = identifier();
        expectOp("(");
        var params = new ArrayList<String>();
        while (!peek().isOp(")")) {
            params.add(identifier());
            if (peek().isOp(":")) {
                advance();
                expression();
            }
            if (peek().isOp("=")) {
                throw new UnsupportedOperation("Default parameter values are not supported", peek().position());
            }
            if (!peek().isOp(")")) {
                expectOp(",");
            }
        }
        expectOp(")");
        if (peek().isOp("->")) {
            advance();
            expression();
        }
        expectOp(":");
        return new FunctionDef(name, params, decorators, suite(), at);
    }

    private List<Stmt> suite() {
        if (peek().kind() != Token.Kind.NEWLINE) {
            return List.of(simpleStatement());
        }
        advance();
        if (!at(Token.Kind.INDENT)) {
            throw syntaxError("expected an indented block");
        }
        advance();
        var body = new ArrayList<Stmt>();
        while (!at(Token.Kind.DEDENT) && !at(Token.Kind.END)) {
            body.add(statement());
        }
        if (at(Token.Kind.DEDENT)) {
            advance();
        }
        return body;
    }

    private Stmt statement() {
        Token token = peek();
        if (token.kind() == Token.Kind.INDENT) {
            throw new UnsupportedOperation("Invalid syntax: unexpected indent", token.position());
        }
        if (token.kind() == Token.Kind.NAME) {
            switch (token.text()) {
                case "if" -> {
                    advance();
                    return ifRest(token.position());
                }
                case "try" -> {
                    return tryStatement();
                }
                case "def" -> throw new UnsupportedOperation(
                    "Nested function definitions are not supported", token.position());
                default -> {
                    if (UNSUPPORTED_STATEMENTS.contains(token.text())) {
                        throw new UnsupportedOperation(
                            "Unsupported statement '%s'".formatted(token.text()), token.position());
                    }
                }
            }
        }
        if (token.isOp("@")) {
            throw new UnsupportedOperation("Nested function definitions are not supported", token.position());
        }
        return simpleStatement();
    }

    private Stmt.If ifRest(SourcePosition at) {
        Expr test = expression();
        expectOp(":");
        List<Stmt> body = suite();
        List<Stmt> orElse = List.of();
        if (peek().isName("elif")) {
            var elifAt = advance().position();
            orElse = List.of(ifRest(elifAt));
        } else if (peek().isName("else")) {
            advance();
            expectOp(":");
            orElse = suite();
        }
        return new Stmt.If(test, body, orElse, at);
    }

    private Stmt.Try tryStatement() {
        var at = advance().position();
        expectOp(":");
        List<Stmt> body = suite();
        var handlers = new ArrayList<Stmt.ExceptHandler>();
        while (peek().isName("except")) {
            var handlerAt = advance().position();
            Expr type = null;
            String name = null;
            if (!peek().isOp(":")) {
                type = expression();
                if (peek().isName("as")) {
                    advance();
                    name = identifier();
                }
            }
            expectOp(":");
            handlers.add(new Stmt.ExceptHandler(type, name, suite(), handlerAt));
        }
        if (peek().isName("finally") || peek().isName("else")) {
            throw new UnsupportedOperation(
                "'%s' clauses are not supported on try statements".formatted(peek().text()), peek().position());
        }
        if (handlers.isEmpty()) {
            throw syntaxError("expected 'except'");
        }
        return new Stmt.Try(body, handlers, at);
    }

    private Stmt simpleStatement() {
        Token token = peek();
        var at = token.position();
        Stmt stmt;
        if (token.isName("pass")) {
            advance();
            stmt = new Stmt.Pass(at);
        } else if (token.isName("return")) {
            advance();
            stmt = new Stmt.Return(at(Token.Kind.NEWLINE) ? null : expression(), at);
        } else if (token.isName("raise")) {
            advance();
            stmt = new Stmt.Raise(at(Token.Kind.NEWLINE) ? null : expression(), at);
        } else {
            Expr expr = expression();
            if (peek().isOp("=")) {
                advance();
                Expr value = expression();
                if (peek().isOp("=")) {
                    throw new UnsupportedOperation("Chained assignment is not supported", peek().position());
                }
                stmt = new Stmt.Assign(expr, value, at);
            } else if (peek().kind() == Token.Kind.OP && AUGMENTED_OPS.contains(peek().text())) {
                String op = advance().text();
                stmt = new Stmt.AugAssign(expr, op, expression(), at);
            } else {
                stmt = new Stmt.ExprStmt(expr, at);
            }
        }
        if (peek().isOp(";")) {
            throw new UnsupportedOperation("Multiple statements on one line are not supported", peek().position());
        }
        expectNewline();
        return stmt;
    }

    // Expressions, lowest precedence first.

    private Expr expression() {
        return orTest();
    }

    private Expr orTest() {
        Expr first = andTest();
        if (!peek().isName("or")) {
            return first;
        }
        var values = new ArrayList<>(List.of(first));
        while (peek().isName("or")) {
            advance();
            values.add(andTest());
        }
        return new Expr.BoolOp("or", values, first.position());
    }

    private Expr andTest() {
        Expr first = notTest();
        if (!peek().isName("and")) {
            return first;
        }
        var values = new ArrayList<>(List.of(first));
        while (peek().isName("and")) {
            advance();
            values.add(notTest());
        }
        return new Expr.BoolOp("and", values, first.position());
    }

    private Expr notTest() {
        if (peek().isName("not")) {
            var at = advance().position();
            return new Expr.UnaryOp("not", notTest(), at);
        }
        return comparison();
    }

    private Expr comparison() {
        Expr left = arithmetic();
        String op = comparisonOperator();
        if (op == null) {
            return left;
        }
        Expr right = arithmetic();
        if (comparisonOperator() != null) {
            throw new UnsupportedOperation("Chained comparisons are not supported", right.position());
        }
        return new Expr.Compare(left, op, right, left.position());
    }

    /**
     * Consume a comparison operator if one follows and return it, otherwise null.
     */
    private String comparisonOperator() {
        Token token = peek();
        if (token.kind() == Token.Kind.OP && COMPARISON_OPS.contains(token.text())) {
            return advance().text();
        }
        if (token.isName("is")) {
            advance();
            if (peek().isName("not")) {
                advance();
                return "is not";
            }
            return "is";
        }
        if (token.isName("in")) {
            advance();
            return "in";
        }
        if (token.isName("not") && peekAhead(1).isName("in")) {
            advance();
            advance();
            return "not in";
        }
        return null;
    }

    private Expr arithmetic() {
        Expr operand = unary();
        Token token = peek();
        if (token.kind() == Token.Kind.OP && ARITHMETIC_OPS.contains(token.text())) {
            throw new UnsupportedOperation("Arithmetic expressions are not supported", token.position());
        }
        return operand;
    }

    private Expr unary() {
        Token token = peek();
        if (token.isOp("-") || token.isOp("+")) {
            advance();
            return new Expr.UnaryOp(token.text(), unary(), token.position());
        }
        if (token.isOp("~")) {
            throw new UnsupportedOperation("Arithmetic expressions are not supported", token.position());
        }
        return primary();
    }

    private Expr primary() {
        Expr expr = atom();
        while (true) {
            Token token = peek();
            if (token.isOp("(")) {
                advance();
                var args = new ArrayList<Expr>();
                var keywords = new ArrayList<Keyword>();
                arguments(args, keywords);
                expr = new Expr.Call(expr, args, keywords, expr.position());
            } else if (token.isOp("[")) {
                advance();
                Expr index = expression();
                if (peek().isOp(":")) {
                    throw new UnsupportedOperation("Slices are not supported", peek().position());
                }
                expectOp("]");
                expr = new Expr.Subscript(expr, index, expr.position());
            } else if (token.isOp(".")) {
                advance();
                expr = new Expr.Attribute(expr, identifier(), expr.position());
            } else {
                return expr;
            }
        }
    }

    private Expr atom() {
        Token token = advance();
        var at = token.position();
        switch (token.kind()) {
            case NUMBER -> {
                return number(token);
            }
            case STRING -> {
                var sb = new StringBuilder(token.text());
                while (at(Token.Kind.STRING)) {
                    sb.append(advance().text());
                }
                return new Expr.Str(sb.toString(), at);
            }
            case NAME -> {
                switch (token.text()) {
                    case "True" -> {
                        return new Expr.Bool(true, at);
                    }
                    case "False" -> {
                        return new Expr.Bool(false, at);
                    }
                    case "None" -> {
                        return new Expr.NoneLit(at);
                    }
                    default -> {
                        if (KEYWORDS.contains(token.text())) {
                            throw new UnsupportedOperation(
                                "Invalid syntax: unexpected keyword '%s'".formatted(token.text()), at);
                        }
                        return new Expr.Name(token.text(), at);
                    }
                }
            }
            case OP -> {
                switch (token.text()) {
                    case "(" -> {
                        return parenthesized(at);
                    }
                    case "[" -> {
                        return new Expr.ListLit(elements("]"), at);
                    }
                    case "{" -> {
                        return dict(at);
                    }
                    default -> throw new UnsupportedOperation(
                        "Invalid syntax: unexpected '%s'".formatted(token.text()), at);
                }
            }
            default -> throw new UnsupportedOperation("Invalid syntax: unexpected end of line", at);
        }
    }

    private Expr number(Token token) {
        String text = token.text();
        try {
            if (text.contains(".") || text.contains("e") || text.contains("E")) {
                return new Expr.Num(Double.parseDouble(text), token.position());
            }
            if (text.length() > 1 && text.startsWith("0") && !text.chars().allMatch(c -> c == '0')) {
                throw new UnsupportedOperation(
                    "Invalid syntax: leading zeros in integer literals are not permitted", token.position());
            }
            return new Expr.Num(integer(text), token.position());
        } catch (NumberFormatException e) {
            throw new UnsupportedOperation("Invalid numeric literal '%s'".formatted(text), token.position());
        }
    }

    /**
     * Integers that do not fit in a {@code long} keep their exact value.
     */
    private static Number integer(String text) {
        var value = new BigInteger(text);
        return value.bitLength() < Long.SIZE ? (Number) value.longValue() : value;
    }

    private Expr parenthesized(SourcePosition at) {
        if (peek().isOp(")")) {
            advance();
            return new Expr.TupleLit(List.of(), at);
        }
        Expr first = expression();
        if (peek().isOp(")")) {
            advance();
            return first;
        }
        expectOp(",");
        var elements = new ArrayList<>(List.of(first));
        elements.addAll(elements(")"));
        return new Expr.TupleLit(elements, at);
    }

    private List<Expr> elements(String close) {
        var elements = new ArrayList<Expr>();
        while (!peek().isOp(close)) {
            if (peek().isOp("*")) {
                throw new UnsupportedOperation("Unpacking is not supported", peek().position());
            }
            elements.add(expression());
            if (!peek().isOp(close)) {
                expectOp(",");
            }
        }
        expectOp(close);
        return elements;
    }

    private Expr dict(SourcePosition at) {
        var keys = new ArrayList<Expr>();
        var values = new ArrayList<Expr>();
        while (!peek().isOp("}")) {
            if (peek().isOp("**")) {
                throw new UnsupportedOperation("Unpacking is not supported", peek().position());
            }
            Expr key = expression();
            if (!peek().isOp(":")) {
                throw new UnsupportedOperation("Set literals are not supported", key.position());
            }
            advance();
            keys.add(key);
            values.add(expression());
            if (!peek().isOp("}")) {
                expectOp(",");
            }
        }
        expectOp("}");
        return new Expr.DictLit(keys, values, at);
    }

    /**
     * Parse call arguments up to and including the closing parenthesis.
     */
    private void arguments(List<Expr> args, List<Keyword> keywords) {
        while (!peek().isOp(")")) {
            Token token = peek();
            if (token.isOp("*") || token.isOp("**")) {
                throw new UnsupportedOperation("Unpacking is not supported", token.position());
            }
            if (token.kind() == Token.Kind.NAME && peekAhead(1).isOp("=")) {
                advance();
                advance();
                keywords.add(new Keyword(token.text(), expression(), token.position()));
            } else {
                Expr arg = expression();
                if (!keywords.isEmpty()) {
                    throw new UnsupportedOperation("Positional argument follows keyword argument", arg.position());
                }
                args.add(arg);
            }
            if (!peek().isOp(")")) {
                expectOp(",");
            }
        }
        expectOp(")");
    }

    // Token helpers

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private boolean at(Token.Kind kind) {
        return peek().kind() == kind;
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (token.kind() != Token.Kind.END) {
            index++;
        }
        return token;
    }

    private String identifier() {
        Token token = peek();
        if (token.kind() != Token.Kind.NAME || KEYWORDS.contains(token.text())) {
            throw syntaxError("expected a name");
        }
        return advance().text();
    }

    private void expectOp(String op) {
        if (!peek().isOp(op)) {
            throw syntaxError("expected '" + op + "'");
        }
        advance();
    }

    private void expectNewline() {
        if (!at(Token.Kind.NEWLINE) && !at(Token.Kind.END)) {
            throw syntaxError("expected end of line");
        }
        advance();
    }

    private UnsupportedOperation syntaxError(String detail) {
        return new UnsupportedOperation("Invalid syntax: " + detail, peek().position());
    }
}
