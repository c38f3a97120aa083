package dev.sfn.syntax;

import dev.sfn.exceptions.UnsupportedOperation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Splits source text into tokens, emitting INDENT/DEDENT the way Python does.
 * Newlines inside brackets and after a backslash continuation are not significant.
 */
final class Tokenizer {

    private static final Set<String> TWO_CHAR_OPS = Set.of(
        "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%=", "|=", "&=", "->", "**", "//");
    private static final String ONE_CHAR_OPS = "()[]{},:.=<>+-*/%@|&^~;";
    private static final int TAB_SIZE = 8;

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int pos;
    private int line = 1;
    private int lineStart;
    private int depth;

    private Tokenizer(String source) {
        this.source = source.replace("\r\n", "\n").replace('\r', '\n');
        this.indents.push(0);
    }

    static List<Token> tokenize(String source) {
        var tokenizer = new Tokenizer(source);
        tokenizer.run();
        return tokenizer.tokens;
    }

    private void run() {
        boolean atLineStart = true;
        while (pos < source.length()) {
            if (atLineStart && depth == 0) {
                if (!readIndentation()) {
                    continue;
                }
                atLineStart = false;
                if (pos >= source.length()) {
                    break;
                }
            }

            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\n') {
                if (depth == 0) {
                    emit(Token.Kind.NEWLINE, "\n", position());
                    atLineStart = true;
                }
                newLine(pos + 1);
            } else if (c == '\\' && peek(1) == '\n') {
                newLine(pos + 2);
            } else if (Character.isLetter(c) || c == '_') {
                readName();
            } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
                readNumber();
            } else if (c == '"' || c == '\'') {
                readString(c);
            } else {
                readOperator();
            }
        }

        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).kind() != Token.Kind.NEWLINE
                && tokens.get(tokens.size() - 1).kind() != Token.Kind.DEDENT) {
            emit(Token.Kind.NEWLINE, "\n", position());
        }
        if (depth > 0) {
            throw new UnsupportedOperation("Invalid syntax: unclosed bracket", position());
        }
        while (indents.peek() > 0) {
            indents.pop();
            emit(Token.Kind.DEDENT, "", position());
        }
        emit(Token.Kind.END, "", position());
    }

    /**
     * Measure the indentation of the current line. Returns false when the line is blank
     * or holds only a comment, in which case it has been consumed.
     */
    private boolean readIndentation() {
        int column = 0;
        int p = pos;
        while (p < source.length()) {
            char c = source.charAt(p);
            if (c == ' ') {
                column++;
            } else if (c == '\t') {
                column = (column / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c != '\f') {
                break;
            }
            p++;
        }
        pos = p;
        if (p >= source.length()) {
            return true;
        }
        char c = source.charAt(p);
        if (c == '#' || c == '\n') {
            skipComment();
            if (pos < source.length()) {
                newLine(pos + 1);
            }
            return false;
        }

        var at = position();
        if (column > indents.peek()) {
            indents.push(column);
            emit(Token.Kind.INDENT, "", at);
        } else {
            while (column < indents.peek()) {
                indents.pop();
                emit(Token.Kind.DEDENT, "", at);
            }
            if (column != indents.peek()) {
                throw new UnsupportedOperation(
                    "Invalid syntax: unindent does not match any outer indentation level", at);
            }
        }
        return true;
    }

    private void readName() {
        var at = position();
        int start = pos;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        if (pos < source.length() && (source.charAt(pos) == '"' || source.charAt(pos) == '\'')) {
            throw new UnsupportedOperation("String prefixes are not supported", at);
        }
        emit(Token.Kind.NAME, source.substring(start, pos), at);
    }

    private void readNumber() {
        var at = position();
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isDigit(c) || c == '_' || c == '.') {
                pos++;
            } else if ((c == 'e' || c == 'E')) {
                pos++;
                if (peek(0) == '+' || peek(0) == '-') {
                    pos++;
                }
            } else {
                break;
            }
        }
        if (pos < source.length() && Character.isLetter(source.charAt(pos))) {
            throw new UnsupportedOperation("Invalid syntax: malformed number", at);
        }
        emit(Token.Kind.NUMBER, source.substring(start, pos).replace("_", ""), at);
    }

    private void readString(char quote) {
        var at = position();
        boolean triple = peek(1) == quote && peek(2) == quote;
        pos += triple ? 3 : 1;

        var sb = new StringBuilder();
        while (true) {
            if (pos >= source.length()) {
                throw new UnsupportedOperation("Invalid syntax: unterminated string literal", at);
            }
            char c = source.charAt(pos);
            if (c == quote && (!triple || (peek(1) == quote && peek(2) == quote))) {
                pos += triple ? 3 : 1;
                break;
            }
            if (c == '\n') {
                if (!triple) {
                    throw new UnsupportedOperation("Invalid syntax: unterminated string literal", at);
                }
                sb.append('\n');
                newLine(pos + 1);
                continue;
            }
            if (c == '\\') {
                readEscape(sb, at);
                continue;
            }
            sb.append(c);
            pos++;
        }
        emit(Token.Kind.STRING, sb.toString(), at);
    }

    private void readEscape(StringBuilder sb, SourcePosition at) {
        char next = peek(1);
        pos += 2;
        switch (next) {
            case '\n' -> newLine(pos);
            case 'n' -> sb.append('\n');
            case 't' -> sb.append('\t');
            case 'r' -> sb.append('\r');
            case 'b' -> sb.append('\b');
            case 'f' -> sb.append('\f');
            case 'a' -> sb.append('\u0007');
            case 'v' -> sb.append('\u000b');
            case '\\', '\'', '"' -> sb.append(next);
            case '0', '1', '2', '3', '4', '5', '6', '7' -> sb.append((char) readOctal(next));
            case 'x' -> sb.append((char) readHex(2, at));
            case 'u' -> sb.append((char) readHex(4, at));
            case 'U' -> {
                int codePoint = readHex(8, at);
                if (!Character.isValidCodePoint(codePoint)) {
                    throw new UnsupportedOperation("Invalid syntax: illegal Unicode character in escape", at);
                }
                sb.appendCodePoint(codePoint);
            }
            case 'N' -> throw new UnsupportedOperation("Named Unicode escapes (\\N{...}) are not supported", at);
            default -> sb.append('\\').append(next);
        }
    }

    /**
     * Up to three octal digits, the first of which has already been consumed.
     */
    private int readOctal(char first) {
        int value = first - '0';
        for (int i = 0; i < 2 && peek(0) >= '0' && peek(0) <= '7'; i++) {
            value = value * 8 + (source.charAt(pos) - '0');
            pos++;
        }
        return value;
    }

    private int readHex(int digits, SourcePosition at) {
        if (pos + digits > source.length()) {
            throw new UnsupportedOperation("Invalid syntax: truncated escape sequence", at);
        }
        String hex = source.substring(pos, pos + digits);
        if (!hex.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            throw new UnsupportedOperation("Invalid syntax: malformed escape sequence", at);
        }
        pos += digits;
        return (int) Long.parseLong(hex, 16);
    }

    private void readOperator() {
        var at = position();
        if (pos + 1 < source.length() && TWO_CHAR_OPS.contains(source.substring(pos, pos + 2))) {
            emit(Token.Kind.OP, source.substring(pos, pos + 2), at);
            pos += 2;
            return;
        }
        char c = source.charAt(pos);
        if (ONE_CHAR_OPS.indexOf(c) < 0) {
            throw new UnsupportedOperation("Invalid syntax: unexpected character '" + c + "'", at);
        }
        if (c == '(' || c == '[' || c == '{') {
            depth++;
        } else if (c == ')' || c == ']' || c == '}') {
            if (depth == 0) {
                throw new UnsupportedOperation("Invalid syntax: unmatched '" + c + "'", at);
            }
            depth--;
        }
        emit(Token.Kind.OP, String.valueOf(c), at);
        pos++;
    }

    private void skipComment() {
        while (pos < source.length() && source.charAt(pos) != '\n') {
            pos++;
        }
    }

    private void newLine(int next) {
        pos = next;
        line++;
        lineStart = next;
    }

    private char peek(int offset) {
        int p = pos + offset;
        return p < source.length() ? source.charAt(p) : '\0';
    }

    private SourcePosition position() {
        return new SourcePosition(line, pos - lineStart);
    }

    private void emit(Token.Kind kind, String text, SourcePosition at) {
        tokens.add(new Token(kind, text, at));
    }
}
