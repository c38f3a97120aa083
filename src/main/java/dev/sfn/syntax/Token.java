package dev.sfn.syntax;

/**
 * Lexical token. For strings {@code text} is the decoded value.
 */
record Token(Kind kind, String text, SourcePosition position) {

    enum Kind { NAME, NUMBER, STRING, OP, NEWLINE, INDENT, DEDENT, END }

    boolean is(Kind expected, String value) {
        return kind == expected && text.equals(value);
    }

    boolean isOp(String value) {
        return is(Kind.OP, value);
    }

    boolean isName(String value) {
        return is(Kind.NAME, value);
    }
}
