package com.latex.jdbc.loader.lexer;

import java.util.Objects;

/**
 * Immutable lexical token. {@code offset} is the UTF-16 index of the first character in the
 * source string; {@code line} and {@code column} are 1-based, and the column counts code points.
 */
public final class Token {
    private final TokenKind kind;
    private final String text;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenKind kind, String text, int line, int column, int offset) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    /** Offset one past the last character of this token. */
    public int getEndOffset() {
        return offset + text.length();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Token)) {
            return false;
        }
        Token other = (Token) obj;
        return kind == other.kind
                && line == other.line
                && column == other.column
                && offset == other.offset
                && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, line, column, offset);
    }

    @Override
    public String toString() {
        return kind + "@" + line + ":" + column + " " + text;
    }
}
