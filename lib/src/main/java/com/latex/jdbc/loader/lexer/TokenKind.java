package com.latex.jdbc.loader.lexer;

/** Closed set of lexical categories produced by {@link LatexTokenizer}. */
public enum TokenKind {
    COMMAND,
    ENVIRONMENT_BEGIN,
    ENVIRONMENT_END,
    TEXT,
    MATH_INLINE,
    MATH_DISPLAY,
    COMMENT,
    WHITESPACE,
    NEWLINE,
    BRACE_OPEN,
    BRACE_CLOSE,
    BRACKET_OPEN,
    BRACKET_CLOSE,
    ESCAPED_CHAR;

    /** True for the three kinds that start a command invocation. */
    public boolean isCommandLike() {
        return this == COMMAND || this == ENVIRONMENT_BEGIN || this == ENVIRONMENT_END;
    }

    public boolean isBlank() {
        return this == WHITESPACE || this == NEWLINE;
    }
}
