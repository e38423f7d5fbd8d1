package com.latex.jdbc.loader.lexer;

import com.latex.jdbc.loader.grammar.LatexLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;

/**
 * Turns LaTeX source into a flat token list using the generated {@link LatexLexer}. The scan is
 * total: every character of the input ends up in exactly one token, so concatenating the token
 * texts in order reproduces the source.
 */
public final class LatexTokenizer {

    public List<Token> tokenize(String input) {
        Objects.requireNonNull(input, "input");
        LatexLexer lexer = new LatexLexer(CharStreams.fromString(input));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream stream = new CommonTokenStream(lexer);
        stream.fill();

        List<Token> tokens = new ArrayList<>();
        // ANTLR indexes code points; offsets here are UTF-16 indexes into the input string.
        int offset = 0;
        for (org.antlr.v4.runtime.Token token : stream.getTokens()) {
            if (token.getType() == org.antlr.v4.runtime.Token.EOF) {
                break;
            }
            String text = token.getText();
            tokens.add(
                    new Token(
                            kindOf(token.getType()),
                            text,
                            token.getLine(),
                            token.getCharPositionInLine() + 1,
                            offset));
            offset += text.length();
        }
        return List.copyOf(tokens);
    }

    static TokenKind kindOf(int type) {
        return switch (type) {
            case LatexLexer.COMMENT -> TokenKind.COMMENT;
            case LatexLexer.BEGIN_ENV -> TokenKind.ENVIRONMENT_BEGIN;
            case LatexLexer.END_ENV -> TokenKind.ENVIRONMENT_END;
            case LatexLexer.CONTROL_WORD, LatexLexer.CONTROL_SYMBOL -> TokenKind.COMMAND;
            case LatexLexer.ESCAPED_CHAR -> TokenKind.ESCAPED_CHAR;
            case LatexLexer.MATH_DISPLAY -> TokenKind.MATH_DISPLAY;
            case LatexLexer.MATH_INLINE -> TokenKind.MATH_INLINE;
            case LatexLexer.BRACE_OPEN -> TokenKind.BRACE_OPEN;
            case LatexLexer.BRACE_CLOSE -> TokenKind.BRACE_CLOSE;
            case LatexLexer.BRACKET_OPEN -> TokenKind.BRACKET_OPEN;
            case LatexLexer.BRACKET_CLOSE -> TokenKind.BRACKET_CLOSE;
            case LatexLexer.NEWLINE -> TokenKind.NEWLINE;
            case LatexLexer.WHITESPACE -> TokenKind.WHITESPACE;
            // A lone trailing backslash has nothing to escape.
            case LatexLexer.LONE_BACKSLASH, LatexLexer.TEXT -> TokenKind.TEXT;
            default -> throw new IllegalStateException("Unexpected lexer token type " + type);
        };
    }
}
