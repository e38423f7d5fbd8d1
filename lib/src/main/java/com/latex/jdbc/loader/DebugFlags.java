package com.latex.jdbc.loader;

import com.latex.jdbc.loader.lexer.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class DebugFlags {
    private static final String TOKENS_PROPERTY = "latex.jdbc.debugTokens";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String TOKENS_ENV = "LATEX_JDBC_DEBUG_TOKENS";
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS =
            ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        String value = System.getProperty(TOKENS_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(TOKENS_ENV));
    }

    public static void logTokens(String sourceName, List<Token> tokens) {
        System.err.printf(Locale.ROOT, "[LaTeX JDBC] Token dump for %s:%n", sourceName);
        for (Token token : tokens) {
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-18s @ %4d:%-3d -> %s",
                            token.getKind(),
                            token.getLine(),
                            token.getColumn(),
                            printable(token.getText()));
            System.err.printf(Locale.ROOT, "  %s%n", line);
            CAPTURED_TOKENS.get().add(line);
        }
    }

    public static List<String> drainCapturedTokens() {
        List<String> captured = new ArrayList<>(CAPTURED_TOKENS.get());
        CAPTURED_TOKENS.get().clear();
        return captured;
    }

    private static String printable(String text) {
        return text.replace("\n", "\\n").replace("\t", "\\t");
    }
}
