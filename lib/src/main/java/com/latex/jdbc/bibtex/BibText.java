package com.latex.jdbc.bibtex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Text helpers shared by the BibTeX parser and the name parser. */
final class BibText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern FORMATTING =
            Pattern.compile("\\\\(?:textbf|textit|textsc|texttt|textrm|emph|url|mathrm)\\s*\\{([^{}]*)\\}");
    private static final Pattern HREF = Pattern.compile("\\\\href\\s*\\{[^{}]*\\}\\s*\\{([^{}]*)\\}");
    private static final Pattern OTHER_COMMAND =
            Pattern.compile("\\\\[A-Za-z]+(?:\\[[^\\]]*\\])?(?:\\{[^{}]*\\})*");

    private BibText() {}

    static String normalizeWhitespace(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    /**
     * Reduces a prose field to plain text: formatting commands keep their argument, any other
     * command is removed, grouping braces are dropped.
     */
    static String clean(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String text = HREF.matcher(value).replaceAll("$1");
        String previous;
        do {
            previous = text;
            text = FORMATTING.matcher(text).replaceAll("$1");
        } while (!text.equals(previous));
        text = OTHER_COMMAND.matcher(text).replaceAll("");
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c == '{' || c == '}') && (i == 0 || text.charAt(i - 1) != '\\')) {
                continue;
            }
            out.append(c);
        }
        return normalizeWhitespace(out.toString());
    }

    /** Splits on {@code separator} characters that sit outside braces. */
    static List<String> splitTopLevel(String value, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == separator && depth == 0) {
                parts.add(value.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(value.substring(start).trim());
        return parts;
    }

    /** Splits on whitespace outside braces, so {@code {van Gogh} Vincent} has two words. */
    static List<String> words(String value) {
        List<String> words = new ArrayList<>();
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            }
            if (Character.isWhitespace(c) && depth == 0) {
                if (current.length() > 0) {
                    words.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            words.add(current.toString());
        }
        return words;
    }

    /**
     * Splits a name list on the word {@code and} (any case) outside braces, so
     * {@code {Barnes and Noble}} stays one name.
     */
    static List<String> splitNames(String value) {
        List<String> names = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String word : words(value)) {
            if ("and".equalsIgnoreCase(word)) {
                if (!current.isEmpty()) {
                    names.add(String.join(" ", current));
                    current.clear();
                }
            } else {
                current.add(word);
            }
        }
        if (!current.isEmpty()) {
            names.add(String.join(" ", current));
        }
        return names;
    }
}
