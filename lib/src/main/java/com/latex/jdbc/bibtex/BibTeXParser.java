package com.latex.jdbc.bibtex;

import com.latex.jdbc.loader.DuplicateKeyPolicy;
import com.latex.jdbc.loader.LoaderMessage;
import com.latex.jdbc.loader.LoaderMessage.Category;
import com.latex.jdbc.loader.ast.SourceLocation;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Brace- and quote-aware scanner for BibTeX text. A malformed entry is reported and skipped; the
 * rest of the file is still read.
 *
 * <p>Supported beyond plain {@code @type{key, name = value}} entries: parenthesised entries,
 * {@code @string} abbreviations (the twelve month macros are predefined), {@code #}
 * concatenation, and skipping of {@code @comment} and {@code @preamble}.
 */
public final class BibTeXParser {
    private static final Logger LOGGER = Logger.getLogger(BibTeXParser.class.getName());

    private static final Map<String, String> MONTHS =
            Map.ofEntries(
                    Map.entry("jan", "January"),
                    Map.entry("feb", "February"),
                    Map.entry("mar", "March"),
                    Map.entry("apr", "April"),
                    Map.entry("may", "May"),
                    Map.entry("jun", "June"),
                    Map.entry("jul", "July"),
                    Map.entry("aug", "August"),
                    Map.entry("sep", "September"),
                    Map.entry("oct", "October"),
                    Map.entry("nov", "November"),
                    Map.entry("dec", "December"));

    private final DuplicateKeyPolicy duplicateKeyPolicy;

    public BibTeXParser() {
        this(DuplicateKeyPolicy.KEEP_LAST);
    }

    public BibTeXParser(DuplicateKeyPolicy duplicateKeyPolicy) {
        this.duplicateKeyPolicy = Objects.requireNonNull(duplicateKeyPolicy, "duplicateKeyPolicy");
    }

    public BibliographyParseResult parse(String text) {
        return parse("", text);
    }

    public BibliographyParseResult parse(String sourceName, String text) {
        Objects.requireNonNull(text, "text");
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put(sourceName == null ? "" : sourceName, text);
        return parseAll(sources);
    }

    /**
     * Parses several bibliography files, in iteration order, into one key space. Abbreviations
     * defined in an earlier file are visible in later ones, and duplicate keys across files follow
     * the configured policy.
     */
    public BibliographyParseResult parseAll(Map<String, String> sources) {
        Objects.requireNonNull(sources, "sources");
        Accumulator accumulator = new Accumulator();
        for (Map.Entry<String, String> source : sources.entrySet()) {
            new Run(source.getKey(), Objects.requireNonNull(source.getValue(), "text"), accumulator).scan();
        }
        BibliographyParseResult result = new BibliographyParseResult(accumulator.entries, accumulator.messages);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(
                    String.format(
                            Locale.ROOT,
                            "Parsed %d BibTeX entries from %d source(s) with %d diagnostics",
                            result.getEntries().size(),
                            sources.size(),
                            result.getMessages().size()));
        }
        return result;
    }

    /** State shared by the files of one parse. */
    private static final class Accumulator {
        private final Map<String, String> strings = new HashMap<>(MONTHS);
        private final Map<String, BibEntry> entries = new LinkedHashMap<>();
        private final Set<String> rejected = new HashSet<>();
        private final List<LoaderMessage> messages = new ArrayList<>();
    }

    /** Scan state of one file; never shared. */
    private final class Run {
        private final String sourceName;
        private final String text;
        private final List<Integer> lineStarts = new ArrayList<>();
        private final Map<String, String> strings;
        private final Map<String, BibEntry> entries;
        private final Set<String> rejected;
        private final List<LoaderMessage> messages;

        private Run(String sourceName, String text, Accumulator accumulator) {
            this.sourceName = sourceName == null ? "" : sourceName;
            this.text = text;
            this.strings = accumulator.strings;
            this.entries = accumulator.entries;
            this.rejected = accumulator.rejected;
            this.messages = accumulator.messages;
            lineStarts.add(0);
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    lineStarts.add(i + 1);
                }
            }
        }

        private void scan() {
            int n = text.length();
            int i = 0;
            while (i < n) {
                int at = text.indexOf('@', i);
                if (at < 0) {
                    break;
                }
                int typeStart = skipWhitespace(text, at + 1);
                int typeEnd = typeStart;
                while (typeEnd < n && isIdentifierChar(text.charAt(typeEnd))) {
                    typeEnd++;
                }
                if (typeEnd == typeStart) {
                    i = at + 1;
                    continue;
                }
                String type = text.substring(typeStart, typeEnd).toLowerCase(Locale.ROOT);
                int open = skipWhitespace(text, typeEnd);
                if (open >= n) {
                    break;
                }
                char opener = text.charAt(open);
                if (opener != '{' && opener != '(') {
                    i = open;
                    continue;
                }
                int close = findEntryClose(open, opener);
                if (close < 0) {
                    messages.add(error("Unclosed entry @" + type + "; skipped to the next @", at));
                    i = at + 1;
                    continue;
                }
                handleEntry(type, text.substring(open + 1, close), at, close);
                i = close + 1;
            }
        }

        private int findEntryClose(int open, char opener) {
            int braces = opener == '{' ? 1 : 0;
            boolean inQuotes = false;
            for (int p = open + 1; p < text.length(); p++) {
                char c = text.charAt(p);
                if (c == '\\') {
                    p++;
                } else if (c == '{') {
                    braces++;
                } else if (c == '}') {
                    braces--;
                    if (opener == '{' && braces == 0) {
                        return p;
                    }
                    braces = Math.max(0, braces);
                } else if (opener == '(' && braces == 0) {
                    if (c == '"') {
                        inQuotes = !inQuotes;
                    } else if (c == ')' && !inQuotes) {
                        return p;
                    }
                }
            }
            return -1;
        }

        private void handleEntry(String type, String body, int at, int close) {
            switch (type) {
                case "comment", "preamble" -> {
                    return;
                }
                case "string" -> {
                    for (Map.Entry<String, String> definition : parseFields(body, 0, "@string", at).entrySet()) {
                        strings.put(definition.getKey(), definition.getValue());
                    }
                    return;
                }
                default -> {
                    // a reference entry
                }
            }
            int comma = indexOfTopLevel(body, 0, ',');
            String key = (comma < 0 ? body : body.substring(0, comma)).trim();
            if (key.isEmpty() || key.indexOf('=') >= 0) {
                messages.add(error("Entry @" + type + " has no key; skipped", at));
                return;
            }
            Map<String, String> fields = comma < 0 ? Map.of() : parseFields(body, comma + 1, key, at);
            Optional<BibEntryType> known = BibEntryType.fromName(type);
            if (known.isEmpty()) {
                messages.add(warning("Unknown entry type @" + type + " for '" + key + "'; treated as misc", at));
            }
            BibEntry entry =
                    new BibEntry(
                            key,
                            known.orElse(BibEntryType.MISC),
                            type,
                            fields,
                            locationOf(at),
                            text.substring(at, close + 1));
            store(entry, at);
        }

        private void store(BibEntry entry, int at) {
            String key = entry.getKey();
            if (rejected.contains(key)) {
                messages.add(error("Duplicate key '" + key + "'; all definitions dropped", at));
                return;
            }
            if (!entries.containsKey(key)) {
                entries.put(key, entry);
                return;
            }
            switch (duplicateKeyPolicy) {
                case KEEP_LAST -> {
                    messages.add(warning("Duplicate key '" + key + "'; keeping the later definition", at));
                    entries.remove(key);
                    entries.put(key, entry);
                }
                case KEEP_FIRST -> messages.add(
                        warning("Duplicate key '" + key + "'; keeping the first definition", at));
                case REJECT -> {
                    messages.add(error("Duplicate key '" + key + "'; all definitions dropped", at));
                    entries.remove(key);
                    rejected.add(key);
                }
            }
        }

        /** Reads {@code name = value} pairs from {@code body} starting at {@code from}. */
        private Map<String, String> parseFields(String body, int from, String owner, int at) {
            Map<String, String> fields = new LinkedHashMap<>();
            int n = body.length();
            int p = from;
            while (true) {
                while (p < n && (Character.isWhitespace(body.charAt(p)) || body.charAt(p) == ',')) {
                    p++;
                }
                if (p >= n) {
                    break;
                }
                int nameStart = p;
                while (p < n && isIdentifierChar(body.charAt(p))) {
                    p++;
                }
                if (p == nameStart) {
                    messages.add(warning("Unexpected '" + body.charAt(p) + "' in fields of '" + owner + "'", at));
                    p = nextSeparator(body, p);
                    continue;
                }
                String name = body.substring(nameStart, p).toLowerCase(Locale.ROOT);
                p = skipWhitespace(body, p);
                if (p >= n || body.charAt(p) != '=') {
                    messages.add(warning("Field '" + name + "' of '" + owner + "' has no value", at));
                    p = nextSeparator(body, p);
                    continue;
                }
                p = skipWhitespace(body, p + 1);
                StringBuilder value = new StringBuilder();
                boolean complete = true;
                while (true) {
                    if (p >= n) {
                        complete = value.length() > 0;
                        break;
                    }
                    char c = body.charAt(p);
                    if (c == '{') {
                        int end = matchBrace(body, p);
                        if (end < 0) {
                            complete = false;
                            p = n;
                            break;
                        }
                        value.append(body, p + 1, end);
                        p = end + 1;
                    } else if (c == '"') {
                        int end = matchQuote(body, p);
                        if (end < 0) {
                            complete = false;
                            p = n;
                            break;
                        }
                        value.append(body, p + 1, end);
                        p = end + 1;
                    } else {
                        int start = p;
                        while (p < n && isBareChar(body.charAt(p))) {
                            p++;
                        }
                        if (p == start) {
                            complete = false;
                            break;
                        }
                        value.append(expand(body.substring(start, p), owner, at));
                    }
                    p = skipWhitespace(body, p);
                    if (p < n && body.charAt(p) == '#') {
                        p = skipWhitespace(body, p + 1);
                        continue;
                    }
                    break;
                }
                if (complete) {
                    fields.put(name, BibText.normalizeWhitespace(value.toString()));
                } else {
                    messages.add(warning("Malformed value for field '" + name + "' of '" + owner + "'", at));
                }
                p = nextSeparator(body, p);
            }
            return fields;
        }

        private String expand(String token, String owner, int at) {
            if (token.chars().allMatch(Character::isDigit)) {
                return token;
            }
            String expansion = strings.get(token.toLowerCase(Locale.ROOT));
            if (expansion == null) {
                messages.add(warning("Undefined abbreviation '" + token + "' in '" + owner + "'", at));
                return token;
            }
            return expansion;
        }

        private SourceLocation locationOf(int offset) {
            int low = 0;
            int high = lineStarts.size() - 1;
            while (low < high) {
                int mid = (low + high + 1) >>> 1;
                if (lineStarts.get(mid) <= offset) {
                    low = mid;
                } else {
                    high = mid - 1;
                }
            }
            return new SourceLocation(sourceName, low + 1, offset - lineStarts.get(low) + 1, offset);
        }

        private LoaderMessage warning(String message, int offset) {
            SourceLocation location = locationOf(offset);
            return LoaderMessage.warning(
                    Category.BIB_ENTRY, message, sourceName, location.getLine(), location.getColumn());
        }

        private LoaderMessage error(String message, int offset) {
            SourceLocation location = locationOf(offset);
            return LoaderMessage.error(
                    Category.BIB_ENTRY, message, sourceName, location.getLine(), location.getColumn());
        }
    }

    private static int matchBrace(String body, int open) {
        int depth = 0;
        for (int p = open; p < body.length(); p++) {
            char c = body.charAt(p);
            if (c == '\\') {
                p++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return p;
                }
            }
        }
        return -1;
    }

    /** Closing quote of a quoted value; quotes inside braces do not count. */
    private static int matchQuote(String body, int open) {
        int depth = 0;
        for (int p = open + 1; p < body.length(); p++) {
            char c = body.charAt(p);
            if (c == '\\') {
                p++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == '"' && depth == 0) {
                return p;
            }
        }
        return -1;
    }

    /** Index of the next comma outside braces and quotes at or after {@code from}, or the length. */
    private static int nextSeparator(String body, int from) {
        int index = indexOfTopLevel(body, from, ',');
        return index < 0 ? body.length() : index;
    }

    private static int indexOfTopLevel(String body, int from, char target) {
        int depth = 0;
        boolean inQuotes = false;
        for (int p = from; p < body.length(); p++) {
            char c = body.charAt(p);
            if (c == '\\') {
                p++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == '"' && depth == 0) {
                inQuotes = !inQuotes;
            } else if (c == target && depth == 0 && !inQuotes) {
                return p;
            }
        }
        return -1;
    }

    private static int skipWhitespace(String text, int from) {
        int p = from;
        while (p < text.length() && Character.isWhitespace(text.charAt(p))) {
            p++;
        }
        return p;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == ':' || c == '.' || c == '+';
    }

    private static boolean isBareChar(char c) {
        return !Character.isWhitespace(c) && c != ',' && c != '#' && c != '{' && c != '}' && c != '"';
    }
}
