package com.latex.jdbc.citation;

import com.latex.jdbc.loader.LoaderMessage;
import com.latex.jdbc.loader.LoaderMessage.Category;
import com.latex.jdbc.loader.ast.SourceLocation;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds citation commands directly in the source text. Citation commands take up to two
 * optional arguments, which the generic command parser does not model, so they get their own
 * scan. A lone optional argument is the postnote; with two, the first is the prenote.
 */
public final class CitationExtractor {

    private static final Pattern CITATION =
            Pattern.compile(
                    "\\\\(footfullcite|fullcite|footcite|parencite|textcite|autocite|citeauthor|citeyear"
                            + "|citealp|citealt|citep|citet|cite)(?![A-Za-z])(\\*?)"
                            + "\\s*(?:\\[([^\\]]*)\\])?\\s*(?:\\[([^\\]]*)\\])?\\s*\\{([^}]*)\\}",
                    Pattern.CASE_INSENSITIVE);

    private final String sourceName;

    public CitationExtractor() {
        this("");
    }

    public CitationExtractor(String sourceName) {
        this.sourceName = sourceName == null ? "" : sourceName;
    }

    public List<Citation> extract(String source) {
        return extractWithMessages(source).getCitations();
    }

    public CitationExtraction extractWithMessages(String source) {
        List<Citation> citations = new ArrayList<>();
        List<LoaderMessage> messages = new ArrayList<>();
        LineIndex lines = new LineIndex(source);
        Matcher matcher = CITATION.matcher(source);
        while (matcher.find()) {
            int start = matcher.start();
            if (isEscaped(source, start) || lines.isInComment(start)) {
                continue;
            }
            SourceLocation location = lines.locationOf(sourceName, start);
            List<String> keys = splitKeys(matcher.group(5));
            if (keys.isEmpty()) {
                messages.add(
                        LoaderMessage.warning(
                                Category.CITATION,
                                "Citation without keys: " + matcher.group(),
                                sourceName,
                                location.getLine(),
                                location.getColumn()));
                continue;
            }
            String first = matcher.group(3);
            String second = matcher.group(4);
            String prenote = "";
            String postnote = "";
            if (first != null && second != null) {
                prenote = first.trim();
                postnote = second.trim();
            } else if (first != null) {
                postnote = first.trim();
            }
            citations.add(
                    new Citation(
                            keys,
                            CitationType.fromCommandName(matcher.group(1)),
                            prenote,
                            postnote,
                            !matcher.group(2).isEmpty(),
                            location,
                            matcher.group()));
        }
        return new CitationExtraction(citations, messages);
    }

    private static List<String> splitKeys(String keyList) {
        List<String> keys = new ArrayList<>();
        for (String part : keyList.split(",")) {
            String key = part.trim();
            if (!key.isEmpty()) {
                keys.add(key);
            }
        }
        return keys;
    }

    private static boolean isEscaped(String text, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    /** Line starts of a source, for offset to line/column conversion and comment detection. */
    private static final class LineIndex {
        private final String source;
        private final List<Integer> starts = new ArrayList<>();

        private LineIndex(String source) {
            this.source = source;
            starts.add(0);
            for (int i = 0; i < source.length(); i++) {
                if (source.charAt(i) == '\n') {
                    starts.add(i + 1);
                }
            }
        }

        private int lineIndexOf(int offset) {
            int low = 0;
            int high = starts.size() - 1;
            while (low < high) {
                int mid = (low + high + 1) >>> 1;
                if (starts.get(mid) <= offset) {
                    low = mid;
                } else {
                    high = mid - 1;
                }
            }
            return low;
        }

        private SourceLocation locationOf(String sourceName, int offset) {
            int line = lineIndexOf(offset);
            return new SourceLocation(sourceName, line + 1, offset - starts.get(line) + 1, offset);
        }

        private boolean isInComment(int offset) {
            for (int i = starts.get(lineIndexOf(offset)); i < offset; i++) {
                if (source.charAt(i) == '%' && !isEscaped(source, i)) {
                    return true;
                }
            }
            return false;
        }
    }
}
