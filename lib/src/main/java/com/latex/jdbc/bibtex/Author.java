package com.latex.jdbc.bibtex;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * A parsed person name. The split into parts is best effort: it understands
 * {@code Last, First Middle}, {@code Last, Suffix, First}, {@code First Middle Last}, lowercase
 * particles such as {@code van der} and trailing suffixes such as {@code Jr.}. Callers that need
 * the name exactly as written use {@link #getRaw()}.
 */
public final class Author {

    private static final Set<String> SUFFIXES = Set.of("jr", "jr.", "sr", "sr.", "ii", "iii", "iv");

    private final String first;
    private final String middle;
    private final String last;
    private final String vonParticle;
    private final String suffix;
    private final String fullName;
    private final String raw;

    public Author(String first, String middle, String last, String vonParticle, String suffix, String raw) {
        this.first = nullToEmpty(first);
        this.middle = nullToEmpty(middle);
        this.last = nullToEmpty(last);
        this.vonParticle = nullToEmpty(vonParticle);
        this.suffix = nullToEmpty(suffix);
        this.raw = nullToEmpty(raw);
        List<String> parts = new ArrayList<>();
        for (String part : List.of(this.first, this.middle, this.vonParticle, this.last, this.suffix)) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        this.fullName = String.join(" ", parts);
    }

    /** Parses one name; returns {@code null} for a blank string. */
    public static Author parse(String name) {
        Objects.requireNonNull(name, "name");
        String raw = BibText.normalizeWhitespace(name);
        if (raw.isEmpty()) {
            return null;
        }
        List<String> parts = BibText.splitTopLevel(raw, ',');
        if (parts.size() >= 3) {
            NameSplit lastPart = splitVon(BibText.words(parts.get(0)));
            FirstMiddle given = firstMiddle(BibText.words(String.join(" ", parts.subList(2, parts.size()))));
            return new Author(
                    given.first, given.middle, lastPart.last, lastPart.von, BibText.clean(parts.get(1)), raw);
        }
        if (parts.size() == 2) {
            NameSplit lastPart = splitVon(BibText.words(parts.get(0)));
            FirstMiddle given = firstMiddle(BibText.words(parts.get(1)));
            return new Author(given.first, given.middle, lastPart.last, lastPart.von, "", raw);
        }
        List<String> words = new ArrayList<>(BibText.words(raw));
        String suffix = "";
        if (words.size() > 1 && SUFFIXES.contains(words.get(words.size() - 1).toLowerCase(Locale.ROOT))) {
            suffix = words.remove(words.size() - 1);
        }
        if (words.size() == 1) {
            return new Author("", "", BibText.clean(words.get(0)), "", suffix, raw);
        }
        String first = BibText.clean(words.get(0));
        String last = BibText.clean(words.get(words.size() - 1));
        List<String> between = words.subList(1, words.size() - 1);
        int vonStart = between.size();
        while (vonStart > 0 && isLowercaseWord(between.get(vonStart - 1))) {
            vonStart--;
        }
        String middle = cleanJoin(between.subList(0, vonStart));
        String von = cleanJoin(between.subList(vonStart, between.size()));
        return new Author(first, middle, last, von, suffix, raw);
    }

    /** Parses an {@code and}-separated name list, skipping blank names. */
    public static List<Author> parseList(String names) {
        List<Author> authors = new ArrayList<>();
        if (names == null) {
            return authors;
        }
        for (String name : BibText.splitNames(names)) {
            Author author = parse(name);
            if (author != null) {
                authors.add(author);
            }
        }
        return authors;
    }

    private static NameSplit splitVon(List<String> words) {
        int index = 0;
        while (index < words.size() - 1 && isLowercaseWord(words.get(index))) {
            index++;
        }
        return new NameSplit(cleanJoin(words.subList(0, index)), cleanJoin(words.subList(index, words.size())));
    }

    private static FirstMiddle firstMiddle(List<String> words) {
        if (words.isEmpty()) {
            return new FirstMiddle("", "");
        }
        return new FirstMiddle(BibText.clean(words.get(0)), cleanJoin(words.subList(1, words.size())));
    }

    private static boolean isLowercaseWord(String word) {
        return !word.isEmpty() && Character.isLowerCase(word.charAt(0));
    }

    private static String cleanJoin(List<String> words) {
        return BibText.clean(String.join(" ", words));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    public String getFirst() {
        return first;
    }

    public String getMiddle() {
        return middle;
    }

    public String getLast() {
        return last;
    }

    public String getVonParticle() {
        return vonParticle;
    }

    public String getSuffix() {
        return suffix;
    }

    public String getFullName() {
        return fullName;
    }

    public String getRaw() {
        return raw;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Author)) {
            return false;
        }
        Author other = (Author) obj;
        return first.equals(other.first)
                && middle.equals(other.middle)
                && last.equals(other.last)
                && vonParticle.equals(other.vonParticle)
                && suffix.equals(other.suffix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, middle, last, vonParticle, suffix);
    }

    @Override
    public String toString() {
        return fullName;
    }

    private record NameSplit(String von, String last) {}

    private record FirstMiddle(String first, String middle) {}
}
