package com.latex.jdbc.bibtex;

import com.latex.jdbc.loader.ast.SourceLocation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One bibliography entry. Field values are stored after abbreviation expansion and
 * concatenation; prose fields (title, journal, ...) are additionally reduced to plain text by
 * their getters. {@link #getFields()} always returns the uncleaned values.
 */
public final class BibEntry {

    /** Fields with a typed getter; every other field lands in {@link #getExtraFields()}. */
    public static final Set<String> KNOWN_FIELDS =
            Set.of(
                    "author", "editor", "title", "journal", "booktitle", "publisher", "year", "month",
                    "volume", "number", "pages", "doi", "url", "isbn", "issn", "address", "edition",
                    "chapter", "note", "abstract", "keywords", "school", "institution", "organization",
                    "series", "howpublished");

    private static final Pattern YEAR = Pattern.compile("\\d{4}");

    private final String key;
    private final BibEntryType entryType;
    private final String declaredType;
    private final Map<String, String> fields;
    private final List<Author> authors;
    private final List<Author> editors;
    private final Integer year;
    private final List<String> keywords;
    private final SourceLocation location;
    private final String rawEntry;

    public BibEntry(
            String key,
            BibEntryType entryType,
            String declaredType,
            Map<String, String> fields,
            SourceLocation location,
            String rawEntry) {
        this.key = Objects.requireNonNull(key, "key");
        this.entryType = Objects.requireNonNull(entryType, "entryType");
        this.declaredType = declaredType == null ? entryType.getBibtexName() : declaredType;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
        this.location = Objects.requireNonNull(location, "location");
        this.rawEntry = rawEntry == null ? "" : rawEntry;
        this.authors = List.copyOf(Author.parseList(this.fields.get("author")));
        this.editors = List.copyOf(Author.parseList(this.fields.get("editor")));
        this.year = parseYear(this.fields.get("year"));
        this.keywords = List.copyOf(parseKeywords(this.fields.get("keywords")));
    }

    private static Integer parseYear(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = YEAR.matcher(value);
        return matcher.find() ? Integer.valueOf(matcher.group()) : null;
    }

    private static List<String> parseKeywords(String value) {
        List<String> out = new ArrayList<>();
        if (value == null) {
            return out;
        }
        for (String part : BibText.clean(value).split("[,;]")) {
            String keyword = part.trim();
            if (!keyword.isEmpty()) {
                out.add(keyword);
            }
        }
        return out;
    }

    public String getKey() {
        return key;
    }

    public BibEntryType getEntryType() {
        return entryType;
    }

    /** The type as written after {@code @}, lower-cased; differs from the entry type for unknown types. */
    public String getDeclaredType() {
        return declaredType;
    }

    public List<Author> getAuthors() {
        return authors;
    }

    public List<Author> getEditors() {
        return editors;
    }

    /** Last name of the first author, or an empty string when there are no authors. */
    public String getFirstAuthorLastName() {
        return authors.isEmpty() ? "" : authors.get(0).getLast();
    }

    public String getRawAuthors() {
        return raw("author");
    }

    /** First four-digit run of the year field, or {@code null} when absent. */
    public Integer getYear() {
        return year;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public String getTitle() {
        return cleaned("title");
    }

    public String getJournal() {
        return cleaned("journal");
    }

    public String getBooktitle() {
        return cleaned("booktitle");
    }

    public String getPublisher() {
        return cleaned("publisher");
    }

    public String getMonth() {
        return raw("month");
    }

    public String getVolume() {
        return raw("volume");
    }

    public String getNumber() {
        return raw("number");
    }

    public String getPages() {
        return raw("pages");
    }

    public String getDoi() {
        return raw("doi");
    }

    public String getUrl() {
        return raw("url");
    }

    public String getIsbn() {
        return raw("isbn");
    }

    public String getIssn() {
        return raw("issn");
    }

    public String getAddress() {
        return cleaned("address");
    }

    public String getEdition() {
        return raw("edition");
    }

    public String getChapter() {
        return raw("chapter");
    }

    public String getNote() {
        return cleaned("note");
    }

    public String getAbstract() {
        return cleaned("abstract");
    }

    public String getSchool() {
        return cleaned("school");
    }

    public String getInstitution() {
        return cleaned("institution");
    }

    public String getOrganization() {
        return cleaned("organization");
    }

    public String getSeries() {
        return cleaned("series");
    }

    public String getHowpublished() {
        return cleaned("howpublished");
    }

    /** All fields by lower-case name, in file order. */
    public Map<String, String> getFields() {
        return fields;
    }

    public Map<String, String> getExtraFields() {
        Map<String, String> extra = new LinkedHashMap<>();
        for (Map.Entry<String, String> field : fields.entrySet()) {
            if (!KNOWN_FIELDS.contains(field.getKey())) {
                extra.put(field.getKey(), field.getValue());
            }
        }
        return Collections.unmodifiableMap(extra);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getRawEntry() {
        return rawEntry;
    }

    private String raw(String name) {
        String value = fields.get(name);
        return value == null ? "" : value;
    }

    private String cleaned(String name) {
        return BibText.clean(fields.get(name));
    }

    @Override
    public String toString() {
        return "@" + declaredType + "{" + key + ", " + fields.keySet() + "}";
    }
}
