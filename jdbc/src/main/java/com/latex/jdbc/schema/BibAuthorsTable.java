package com.latex.jdbc.schema;

import com.latex.jdbc.bibtex.Author;
import com.latex.jdbc.bibtex.BibEntry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Parsed author and editor names, one row per person per entry. */
public final class BibAuthorsTable {
    public static final String NAME = "bib_authors";

    static final String ROLE_AUTHOR = "author";
    static final String ROLE_EDITOR = "editor";

    private static final TableDefinition DEFINITION =
            new TableDefinition(
                    NAME,
                    "Authors and editors of BibTeX entries",
                    List.of(
                            ColumnDescriptor.varchar("citation_key", false),
                            ColumnDescriptor.varchar("role", false),
                            ColumnDescriptor.integer("position", false),
                            ColumnDescriptor.varchar("first_name", true),
                            ColumnDescriptor.varchar("middle_name", true),
                            ColumnDescriptor.varchar("last_name", true),
                            ColumnDescriptor.varchar("von_particle", true),
                            ColumnDescriptor.varchar("suffix", true),
                            ColumnDescriptor.varchar("full_name", false),
                            ColumnDescriptor.varchar("raw_name", false)));

    private BibAuthorsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(Collection<BibEntry> entries) {
        List<Object[]> rows = new ArrayList<>();
        for (BibEntry entry : entries) {
            appendPeople(entry.getKey(), ROLE_AUTHOR, entry.getAuthors(), rows);
            appendPeople(entry.getKey(), ROLE_EDITOR, entry.getEditors(), rows);
        }
        return rows;
    }

    private static void appendPeople(String key, String role, List<Author> people, List<Object[]> rows) {
        int position = 0;
        for (Author author : people) {
            position++;
            rows.add(
                    new Object[] {
                        key,
                        role,
                        position,
                        Rows.emptyToNull(author.getFirst()),
                        Rows.emptyToNull(author.getMiddle()),
                        Rows.emptyToNull(author.getLast()),
                        Rows.emptyToNull(author.getVonParticle()),
                        Rows.emptyToNull(author.getSuffix()),
                        author.getFullName(),
                        author.getRaw()
                    });
        }
    }
}
