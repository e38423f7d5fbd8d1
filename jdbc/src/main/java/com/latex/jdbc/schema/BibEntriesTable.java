package com.latex.jdbc.schema;

import com.latex.jdbc.bibtex.BibEntry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/** Bibliography entries after duplicate-key handling, in file order. */
public final class BibEntriesTable {
    public static final String NAME = "bib_entries";

    private static final TableDefinition DEFINITION =
            new TableDefinition(
                    NAME,
                    "BibTeX entries",
                    List.of(
                            ColumnDescriptor.varchar("citation_key", false),
                            ColumnDescriptor.varchar("entry_type", false),
                            ColumnDescriptor.varchar("declared_type", false),
                            ColumnDescriptor.varchar("title", true),
                            ColumnDescriptor.varchar("author", true),
                            ColumnDescriptor.integer("author_count", false),
                            ColumnDescriptor.varchar("first_author_last_name", true),
                            ColumnDescriptor.integer("year", true),
                            ColumnDescriptor.varchar("journal", true),
                            ColumnDescriptor.varchar("booktitle", true),
                            ColumnDescriptor.varchar("publisher", true),
                            ColumnDescriptor.varchar("volume", true),
                            ColumnDescriptor.varchar("number", true),
                            ColumnDescriptor.varchar("pages", true),
                            ColumnDescriptor.varchar("doi", true),
                            ColumnDescriptor.varchar("url", true),
                            ColumnDescriptor.varchar("keywords", true),
                            ColumnDescriptor.bool("cited", false),
                            ColumnDescriptor.varchar("source_filename", false),
                            ColumnDescriptor.integer("source_lineno", false)));

    private BibEntriesTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(Collection<BibEntry> entries, Set<String> citedKeys) {
        List<Object[]> rows = new ArrayList<>(entries.size());
        for (BibEntry entry : entries) {
            rows.add(
                    new Object[] {
                        entry.getKey(),
                        entry.getEntryType().name(),
                        entry.getDeclaredType(),
                        Rows.emptyToNull(entry.getTitle()),
                        Rows.emptyToNull(entry.getRawAuthors()),
                        entry.getAuthors().size(),
                        Rows.emptyToNull(entry.getFirstAuthorLastName()),
                        entry.getYear(),
                        Rows.emptyToNull(entry.getJournal()),
                        Rows.emptyToNull(entry.getBooktitle()),
                        Rows.emptyToNull(entry.getPublisher()),
                        Rows.emptyToNull(entry.getVolume()),
                        Rows.emptyToNull(entry.getNumber()),
                        Rows.emptyToNull(entry.getPages()),
                        Rows.emptyToNull(entry.getDoi()),
                        Rows.emptyToNull(entry.getUrl()),
                        Rows.joinOrNull(entry.getKeywords()),
                        citedKeys.contains(entry.getKey()),
                        entry.getLocation().getSourceName(),
                        entry.getLocation().getLine()
                    });
        }
        return rows;
    }
}
