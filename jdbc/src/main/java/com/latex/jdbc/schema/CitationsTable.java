package com.latex.jdbc.schema;

import com.latex.jdbc.citation.Citation;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** One row per cited key; a {@code \cite{a,b}} command yields two rows sharing a citation_id. */
public final class CitationsTable {
    public static final String NAME = "citations";

    private static final TableDefinition DEFINITION =
            new TableDefinition(
                    NAME,
                    "Cited keys",
                    List.of(
                            ColumnDescriptor.integer("id", false),
                            ColumnDescriptor.integer("citation_id", false),
                            ColumnDescriptor.varchar("citation_key", false),
                            ColumnDescriptor.integer("key_position", false),
                            ColumnDescriptor.varchar("command_name", false),
                            ColumnDescriptor.bool("star_form", false),
                            ColumnDescriptor.varchar("prenote", true),
                            ColumnDescriptor.varchar("postnote", true),
                            ColumnDescriptor.bool("resolved", false),
                            ColumnDescriptor.varchar("raw_text", false),
                            ColumnDescriptor.integer("source_lineno", false),
                            ColumnDescriptor.integer("source_column", false)));

    private CitationsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<Citation> citations, Map<String, ?> bibliography) {
        List<Object[]> rows = new ArrayList<>();
        int citationId = 0;
        for (Citation citation : citations) {
            citationId++;
            int position = 0;
            for (String key : citation.getKeys()) {
                position++;
                rows.add(
                        new Object[] {
                            rows.size() + 1,
                            citationId,
                            key,
                            position,
                            citation.getCitationType().getCommandName(),
                            citation.isStarForm(),
                            Rows.emptyToNull(citation.getPrenote()),
                            Rows.emptyToNull(citation.getPostnote()),
                            bibliography.containsKey(key),
                            citation.getRawText(),
                            citation.getLocation().getLine(),
                            citation.getLocation().getColumn()
                        });
            }
        }
        return rows;
    }
}
