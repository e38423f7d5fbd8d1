package com.latex.jdbc.schema;

import com.latex.jdbc.loader.ast.DocumentSection;
import java.util.ArrayList;
import java.util.List;

/** Flattened section tree, depth-first in document order. */
public final class SectionsTable {
    public static final String NAME = "sections";

    private static final TableDefinition DEFINITION =
            new TableDefinition(
                    NAME,
                    "Sectioning hierarchy",
                    List.of(
                            ColumnDescriptor.integer("id", false),
                            ColumnDescriptor.integer("parent_id", true),
                            ColumnDescriptor.integer("level", false),
                            ColumnDescriptor.varchar("command_name", false),
                            ColumnDescriptor.varchar("title", false),
                            ColumnDescriptor.bool("star_form", false),
                            ColumnDescriptor.integer("element_count", false),
                            ColumnDescriptor.integer("subsection_count", false),
                            ColumnDescriptor.integer("source_lineno", false),
                            ColumnDescriptor.integer("source_column", false)));

    private SectionsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<DocumentSection> roots) {
        List<Object[]> rows = new ArrayList<>();
        for (DocumentSection section : roots) {
            append(section, null, rows);
        }
        return rows;
    }

    private static void append(DocumentSection section, Integer parentId, List<Object[]> rows) {
        int id = rows.size() + 1;
        rows.add(
                new Object[] {
                    id,
                    parentId,
                    section.getLevel(),
                    section.getCommandName(),
                    section.getTitle(),
                    section.isStarForm(),
                    section.getElements().size(),
                    section.getSubsections().size(),
                    section.getLocation().getLine(),
                    section.getLocation().getColumn()
                });
        for (DocumentSection child : section.getSubsections()) {
            append(child, id, rows);
        }
    }
}
