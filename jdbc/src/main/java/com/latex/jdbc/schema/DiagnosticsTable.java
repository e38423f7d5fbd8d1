package com.latex.jdbc.schema;

import com.latex.jdbc.loader.LoaderMessage;
import java.util.ArrayList;
import java.util.List;

/** Loader and analysis diagnostics, in the order they were reported. */
public final class DiagnosticsTable {
    public static final String NAME = "diagnostics";

    private static final TableDefinition DEFINITION =
            new TableDefinition(
                    NAME,
                    "Diagnostics produced while loading the document",
                    List.of(
                            ColumnDescriptor.integer("id", false),
                            ColumnDescriptor.varchar("level", false),
                            ColumnDescriptor.varchar("category", false),
                            ColumnDescriptor.varchar("message", false),
                            ColumnDescriptor.varchar("source_filename", false),
                            ColumnDescriptor.integer("source_lineno", false),
                            ColumnDescriptor.integer("source_column", false)));

    private DiagnosticsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<LoaderMessage> messages) {
        List<Object[]> rows = new ArrayList<>(messages.size());
        for (LoaderMessage message : messages) {
            rows.add(
                    new Object[] {
                        rows.size() + 1,
                        message.getLevel().name(),
                        message.getCategory().name(),
                        message.getMessage(),
                        message.getSourceFilename(),
                        message.getSourceLineno(),
                        message.getSourceColumn()
                    });
        }
        return rows;
    }
}
