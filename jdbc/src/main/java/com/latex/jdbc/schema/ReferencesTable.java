package com.latex.jdbc.schema;

import com.latex.jdbc.xref.CrossReferenceReport;
import com.latex.jdbc.xref.Label;
import com.latex.jdbc.xref.Reference;
import com.latex.jdbc.xref.ReferenceResolution;
import java.util.ArrayList;
import java.util.List;

/**
 * One row per referenced label. The table name is a reserved word, so queries must quote it:
 * {@code SELECT * FROM "references"}.
 */
public final class ReferencesTable {
    public static final String NAME = "references";

    private static final TableDefinition DEFINITION =
            new TableDefinition(
                    NAME,
                    "Cross-reference commands and their resolution",
                    List.of(
                            ColumnDescriptor.integer("id", false),
                            ColumnDescriptor.varchar("command_name", false),
                            ColumnDescriptor.varchar("target_label", false),
                            ColumnDescriptor.bool("resolved", false),
                            ColumnDescriptor.integer("target_lineno", true),
                            ColumnDescriptor.varchar("error", true),
                            ColumnDescriptor.integer("source_lineno", false),
                            ColumnDescriptor.integer("source_column", false)));

    private ReferencesTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(CrossReferenceReport report) {
        List<Object[]> rows = new ArrayList<>(report.getReferences().size());
        for (Reference reference : report.getReferences()) {
            ReferenceResolution resolution = report.getResolutions().get(reference.getTargetLabel());
            Label target = resolution == null ? null : resolution.getTarget().orElse(null);
            rows.add(
                    new Object[] {
                        rows.size() + 1,
                        reference.getCommandName(),
                        reference.getTargetLabel(),
                        target != null,
                        target == null ? null : target.getLocation().getLine(),
                        resolution == null ? null : resolution.getError().orElse(null),
                        reference.getLocation().getLine(),
                        reference.getLocation().getColumn()
                    });
        }
        return rows;
    }
}
