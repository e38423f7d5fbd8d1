package com.latex.jdbc.schema;

import com.latex.jdbc.xref.CrossReferenceReport;
import com.latex.jdbc.xref.Label;
import com.latex.jdbc.xref.ReferenceResolution;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Every {@code \label} occurrence. A name defined more than once appears once per definition;
 * only the first has {@code duplicate = false}.
 */
public final class LabelsTable {
    public static final String NAME = "labels";

    private static final TableDefinition DEFINITION =
            new TableDefinition(
                    NAME,
                    "Label definitions",
                    List.of(
                            ColumnDescriptor.integer("id", false),
                            ColumnDescriptor.varchar("name", false),
                            ColumnDescriptor.bool("duplicate", false),
                            ColumnDescriptor.integer("reference_count", false),
                            ColumnDescriptor.integer("source_lineno", false),
                            ColumnDescriptor.integer("source_column", false)));

    private LabelsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(CrossReferenceReport report) {
        List<Object[]> rows = new ArrayList<>(report.getLabels().size());
        Set<String> seen = new HashSet<>();
        for (Label label : report.getLabels()) {
            boolean duplicate = !seen.add(label.getName());
            ReferenceResolution resolution = report.getResolutions().get(label.getName());
            int referenceCount = resolution == null || duplicate ? 0 : resolution.getReferences().size();
            rows.add(
                    new Object[] {
                        rows.size() + 1,
                        label.getName(),
                        duplicate,
                        referenceCount,
                        label.getLocation().getLine(),
                        label.getLocation().getColumn()
                    });
        }
        return rows;
    }
}
