package com.latex.jdbc.schema;

import com.latex.jdbc.document.FloatInfo;
import java.util.ArrayList;
import java.util.List;

public final class FloatsTable {
    public static final String NAME = "floats";

    private static final TableDefinition DEFINITION =
            new TableDefinition(
                    NAME,
                    "Figure and table floats",
                    List.of(
                            ColumnDescriptor.integer("id", false),
                            ColumnDescriptor.varchar("environment_name", false),
                            ColumnDescriptor.varchar("kind", false),
                            ColumnDescriptor.varchar("caption", true),
                            ColumnDescriptor.varchar("label", true),
                            ColumnDescriptor.varchar("graphics", true),
                            ColumnDescriptor.integer("source_lineno", false),
                            ColumnDescriptor.integer("source_column", false)));

    private FloatsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<FloatInfo> floats) {
        List<Object[]> rows = new ArrayList<>(floats.size());
        for (FloatInfo info : floats) {
            rows.add(
                    new Object[] {
                        rows.size() + 1,
                        info.getEnvironmentName(),
                        info.getKind().name(),
                        info.getCaption(),
                        info.getLabel(),
                        Rows.joinOrNull(info.getGraphics()),
                        info.getLocation().getLine(),
                        info.getLocation().getColumn()
                    });
        }
        return rows;
    }
}
