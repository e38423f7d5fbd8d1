package com.latex.jdbc.schema;

import com.latex.jdbc.loader.ast.Environment;
import java.util.ArrayList;
import java.util.List;

/**
 * Flattened environment tree. Rows are numbered depth-first in document order; {@code parent_id}
 * is null for top-level environments and {@code depth} starts at 0.
 */
public final class EnvironmentsTable {
    public static final String NAME = "environments";

    private static final TableDefinition DEFINITION =
            new TableDefinition(
                    NAME,
                    "Matched begin/end environment pairs",
                    List.of(
                            ColumnDescriptor.integer("id", false),
                            ColumnDescriptor.integer("parent_id", true),
                            ColumnDescriptor.integer("depth", false),
                            ColumnDescriptor.varchar("name", false),
                            ColumnDescriptor.varchar("begin_arguments", true),
                            ColumnDescriptor.varchar("content", false),
                            ColumnDescriptor.integer("nested_count", false),
                            ColumnDescriptor.integer("source_lineno", false),
                            ColumnDescriptor.integer("source_column", false),
                            ColumnDescriptor.integer("end_lineno", false),
                            ColumnDescriptor.integer("start_offset", false),
                            ColumnDescriptor.integer("end_offset", false)));

    private EnvironmentsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<Environment> topLevel) {
        List<Object[]> rows = new ArrayList<>();
        for (Environment environment : topLevel) {
            append(environment, null, 0, rows);
        }
        return rows;
    }

    private static void append(Environment environment, Integer parentId, int depth, List<Object[]> rows) {
        int id = rows.size() + 1;
        rows.add(
                new Object[] {
                    id,
                    parentId,
                    depth,
                    environment.getName(),
                    Rows.renderArguments(environment.getBeginArguments(), '{', '}'),
                    environment.getContent(),
                    environment.getNestedEnvironments().size(),
                    environment.getLocation().getLine(),
                    environment.getLocation().getColumn(),
                    environment.getEndLocation().getLine(),
                    environment.getBeginOffset(),
                    environment.getEndOffset()
                });
        for (Environment nested : environment.getNestedEnvironments()) {
            append(nested, id, depth + 1, rows);
        }
    }
}
