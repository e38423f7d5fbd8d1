package com.latex.jdbc.schema;

import com.latex.jdbc.loader.ast.Command;
import java.util.ArrayList;
import java.util.List;

/** One row per command occurrence, including {@code \begin} and {@code \end}. */
public final class CommandsTable {
    public static final String NAME = "commands";

    private static final TableDefinition DEFINITION =
            new TableDefinition(
                    NAME,
                    "Commands with their arguments",
                    List.of(
                            ColumnDescriptor.integer("id", false),
                            ColumnDescriptor.varchar("name", false),
                            ColumnDescriptor.bool("star_form", false),
                            ColumnDescriptor.integer("argument_count", false),
                            ColumnDescriptor.varchar("first_argument", true),
                            ColumnDescriptor.varchar("arguments", true),
                            ColumnDescriptor.varchar("optional_arguments", true),
                            ColumnDescriptor.integer("source_lineno", false),
                            ColumnDescriptor.integer("source_column", false),
                            ColumnDescriptor.integer("start_offset", false),
                            ColumnDescriptor.integer("end_offset", false)));

    private CommandsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<Command> commands) {
        List<Object[]> rows = new ArrayList<>(commands.size());
        int id = 1;
        for (Command command : commands) {
            rows.add(
                    new Object[] {
                        id++,
                        command.getName(),
                        command.isStarForm(),
                        command.getArguments().size(),
                        command.firstArgument(),
                        Rows.renderArguments(command.getArguments(), '{', '}'),
                        Rows.renderArguments(command.getOptionalArguments(), '[', ']'),
                        command.getLocation().getLine(),
                        command.getLocation().getColumn(),
                        command.getOffset(),
                        command.getEndOffset()
                    });
        }
        return rows;
    }
}
