package com.latex.jdbc.schema;

import com.latex.jdbc.loader.lexer.Token;
import java.util.ArrayList;
import java.util.List;

/** One row per lexical token, in source order. */
public final class TokensTable {
    public static final String NAME = "tokens";

    private static final TableDefinition DEFINITION =
            new TableDefinition(
                    NAME,
                    "Lexical tokens of the document",
                    List.of(
                            ColumnDescriptor.integer("id", false),
                            ColumnDescriptor.varchar("kind", false),
                            ColumnDescriptor.varchar("text", false),
                            ColumnDescriptor.integer("source_lineno", false),
                            ColumnDescriptor.integer("source_column", false),
                            ColumnDescriptor.integer("start_offset", false),
                            ColumnDescriptor.integer("end_offset", false)));

    private TokensTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<Token> tokens) {
        List<Object[]> rows = new ArrayList<>(tokens.size());
        int id = 1;
        for (Token token : tokens) {
            rows.add(
                    new Object[] {
                        id++,
                        token.getKind().name(),
                        token.getText(),
                        token.getLine(),
                        token.getColumn(),
                        token.getOffset(),
                        token.getEndOffset()
                    });
        }
        return rows;
    }
}
