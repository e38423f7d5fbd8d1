package com.latex.jdbc.tools;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.Statement;

/**
 * Runs one SQL query against a LaTeX document and prints the rows, one per line, as
 * {@code column=value} pairs separated by {@code " | "}. Load warnings go to standard error.
 */
public final class LatexQueryCli {

    private LatexQueryCli() {}

    public static void main(String[] args) throws Exception {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) throws ClassNotFoundException {
        if (args.length != 2) {
            err.println("Usage: LatexQueryCli <document.tex> <sql>");
            return 1;
        }
        Path document = Path.of(args[0]).toAbsolutePath().normalize();
        if (!Files.exists(document)) {
            err.println("Document file not found: " + document);
            return 1;
        }
        Class.forName("com.latex.jdbc.LatexDriver");
        try (Connection connection = DriverManager.getConnection("jdbc:latex:" + document.toUri())) {
            for (SQLWarning warning = connection.getWarnings();
                    warning != null;
                    warning = warning.getNextWarning()) {
                err.println(warning.getMessage());
            }
            try (Statement statement = connection.createStatement();
                    ResultSet rs = statement.executeQuery(args[1])) {
                printRows(rs, out);
            }
            return 0;
        } catch (SQLException ex) {
            err.println("Query failed: " + ex.getMessage());
            return 2;
        }
    }

    private static void printRows(ResultSet rs, PrintStream out) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columns = metaData.getColumnCount();
        while (rs.next()) {
            StringBuilder builder = new StringBuilder();
            for (int i = 1; i <= columns; i++) {
                if (i > 1) {
                    builder.append(" | ");
                }
                builder.append(metaData.getColumnLabel(i)).append('=').append(rs.getObject(i));
            }
            out.println(builder);
        }
    }
}
