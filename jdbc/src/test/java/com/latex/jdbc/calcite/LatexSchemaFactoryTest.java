package com.latex.jdbc.calcite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import org.apache.calcite.jdbc.CalciteConnection;
import org.apache.calcite.jdbc.CalciteSchema;
import org.apache.calcite.schema.SchemaPlus;
import org.junit.jupiter.api.Test;

final class LatexSchemaFactoryTest {

    @Test
    void registersSchemaViaInlineModel() throws Exception {
        Class.forName("org.apache.calcite.jdbc.Driver");
        Properties props =
                CalciteIntegrationTestSupport.newCalciteConnectionProperties(
                        CalciteIntegrationTestSupport.paperPath());
        try (Connection connection = DriverManager.getConnection("jdbc:calcite:", props)) {
            CalciteConnection calcite = connection.unwrap(CalciteConnection.class);
            SchemaPlus root = calcite.getRootSchema();
            Set<String> schemas = root.getSubSchemaNames();
            assertTrue(
                    schemas.contains("latex"),
                    "Expected root schema to contain 'latex' but found: " + schemas);
            Set<String> tables = root.getSubSchema("latex").getTableNames();
            assertEquals(
                    Set.of(
                            "tokens", "commands", "environments", "sections", "math", "citations",
                            "bib_entries", "bib_authors", "labels", "references", "floats", "diagnostics"),
                    tables);
        }
    }

    @Test
    void loaderOptionsTravelInTheOperand() throws Exception {
        Class.forName("org.apache.calcite.jdbc.Driver");
        Properties props =
                CalciteIntegrationTestSupport.newCalciteConnectionProperties(
                        CalciteIntegrationTestSupport.paperPath(), ",\"validate\":\"false\"");
        try (Connection connection = DriverManager.getConnection("jdbc:calcite:", props);
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM \"latex\".\"diagnostics\"")) {
            rs.next();
            assertEquals(0, rs.getInt(1));
        }
    }

    @Test
    void operandWithoutDocumentIsRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () ->
                        new LatexSchemaFactory()
                                .create(CalciteSchema.createRootSchema(false).plus(), "latex", Map.of()));
    }
}
