package com.latex.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.latex.jdbc.testing.TestResources;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.Statement;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

final class LatexDriverIntegrationTest {

    private static Path paper;

    @BeforeAll
    static void extractFixtures() throws Exception {
        Class.forName("com.latex.jdbc.LatexDriver");
        TestResources.resolveResource("documents/references.bib");
        paper = TestResources.resolveResource("documents/paper.tex");
    }

    @Test
    void driverConnectsAndQueriesSections() throws Exception {
        try (Connection connection = DriverManager.getConnection("jdbc:latex:" + paper);
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM \"latex\".\"sections\"")) {
            rs.next();
            assertEquals(4, rs.getInt(1));
        }
    }

    @Test
    void defaultSchemaAllowsUnqualifiedNames() throws Exception {
        try (Connection connection = DriverManager.getConnection("jdbc:latex:" + paper.toUri());
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM \"references\"")) {
            rs.next();
            assertEquals(3, rs.getInt(1));
        }
    }

    @Test
    void loaderWarningsFormAChain() throws Exception {
        try (Connection connection = DriverManager.getConnection("jdbc:latex:" + paper)) {
            SQLWarning warning = connection.getWarnings();
            assertNotNull(warning);
            int count = 0;
            for (SQLWarning current = warning; current != null; current = current.getNextWarning()) {
                assertTrue(current.getMessage().startsWith("[LaTeX JDBC] "), current.getMessage());
                count++;
            }
            assertEquals(3, count);
            assertTrue(warning.getMessage().contains("sec:nowhere"), warning.getMessage());

            connection.clearWarnings();
            assertNull(connection.getWarnings());
        }
    }

    @Test
    void urlParametersConfigureTheLoader() throws Exception {
        try (Connection connection = DriverManager.getConnection("jdbc:latex:" + paper + "?validate=false");
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM \"latex\".\"diagnostics\"")) {
            assertNull(connection.getWarnings());
            rs.next();
            assertEquals(0, rs.getInt(1));
        }
    }

    @Test
    void connectionPropertiesConfigureTheLoader() throws Exception {
        Properties info = new Properties();
        info.setProperty("maxEnvironmentDepth", "1");
        try (Connection connection = DriverManager.getConnection("jdbc:latex:" + paper, info);
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM \"latex\".\"environments\"")) {
            rs.next();
            assertEquals(1, rs.getInt(1));
        }
    }

    @Test
    void invalidOptionIsAnSqlException() {
        SQLException ex =
                assertThrows(
                        SQLException.class,
                        () -> DriverManager.getConnection("jdbc:latex:" + paper + "?duplicateKeys=merge"));
        assertTrue(ex.getMessage().contains("duplicateKeys") || ex.getMessage().contains("merge"));
    }

    @Test
    void missingDocumentIsAnSqlException() {
        Path missing = paper.resolveSibling("does-not-exist.tex");
        SQLException ex =
                assertThrows(SQLException.class, () -> DriverManager.getConnection("jdbc:latex:" + missing));
        assertTrue(ex.getMessage().contains("not found"), ex.getMessage());
    }

    @Test
    void metaDataReportsProductAndTables() throws Exception {
        try (Connection connection = DriverManager.getConnection("jdbc:latex:" + paper)) {
            DatabaseMetaData metaData = connection.getMetaData();
            assertEquals("LaTeX", metaData.getDatabaseProductName());
            assertEquals(Version.RUNTIME, metaData.getDriverVersion());
            assertTrue(metaData.getDriverName().startsWith("LaTeX JDBC"));

            Set<String> tableNames = new LinkedHashSet<>();
            try (ResultSet rs = metaData.getTables(null, "latex", "%", null)) {
                while (rs.next()) {
                    tableNames.add(rs.getString("TABLE_NAME"));
                }
            }
            assertTrue(tableNames.contains("sections"), "tables: " + tableNames);
            assertTrue(tableNames.contains("bib_entries"), "tables: " + tableNames);
            assertEquals(12, tableNames.size(), "tables: " + tableNames);
        }
    }
}
