package com.latex.jdbc.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.latex.jdbc.testing.TestResources;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

final class LatexQueryCliTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    void printsRowsAndWarnings() throws Exception {
        TestResources.resolveResource("documents/references.bib");
        Path paper = TestResources.resolveResource("documents/paper.tex");

        int status =
                run(
                        paper.toString(),
                        "SELECT \"name\" AS \"label\", \"duplicate\" FROM \"latex\".\"labels\" WHERE \"id\" <= 2 "
                                + "ORDER BY \"id\"");

        assertEquals(0, status);
        assertEquals(
                "label=sec:intro | duplicate=false" + System.lineSeparator()
                        + "label=sec:method | duplicate=false" + System.lineSeparator(),
                text(out));
        assertTrue(text(err).contains("[LaTeX JDBC] REFERENCE"), text(err));
    }

    @Test
    void usageErrorWithoutArguments() throws Exception {
        assertEquals(1, run());
        assertTrue(text(err).startsWith("Usage:"));
    }

    @Test
    void missingDocumentIsReported() throws Exception {
        assertEquals(1, run("/definitely/not/here.tex", "SELECT 1"));
        assertTrue(text(err).contains("not found"));
    }

    @Test
    void invalidSqlExitsWithTwo() throws Exception {
        Path document = TestResources.resolveResource("documents/unclosed.tex");

        assertEquals(2, run(document.toString(), "SELECT FROM nowhere"));
        assertTrue(text(err).contains("Query failed"));
    }

    private int run(String... args) throws Exception {
        return LatexQueryCli.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static String text(ByteArrayOutputStream stream) {
        return stream.toString(StandardCharsets.UTF_8);
    }
}
