package com.latex.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class LatexDriverTest {

    @Test
    void acceptsOnlyLatexUrls() {
        LatexDriver driver = new LatexDriver();

        assertTrue(driver.acceptsURL("jdbc:latex:/tmp/a.tex"));
        assertFalse(driver.acceptsURL("jdbc:sqlite:/tmp/a.db"));
        assertFalse(driver.acceptsURL(null));
    }

    @Test
    void connectReturnsNullForForeignUrls() throws Exception {
        assertNull(new LatexDriver().connect("jdbc:calcite:", null));
    }

    @Test
    void parsesPathAndDecodedQueryParameters(@TempDir Path directory) throws Exception {
        Path document = Files.writeString(directory.resolve("a.tex"), "\\section{A}");

        LatexDriver.ParsedUrl parsed =
                LatexDriver.parseUrl("jdbc:latex:" + document + "?validate=false&duplicateKeys=keep%2Dfirst&flag");

        assertEquals(document.toAbsolutePath().normalize(), parsed.documentPath());
        assertEquals("false", parsed.properties().getProperty("validate"));
        assertEquals("keep-first", parsed.properties().getProperty("duplicateKeys"));
        assertEquals("", parsed.properties().getProperty("flag"));
    }

    @Test
    void parsesFileUris(@TempDir Path directory) throws Exception {
        Path document = Files.writeString(directory.resolve("b.tex"), "");

        LatexDriver.ParsedUrl parsed = LatexDriver.parseUrl("jdbc:latex:" + document.toUri());

        assertEquals(document.toAbsolutePath().normalize(), parsed.documentPath());
        assertTrue(parsed.properties().isEmpty());
    }

    @Test
    void rejectsUrlsWithoutADocument() {
        assertThrows(SQLException.class, () -> LatexDriver.parseUrl("jdbc:latex:"));
        assertThrows(SQLException.class, () -> LatexDriver.parseUrl("jdbc:latex:?validate=false"));
    }

    @Test
    void describesItsProperties() {
        DriverPropertyInfo[] info = new LatexDriver().getPropertyInfo("jdbc:latex:x.tex", null);

        assertEquals(4, info.length);
        assertEquals("document", info[0].name);
        assertTrue(info[0].required);
        assertEquals("64", info[1].value);
    }
}
