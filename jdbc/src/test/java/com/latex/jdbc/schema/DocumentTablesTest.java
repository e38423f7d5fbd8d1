package com.latex.jdbc.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.latex.jdbc.document.LatexDocument;
import com.latex.jdbc.document.LatexDocumentAnalyzer;
import com.latex.jdbc.loader.LoaderMessage;
import com.latex.jdbc.loader.LoaderOptions;
import com.latex.jdbc.testing.TestResources;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

final class DocumentTablesTest {

    private static LatexDocument paper;

    @BeforeAll
    static void analyzePaper() {
        paper =
                new LatexDocumentAnalyzer()
                        .analyze(
                                "paper.tex",
                                TestResources.readResource("documents/paper.tex"),
                                Map.of("references.bib", TestResources.readResource("documents/references.bib")),
                                LoaderOptions.defaults());
    }

    @Test
    void everyRowMatchesItsDefinitionWidth() {
        assertWidth(TokensTable.getDefinition(), TokensTable.materializeRows(paper.getTokens()));
        assertWidth(CommandsTable.getDefinition(), CommandsTable.materializeRows(paper.getCommands()));
        assertWidth(EnvironmentsTable.getDefinition(), EnvironmentsTable.materializeRows(paper.getEnvironments()));
        assertWidth(SectionsTable.getDefinition(), SectionsTable.materializeRows(paper.getSections()));
        assertWidth(MathTable.getDefinition(), MathTable.materializeRows(paper.getEquations()));
        assertWidth(
                CitationsTable.getDefinition(),
                CitationsTable.materializeRows(paper.getCitations(), paper.getBibliography()));
        assertWidth(
                BibEntriesTable.getDefinition(),
                BibEntriesTable.materializeRows(paper.getBibliography().values(), Set.of()));
        assertWidth(BibAuthorsTable.getDefinition(), BibAuthorsTable.materializeRows(paper.getBibliography().values()));
        assertWidth(LabelsTable.getDefinition(), LabelsTable.materializeRows(paper.getCrossReferences()));
        assertWidth(ReferencesTable.getDefinition(), ReferencesTable.materializeRows(paper.getCrossReferences()));
        assertWidth(FloatsTable.getDefinition(), FloatsTable.materializeRows(paper.getFloats()));
        assertWidth(DiagnosticsTable.getDefinition(), DiagnosticsTable.materializeRows(paper.getMessages()));
    }

    @Test
    void commandArgumentsAreRenderedAsWritten() {
        TableDefinition definition = CommandsTable.getDefinition();
        Object[] documentClass = CommandsTable.materializeRows(paper.getCommands()).get(0);

        assertEquals("documentclass", documentClass[definition.indexOf("name")]);
        assertEquals("{article}", documentClass[definition.indexOf("arguments")]);
        assertEquals("[11pt,a4paper]", documentClass[definition.indexOf("optional_arguments")]);
        assertEquals(1, documentClass[definition.indexOf("id")]);

        Object[] maketitle =
                CommandsTable.materializeRows(paper.getCommands()).stream()
                        .filter(row -> "maketitle".equals(row[definition.indexOf("name")]))
                        .findFirst()
                        .orElseThrow();
        assertNull(maketitle[definition.indexOf("arguments")]);
        assertNull(maketitle[definition.indexOf("first_argument")]);
        assertEquals(0, maketitle[definition.indexOf("argument_count")]);
    }

    @Test
    void bibEntryCellsUseNullForAbsentFields() {
        TableDefinition definition = BibEntriesTable.getDefinition();
        List<Object[]> rows = BibEntriesTable.materializeRows(paper.getBibliography().values(), Set.of("doe21"));

        Object[] doe = rows.get(0);
        assertEquals("doe21", doe[definition.indexOf("citation_key")]);
        assertEquals("ARTICLE", doe[definition.indexOf("entry_type")]);
        assertEquals("Journal of Machine Learning", doe[definition.indexOf("journal")]);
        assertEquals(2021, doe[definition.indexOf("year")]);
        assertEquals(2, doe[definition.indexOf("author_count")]);
        assertEquals("Doe", doe[definition.indexOf("first_author_last_name")]);
        assertEquals(true, doe[definition.indexOf("cited")]);
        assertNull(doe[definition.indexOf("doi")]);
        assertNull(doe[definition.indexOf("booktitle")]);
        assertEquals(false, rows.get(2)[definition.indexOf("cited")]);
    }

    @Test
    void authorRowsSplitNameParts() {
        TableDefinition definition = BibAuthorsTable.getDefinition();
        List<Object[]> rows = BibAuthorsTable.materializeRows(paper.getBibliography().values());

        Object[] fontaine = rows.get(rows.size() - 1);
        assertEquals("unused22", fontaine[definition.indexOf("citation_key")]);
        assertEquals("de la", fontaine[definition.indexOf("von_particle")]);
        assertEquals("Fontaine", fontaine[definition.indexOf("last_name")]);
        assertNull(fontaine[definition.indexOf("middle_name")]);

        long editors = rows.stream().filter(row -> "editor".equals(row[definition.indexOf("role")])).count();
        assertEquals(1, editors);
    }

    @Test
    void labelRowsMarkLaterDuplicates() {
        TableDefinition definition = LabelsTable.getDefinition();
        List<Object[]> rows = LabelsTable.materializeRows(paper.getCrossReferences());

        assertEquals(5, rows.size());
        Object[] last = rows.get(rows.size() - 1);
        assertEquals("sec:intro", last[definition.indexOf("name")]);
        assertEquals(true, last[definition.indexOf("duplicate")]);
        assertEquals(false, rows.get(0)[definition.indexOf("duplicate")]);
    }

    @Test
    void referenceRowsPointAtTheTargetLine() {
        TableDefinition definition = ReferencesTable.getDefinition();
        List<Object[]> rows = ReferencesTable.materializeRows(paper.getCrossReferences());

        assertEquals(3, rows.size());
        assertEquals("sec:method", rows.get(0)[definition.indexOf("target_label")]);
        assertEquals(20, rows.get(0)[definition.indexOf("target_lineno")]);
        assertNull(rows.get(0)[definition.indexOf("error")]);
        assertEquals("undefined", rows.get(2)[definition.indexOf("error")]);
        assertNull(rows.get(2)[definition.indexOf("target_lineno")]);
    }

    @Test
    void diagnosticRowsCarryLevelAndCategoryNames() {
        TableDefinition definition = DiagnosticsTable.getDefinition();
        List<Object[]> rows =
                DiagnosticsTable.materializeRows(
                        List.of(
                                LoaderMessage.error(
                                        LoaderMessage.Category.BIB_ENTRY, "Unclosed entry", "refs.bib", 4, 1)));

        Object[] row = rows.get(0);
        assertEquals("ERROR", row[definition.indexOf("level")]);
        assertEquals("BIB_ENTRY", row[definition.indexOf("category")]);
        assertEquals("refs.bib", row[definition.indexOf("source_filename")]);
        assertEquals(4, row[definition.indexOf("source_lineno")]);
    }

    @Test
    void unknownColumnHasNoIndex() {
        assertEquals(-1, FloatsTable.getDefinition().indexOf("nope"));
        assertFalse(FloatsTable.getDefinition().getColumns().isEmpty());
        assertTrue(ReferencesTable.getDefinition().indexOf("resolved") > 0);
    }

    private static void assertWidth(TableDefinition definition, List<Object[]> rows) {
        for (Object[] row : rows) {
            assertEquals(definition.getColumns().size(), row.length, definition.getName());
        }
    }
}
