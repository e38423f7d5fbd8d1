package com.latex.jdbc.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.latex.jdbc.document.LatexDocument;
import com.latex.jdbc.document.LatexDocumentAnalyzer;
import com.latex.jdbc.loader.LoaderMessage;
import com.latex.jdbc.loader.LoaderOptions;
import com.latex.jdbc.testing.TestResources;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValidationRunnerTest {

    @Test
    void defaultRulesReportInRuleOrder() {
        List<LoaderMessage> messages = ValidationRunner.defaultRules().run(analyzePaper());

        assertEquals(4, messages.size());
        assertEquals(LoaderMessage.Category.REFERENCE, messages.get(0).getCategory());
        assertTrue(messages.get(0).getMessage().contains("sec:nowhere"));
        assertEquals(17, messages.get(0).getSourceLineno());
        assertEquals(LoaderMessage.Category.REFERENCE, messages.get(1).getCategory());
        assertTrue(messages.get(1).getMessage().contains("sec:intro"));
        assertEquals(41, messages.get(1).getSourceLineno());
        assertEquals(LoaderMessage.Category.CITATION, messages.get(2).getCategory());
        assertTrue(messages.get(2).getMessage().contains("missing2020"));
        assertEquals(LoaderMessage.Level.INFO, messages.get(3).getLevel());
        assertEquals("references.bib", messages.get(3).getSourceFilename());
        assertEquals(22, messages.get(3).getSourceLineno());
    }

    @Test
    void customRuleListRunsOnlyThoseRules() {
        ValidationRunner runner = new ValidationRunner(List.of(new DuplicateLabelRule()));

        List<LoaderMessage> messages = runner.run(analyzePaper());

        assertEquals(1, messages.size());
        assertEquals(LoaderMessage.Level.WARNING, messages.get(0).getLevel());
    }

    @Test
    void cleanDocumentHasNoDiagnostics() {
        LatexDocument document =
                new LatexDocumentAnalyzer(new ValidationRunner(List.of()))
                        .analyze("clean.tex", "\\section{A}\\label{a} See \\ref{a}.");

        assertTrue(ValidationRunner.defaultRules().run(document).isEmpty());
    }

    private static LatexDocument analyzePaper() {
        return new LatexDocumentAnalyzer(new ValidationRunner(List.of()))
                .analyze(
                        "paper.tex",
                        TestResources.readResource("documents/paper.tex"),
                        Map.of("references.bib", TestResources.readResource("documents/references.bib")),
                        LoaderOptions.defaults());
    }
}
