package com.latex.jdbc.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.latex.jdbc.loader.LoaderMessage;
import com.latex.jdbc.loader.LoaderOptions;
import com.latex.jdbc.testing.TestResources;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LatexDocumentAnalyzerTest {

    private static final String PAPER = TestResources.readResource("documents/paper.tex");
    private static final Map<String, String> BIBLIOGRAPHY =
            Map.of("references.bib", TestResources.readResource("documents/references.bib"));

    private final LatexDocumentAnalyzer analyzer = new LatexDocumentAnalyzer();

    @Test
    void readsPreamble() {
        PreambleInfo preamble = analyzer.analyze("paper.tex", PAPER).getPreamble();

        assertEquals("article", preamble.getDocumentClass());
        assertEquals(List.of("11pt", "a4paper"), preamble.getDocumentClassOptions());
        assertEquals(List.of("inputenc", "amsmath", "graphicx", "natbib"), preamble.getPackages());
        assertTrue(preamble.usesPackage("natbib"));
    }

    @Test
    void collectsFloatAttributes() {
        List<FloatInfo> floats = analyzer.analyze("paper.tex", PAPER).getFloats();

        assertEquals(1, floats.size());
        FloatInfo figure = floats.get(0);
        assertEquals(FloatInfo.Kind.FIGURE, figure.getKind());
        assertEquals("A plot", figure.getCaption());
        assertEquals("fig:plot", figure.getLabel());
        assertEquals(List.of("plot.pdf"), figure.getGraphics());
        assertEquals(31, figure.getLocation().getLine());
    }

    @Test
    void floatWithoutCaptionHasNullCaption() {
        FloatInfo table =
                analyzer.analyze("t.tex", "\\begin{table}\\label{tab:x}\\end{table}").getFloats().get(0);

        assertEquals(FloatInfo.Kind.TABLE, table.getKind());
        assertNull(table.getCaption());
        assertEquals("tab:x", table.getLabel());
    }

    @Test
    void ordersEquationsBySourcePosition() {
        List<DocumentEquation> equations = analyzer.analyze("paper.tex", PAPER).getEquations();

        List<DocumentEquation.Origin> origins = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (DocumentEquation equation : equations) {
            origins.add(equation.getOrigin());
            names.add(equation.getName());
        }
        assertEquals(
                List.of(
                        DocumentEquation.Origin.INLINE,
                        DocumentEquation.Origin.ENVIRONMENT,
                        DocumentEquation.Origin.ENVIRONMENT,
                        DocumentEquation.Origin.DISPLAY),
                origins);
        assertEquals("equation", names.get(1));
        assertEquals("align", names.get(2));
        assertTrue(equations.get(2).getEnvironmentAnalysis().isPresent());
        assertFalse(equations.get(0).getEnvironmentAnalysis().isPresent());
    }

    @Test
    void resolvesCitationsAgainstBibliography() {
        LatexDocument document =
                analyzer.analyze("paper.tex", PAPER, BIBLIOGRAPHY, LoaderOptions.defaults());

        assertEquals(List.of("references"), document.getBibliographyNames());
        assertEquals(3, document.getBibliography().size());
        assertEquals(List.of("missing2020"), document.getCitationReport().getUnresolvedKeys());
        assertEquals(1, document.getCitationReport().getUnusedEntries().size());
    }

    @Test
    void validationAddsDiagnostics() {
        LatexDocument document =
                analyzer.analyze("paper.tex", PAPER, BIBLIOGRAPHY, LoaderOptions.defaults());

        assertEquals(3, count(document.getMessages(), LoaderMessage.Level.WARNING));
        assertEquals(1, count(document.getMessages(), LoaderMessage.Level.INFO));
        assertFalse(document.hasErrors());
    }

    @Test
    void validationCanBeSwitchedOff() {
        LatexDocument document =
                analyzer.analyze(
                        "paper.tex", PAPER, BIBLIOGRAPHY, LoaderOptions.defaults().withValidate(false));

        assertTrue(document.getMessages().isEmpty());
        assertEquals(5, document.getCrossReferences().getLabels().size());
    }

    private static long count(List<LoaderMessage> messages, LoaderMessage.Level level) {
        return messages.stream().filter(message -> message.getLevel() == level).count();
    }
}
