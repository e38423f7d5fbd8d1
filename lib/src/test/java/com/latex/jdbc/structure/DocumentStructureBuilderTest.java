package com.latex.jdbc.structure;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.latex.jdbc.loader.LatexParser;
import com.latex.jdbc.loader.LoaderOptions;
import com.latex.jdbc.loader.ParseResult;
import com.latex.jdbc.loader.ast.Command;
import com.latex.jdbc.loader.ast.DocumentSection;
import com.latex.jdbc.loader.ast.Environment;
import com.latex.jdbc.loader.lexer.LatexTokenizer;
import com.latex.jdbc.testing.TestResources;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentStructureBuilderTest {

    @Test
    void nestsSubsectionsUnderTheirSection() {
        List<DocumentSection> roots =
                build("\\section{A}\\subsection{A.1}\\subsubsection{A.1.1}\\subsection{A.2}\\section{B}");

        assertEquals(2, roots.size());
        DocumentSection first = roots.get(0);
        assertEquals("A", first.getTitle());
        assertEquals(3, first.getLevel());
        assertEquals(2, first.getSubsections().size());
        assertEquals("A.1.1", first.getSubsections().get(0).getSubsections().get(0).getTitle());
        assertEquals("B", roots.get(1).getTitle());
    }

    @Test
    void skippedLevelsStillNestUnderTheNearestShallowerHeading() {
        List<DocumentSection> roots = build("\\chapter{One}\\subsubsection{Deep}\\section{Two}");

        assertEquals(1, roots.size());
        DocumentSection chapter = roots.get(0);
        assertEquals(2, chapter.getLevel());
        assertEquals(List.of("Deep", "Two"), List.of(
                chapter.getSubsections().get(0).getTitle(), chapter.getSubsections().get(1).getTitle()));
    }

    @Test
    void missingTitleGetsPlaceholder() {
        List<DocumentSection> roots = build("\\section\n\nText");

        assertEquals("Untitled section", roots.get(0).getTitle());
    }

    @Test
    void attachesElementsToTheEnclosingSection() {
        List<DocumentSection> roots = build("\\label{before}\\section{A}\\label{a}\\begin{itemize}\\end{itemize}");

        DocumentSection section = roots.get(0);
        assertEquals(2, section.getElements().size());
        assertTrue(section.getElements().get(0) instanceof Command);
        assertTrue(section.getElements().get(1) instanceof Environment);
    }

    @Test
    void childLevelsAreAlwaysDeeperThanTheirParent() {
        List<DocumentSection> roots = build(TestResources.readResource("documents/paper.tex"));

        assertEquals(3, roots.size());
        assertMonotonic(roots);
    }

    private static void assertMonotonic(List<DocumentSection> sections) {
        for (DocumentSection section : sections) {
            for (DocumentSection child : section.getSubsections()) {
                assertTrue(child.getLevel() > section.getLevel(), child.getTitle() + " under " + section.getTitle());
            }
            assertMonotonic(section.getSubsections());
        }
    }

    private static List<DocumentSection> build(String source) {
        ParseResult parsed =
                new LatexParser("test.tex", LoaderOptions.defaults()).parse(new LatexTokenizer().tokenize(source));
        return new DocumentStructureBuilder().build(parsed.getCommands(), parsed.getEnvironments());
    }
}
