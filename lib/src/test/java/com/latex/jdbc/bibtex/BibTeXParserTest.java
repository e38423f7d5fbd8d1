package com.latex.jdbc.bibtex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.latex.jdbc.loader.DuplicateKeyPolicy;
import com.latex.jdbc.loader.LoaderMessage;
import com.latex.jdbc.testing.TestResources;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BibTeXParserTest {

    private static final String DUPLICATES =
            "@misc{k, title = {First}}\n@misc{other, title = {Other}}\n@misc{k, title = {Second}}\n";

    @Test
    void parsesArticleWithTwoAuthors() {
        BibliographyParseResult result =
                new BibTeXParser()
                        .parse(
                                "@article{doe21, author = {Doe, Jane and Roe, Richard}, title = {A Study}, year = {2021}}");

        assertEquals(1, result.getEntries().size());
        BibEntry entry = result.getEntries().get("doe21");
        assertEquals(BibEntryType.ARTICLE, entry.getEntryType());
        assertEquals(2, entry.getAuthors().size());
        assertEquals("Doe", entry.getAuthors().get(0).getLast());
        assertEquals("Jane", entry.getAuthors().get(0).getFirst());
        assertEquals("Roe", entry.getAuthors().get(1).getLast());
        assertEquals("Richard", entry.getAuthors().get(1).getFirst());
        assertEquals(2021, entry.getYear());
        assertEquals("A Study", entry.getTitle());
        assertTrue(result.getMessages().isEmpty());
    }

    @Test
    void expandsStringsMonthsAndConcatenation() {
        BibliographyParseResult result =
                new BibTeXParser().parse("refs.bib", TestResources.readResource("documents/references.bib"));

        assertEquals(List.of("doe21", "roe19", "unused22"), List.copyOf(result.getEntries().keySet()));
        BibEntry doe = result.getEntries().get("doe21");
        assertEquals("Journal of Machine Learning", doe.getJournal());
        assertEquals("January", doe.getMonth());
        assertEquals("A Study of Things", doe.getTitle());
        assertEquals(List.of("parsing", "latex"), doe.getKeywords());
        BibEntry roe = result.getEntries().get("roe19");
        assertEquals("Proc. Conference", roe.getBooktitle());
        assertEquals(2019, roe.getYear());
        assertEquals("Knuth", roe.getEditors().get(0).getLast());
        assertEquals(BibEntryType.INPROCEEDINGS, roe.getEntryType());
        assertTrue(result.getMessages().isEmpty());
    }

    @Test
    void acceptsParenthesisDelimitedEntries() {
        BibliographyParseResult result =
                new BibTeXParser().parse(TestResources.readResource("documents/references.bib"));

        BibEntry book = result.getEntries().get("unused22");
        assertEquals(BibEntryType.BOOK, book.getEntryType());
        assertEquals("Publisher", book.getPublisher());
        assertTrue(book.getRawEntry().startsWith("@book("));
        assertEquals(22, book.getLocation().getLine());
    }

    @Test
    void unknownTypeBecomesMiscWithAWarning() {
        BibliographyParseResult result = new BibTeXParser().parse("@dataset{d1, title = {Data}}");

        BibEntry entry = result.getEntries().get("d1");
        assertEquals(BibEntryType.MISC, entry.getEntryType());
        assertEquals("dataset", entry.getDeclaredType());
        assertEquals(LoaderMessage.Level.WARNING, result.getMessages().get(0).getLevel());
    }

    @Test
    void unclosedEntryIsSkippedAndScanningResumes() {
        BibliographyParseResult result =
                new BibTeXParser().parse("@article{broken, title = {Oops}\n@misc{ok, title = {Fine}}");

        assertEquals(List.of("ok"), List.copyOf(result.getEntries().keySet()));
        assertEquals(LoaderMessage.Level.ERROR, result.getMessages().get(0).getLevel());
    }

    @Test
    void keepLastMovesTheLaterDefinitionToItsPosition() {
        BibliographyParseResult result = new BibTeXParser(DuplicateKeyPolicy.KEEP_LAST).parse(DUPLICATES);

        assertEquals(List.of("other", "k"), List.copyOf(result.getEntries().keySet()));
        assertEquals("Second", result.getEntries().get("k").getTitle());
        assertEquals(1, result.getMessages().size());
        assertEquals(LoaderMessage.Level.WARNING, result.getMessages().get(0).getLevel());
    }

    @Test
    void keepFirstRetainsTheEarlierDefinition() {
        BibliographyParseResult result = new BibTeXParser(DuplicateKeyPolicy.KEEP_FIRST).parse(DUPLICATES);

        assertEquals(List.of("k", "other"), List.copyOf(result.getEntries().keySet()));
        assertEquals("First", result.getEntries().get("k").getTitle());
        assertEquals(1, result.getMessages().size());
    }

    @Test
    void rejectDropsEveryDefinitionOfTheKey() {
        BibliographyParseResult result =
                new BibTeXParser(DuplicateKeyPolicy.REJECT).parse(DUPLICATES + "@misc{k, title = {Third}}");

        assertFalse(result.getEntries().containsKey("k"));
        assertEquals(2, result.getMessages().size());
        assertEquals(LoaderMessage.Level.ERROR, result.getMessages().get(0).getLevel());
    }

    @Test
    void stringsDefinedInOneFileApplyToTheNext() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("strings.bib", "@string{pub = {ACM Press}}");
        sources.put("refs.bib", "@book{b, publisher = pub}");

        BibliographyParseResult result = new BibTeXParser().parseAll(sources);

        assertEquals("ACM Press", result.getEntries().get("b").getPublisher());
        assertEquals("refs.bib", result.getEntries().get("b").getLocation().getSourceName());
    }

    @Test
    void undefinedAbbreviationIsKeptVerbatimWithAWarning() {
        BibliographyParseResult result = new BibTeXParser().parse("@misc{m, publisher = nowhere}");

        assertEquals("nowhere", result.getEntries().get("m").getPublisher());
        assertEquals(1, result.getMessages().size());
    }
}
