package com.latex.jdbc.document;

import com.latex.jdbc.bibtex.BibEntry;
import com.latex.jdbc.citation.Citation;
import com.latex.jdbc.citation.CitationReport;
import com.latex.jdbc.loader.LoaderMessage;
import com.latex.jdbc.loader.ast.Command;
import com.latex.jdbc.loader.ast.DocumentSection;
import com.latex.jdbc.loader.ast.Environment;
import com.latex.jdbc.loader.ast.MathSpan;
import com.latex.jdbc.loader.lexer.Token;
import com.latex.jdbc.xref.CrossReferenceReport;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Everything one analysis run produced for a document. Immutable. */
public final class LatexDocument {
    private final String sourceName;
    private final String source;
    private final List<Token> tokens;
    private final List<Command> commands;
    private final List<Environment> environments;
    private final List<MathSpan> mathSpans;
    private final List<DocumentSection> sections;
    private final PreambleInfo preamble;
    private final List<String> bibliographyNames;
    private final List<DocumentEquation> equations;
    private final List<FloatInfo> floats;
    private final List<Citation> citations;
    private final Map<String, BibEntry> bibliography;
    private final CitationReport citationReport;
    private final CrossReferenceReport crossReferences;
    private final List<LoaderMessage> messages;

    LatexDocument(
            String sourceName,
            String source,
            List<Token> tokens,
            List<Command> commands,
            List<Environment> environments,
            List<MathSpan> mathSpans,
            List<DocumentSection> sections,
            PreambleInfo preamble,
            List<String> bibliographyNames,
            List<DocumentEquation> equations,
            List<FloatInfo> floats,
            List<Citation> citations,
            Map<String, BibEntry> bibliography,
            CitationReport citationReport,
            CrossReferenceReport crossReferences,
            List<LoaderMessage> messages) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.source = Objects.requireNonNull(source, "source");
        this.tokens = List.copyOf(tokens);
        this.commands = List.copyOf(commands);
        this.environments = List.copyOf(environments);
        this.mathSpans = List.copyOf(mathSpans);
        this.sections = List.copyOf(sections);
        this.preamble = Objects.requireNonNull(preamble, "preamble");
        this.bibliographyNames = List.copyOf(bibliographyNames);
        this.equations = List.copyOf(equations);
        this.floats = List.copyOf(floats);
        this.citations = List.copyOf(citations);
        this.bibliography = Collections.unmodifiableMap(new LinkedHashMap<>(bibliography));
        this.citationReport = Objects.requireNonNull(citationReport, "citationReport");
        this.crossReferences = Objects.requireNonNull(crossReferences, "crossReferences");
        this.messages = List.copyOf(messages);
    }

    /** Copy of this document with {@code additional} appended to its diagnostics. */
    public LatexDocument withAdditionalMessages(List<LoaderMessage> additional) {
        List<LoaderMessage> combined = new ArrayList<>(messages);
        combined.addAll(additional);
        return new LatexDocument(
                sourceName,
                source,
                tokens,
                commands,
                environments,
                mathSpans,
                sections,
                preamble,
                bibliographyNames,
                equations,
                floats,
                citations,
                bibliography,
                citationReport,
                crossReferences,
                combined);
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getSource() {
        return source;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public List<Command> getCommands() {
        return commands;
    }

    /** Top-level matched environments; nested ones hang off their parents. */
    public List<Environment> getEnvironments() {
        return environments;
    }

    public List<Environment> getAllEnvironments() {
        List<Environment> all = new ArrayList<>();
        for (Environment environment : environments) {
            all.addAll(environment.flatten());
        }
        return all;
    }

    public List<MathSpan> getMathSpans() {
        return mathSpans;
    }

    public List<DocumentSection> getSections() {
        return sections;
    }

    public PreambleInfo getPreamble() {
        return preamble;
    }

    public List<String> getBibliographyNames() {
        return bibliographyNames;
    }

    public List<DocumentEquation> getEquations() {
        return equations;
    }

    public List<FloatInfo> getFloats() {
        return floats;
    }

    public List<Citation> getCitations() {
        return citations;
    }

    public Map<String, BibEntry> getBibliography() {
        return bibliography;
    }

    public CitationReport getCitationReport() {
        return citationReport;
    }

    public CrossReferenceReport getCrossReferences() {
        return crossReferences;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }

    public boolean hasErrors() {
        for (LoaderMessage message : messages) {
            if (message.getLevel() == LoaderMessage.Level.ERROR) {
                return true;
            }
        }
        return false;
    }
}
