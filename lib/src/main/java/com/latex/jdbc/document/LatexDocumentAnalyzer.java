package com.latex.jdbc.document;

import com.latex.jdbc.bibtex.BibTeXParser;
import com.latex.jdbc.bibtex.BibliographyParseResult;
import com.latex.jdbc.citation.CitationExtraction;
import com.latex.jdbc.citation.CitationExtractor;
import com.latex.jdbc.citation.CitationReport;
import com.latex.jdbc.citation.CitationResolver;
import com.latex.jdbc.loader.DebugFlags;
import com.latex.jdbc.loader.LatexParser;
import com.latex.jdbc.loader.LoaderMessage;
import com.latex.jdbc.loader.LoaderMessage.Category;
import com.latex.jdbc.loader.LoaderOptions;
import com.latex.jdbc.loader.ParseResult;
import com.latex.jdbc.loader.ast.Command;
import com.latex.jdbc.loader.ast.DocumentSection;
import com.latex.jdbc.loader.ast.Environment;
import com.latex.jdbc.loader.ast.MathSpan;
import com.latex.jdbc.loader.lexer.LatexTokenizer;
import com.latex.jdbc.loader.lexer.Token;
import com.latex.jdbc.math.EnvironmentTraits;
import com.latex.jdbc.math.EquationAnalyzer;
import com.latex.jdbc.math.MathEnvironmentAnalysis;
import com.latex.jdbc.structure.DocumentStructureBuilder;
import com.latex.jdbc.validation.ValidationRunner;
import com.latex.jdbc.xref.CrossReferenceReport;
import com.latex.jdbc.xref.CrossReferenceResolver;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory analysis pipeline for one flattened source and its bibliography texts:
 * tokenize, parse, then build the outline, analyse formulas, extract citations, parse the
 * bibliography, resolve both kinds of references and finally run the validation rules.
 * Every stage gets fresh instances, so documents may be analysed concurrently.
 */
public final class LatexDocumentAnalyzer {

    private static final Set<String> FLOAT_ENVIRONMENTS = Set.of("figure", "figure*", "table", "table*", "wrapfigure");

    private final ValidationRunner validationRunner;

    public LatexDocumentAnalyzer() {
        this(ValidationRunner.defaultRules());
    }

    public LatexDocumentAnalyzer(ValidationRunner validationRunner) {
        this.validationRunner = Objects.requireNonNull(validationRunner, "validationRunner");
    }

    public LatexDocument analyze(String sourceName, String source) {
        return analyze(sourceName, source, Map.of(), LoaderOptions.defaults());
    }

    /**
     * @param bibliographyTexts bibliography name to its text, in {@code \bibliography} order
     */
    public LatexDocument analyze(
            String sourceName, String source, Map<String, String> bibliographyTexts, LoaderOptions options) {
        return analyze(parse(sourceName, source, options), bibliographyTexts, options);
    }

    /** Tokenizes and parses {@code source}; the first half of {@link #analyze(String, String, Map, LoaderOptions)}. */
    public ParsedSource parse(String sourceName, String source, LoaderOptions options) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(options, "options");
        String name = sourceName == null ? "" : sourceName;
        List<LoaderMessage> messages = new ArrayList<>();

        List<Token> tokens = new LatexTokenizer().tokenize(source);
        if (DebugFlags.isTokenDebugEnabled()) {
            DebugFlags.logTokens(name, tokens);
            for (String tokenLine : DebugFlags.drainCapturedTokens()) {
                messages.add(LoaderMessage.info(Category.TOKEN, "Token " + tokenLine, name, 0, 0));
            }
        }
        ParseResult parsed = new LatexParser(name, options).parse(tokens);
        messages.addAll(parsed.getMessages());
        return new ParsedSource(name, source, tokens, parsed, bibliographyNames(parsed.getCommands()), messages);
    }

    public LatexDocument analyze(ParsedSource parsedSource, Map<String, String> bibliographyTexts, LoaderOptions options) {
        Objects.requireNonNull(parsedSource, "parsedSource");
        Objects.requireNonNull(bibliographyTexts, "bibliographyTexts");
        Objects.requireNonNull(options, "options");
        String name = parsedSource.getSourceName();
        String source = parsedSource.getSource();
        ParseResult parsed = parsedSource.getParseResult();
        List<LoaderMessage> messages = new ArrayList<>(parsedSource.getMessages());
        List<Command> commands = parsed.getCommands();

        List<DocumentSection> sections =
                new DocumentStructureBuilder().build(commands, parsed.getEnvironments());
        PreambleInfo preamble = PreambleInfo.from(commands);
        List<DocumentEquation> equations = analyzeEquations(parsed);
        List<FloatInfo> floats = collectFloats(parsed.getAllEnvironments(), commands);

        CitationExtraction extraction = new CitationExtractor(name).extractWithMessages(source);
        messages.addAll(extraction.getMessages());
        BibliographyParseResult bibliography =
                new BibTeXParser(options.getDuplicateKeyPolicy()).parseAll(bibliographyTexts);
        messages.addAll(bibliography.getMessages());
        CitationReport citationReport =
                new CitationResolver().resolve(extraction.getCitations(), bibliography.getEntries());
        CrossReferenceReport crossReferences = new CrossReferenceResolver().analyze(commands);

        LatexDocument document =
                new LatexDocument(
                        name,
                        source,
                        parsedSource.getTokens(),
                        commands,
                        parsed.getEnvironments(),
                        parsed.getMathSpans(),
                        sections,
                        preamble,
                        parsedSource.getBibliographyNames(),
                        equations,
                        floats,
                        extraction.getCitations(),
                        bibliography.getEntries(),
                        citationReport,
                        crossReferences,
                        messages);
        if (!options.isValidate()) {
            return document;
        }
        return document.withAdditionalMessages(validationRunner.run(document));
    }

    /** Names from {@code \bibliography{a,b}} and {@code \addbibresource{c.bib}}, first occurrence kept. */
    static List<String> bibliographyNames(List<Command> commands) {
        Set<String> names = new LinkedHashSet<>();
        for (Command command : commands) {
            String name = command.getName();
            if (("bibliography".equals(name) || "addbibresource".equals(name)) && command.firstArgument() != null) {
                names.addAll(PreambleInfo.splitList(command.firstArgument()));
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * Analyses every outermost math environment and every math span. Math environments nested in
     * another math environment (a {@code split} inside an {@code equation}) are part of the outer
     * formula.
     */
    private static List<DocumentEquation> analyzeEquations(ParseResult parsed) {
        EquationAnalyzer analyzer = new EquationAnalyzer();
        List<DocumentEquation> equations = new ArrayList<>();
        Deque<Environment> pending = new ArrayDeque<>(parsed.getEnvironments());
        while (!pending.isEmpty()) {
            Environment environment = pending.pop();
            if (EnvironmentTraits.isMathEnvironment(environment.getName())) {
                MathEnvironmentAnalysis analysis =
                        analyzer.analyzeEnvironment(environment.getName(), environment.getContent());
                equations.add(
                        new DocumentEquation(
                                DocumentEquation.Origin.ENVIRONMENT,
                                environment.getName(),
                                environment.getLocation(),
                                analysis.getInfo(),
                                analysis));
            } else {
                List<Environment> nested = environment.getNestedEnvironments();
                for (int i = nested.size() - 1; i >= 0; i--) {
                    pending.push(nested.get(i));
                }
            }
        }
        for (MathSpan span : parsed.getMathSpans()) {
            String environmentName = span.isDisplay() ? "displaymath" : "math";
            equations.add(
                    new DocumentEquation(
                            span.isDisplay() ? DocumentEquation.Origin.DISPLAY : DocumentEquation.Origin.INLINE,
                            span.getDelimiter(),
                            span.getLocation(),
                            analyzer.analyze(span.getContent(), environmentName),
                            null));
        }
        equations.sort(Comparator.comparingInt(equation -> equation.getLocation().getOffset()));
        return equations;
    }

    private static List<FloatInfo> collectFloats(List<Environment> environments, List<Command> commands) {
        List<FloatInfo> floats = new ArrayList<>();
        for (Environment environment : environments) {
            if (!FLOAT_ENVIRONMENTS.contains(environment.getName())) {
                continue;
            }
            String caption = null;
            String label = null;
            List<String> graphics = new ArrayList<>();
            for (Command command : commands) {
                if (command.getOffset() <= environment.getBeginOffset() || !environment.contains(command.getOffset())) {
                    continue;
                }
                String argument = command.firstArgument();
                if (argument == null) {
                    continue;
                }
                switch (command.getName()) {
                    case "caption" -> {
                        if (caption == null) {
                            caption = argument.trim();
                        }
                    }
                    case "label" -> {
                        if (label == null) {
                            label = argument.trim();
                        }
                    }
                    case "includegraphics" -> graphics.add(argument.trim());
                    default -> {
                        // not a float attribute
                    }
                }
            }
            FloatInfo.Kind kind =
                    environment.getName().startsWith("table") ? FloatInfo.Kind.TABLE : FloatInfo.Kind.FIGURE;
            floats.add(new FloatInfo(environment.getName(), kind, caption, label, graphics, environment.getLocation()));
        }
        return floats;
    }
}
