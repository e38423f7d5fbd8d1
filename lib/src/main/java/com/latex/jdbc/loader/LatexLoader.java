package com.latex.jdbc.loader;

import com.latex.jdbc.document.LatexDocument;
import com.latex.jdbc.document.LatexDocumentAnalyzer;
import com.latex.jdbc.document.ParsedSource;
import com.latex.jdbc.loader.LoaderMessage.Category;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Entry point for loading a flattened LaTeX file and the bibliographies it names. Reading is the
 * only step that can fail; everything after it reports problems as diagnostics.
 */
public final class LatexLoader {
    private static final Logger LOGGER = Logger.getLogger(LatexLoader.class.getName());

    private final LoaderOptions options;
    private final BibliographyLocator bibliographyLocator;
    private final LatexDocumentAnalyzer analyzer;

    public LatexLoader() {
        this(LoaderOptions.defaults());
    }

    public LatexLoader(LoaderOptions options) {
        this(options, new FileSystemBibliographyLocator());
    }

    public LatexLoader(LoaderOptions options, BibliographyLocator bibliographyLocator) {
        this.options = Objects.requireNonNull(options, "options");
        this.bibliographyLocator = Objects.requireNonNull(bibliographyLocator, "bibliographyLocator");
        this.analyzer = new LatexDocumentAnalyzer();
    }

    public LoaderResult load(Path documentPath) throws LoaderException {
        Objects.requireNonNull(documentPath, "documentPath");
        List<LoaderMessage> messages = new ArrayList<>();
        String sourceName = documentPath.toString();
        String source = read(documentPath, messages);

        ParsedSource parsed = analyzer.parse(sourceName, source, options);
        Map<String, String> bibliographies = new LinkedHashMap<>();
        for (String name : parsed.getBibliographyNames()) {
            Optional<Path> located = bibliographyLocator.locate(documentPath, name);
            if (located.isEmpty()) {
                messages.add(
                        LoaderMessage.warning(
                                Category.DOCUMENT, "Bibliography '" + name + "' not found", sourceName, 0, 0));
                continue;
            }
            Path bibPath = located.get();
            bibliographies.put(bibPath.toString(), read(bibPath, messages));
        }

        LatexDocument document = analyzer.analyze(parsed, bibliographies, options);
        LOGGER.fine(
                () ->
                        "Loaded " + sourceName + ": " + document.getCommands().size() + " commands, "
                                + document.getBibliography().size() + " bibliography entries");
        return new LoaderResult(document, messages);
    }

    /** Decodes as UTF-8, falling back to ISO-8859-1, which accepts any byte sequence. */
    static String read(Path path, List<LoaderMessage> messages) throws LoaderException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new LoaderException("Failed to read " + path, ex);
        }
        try {
            return StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException ex) {
            messages.add(
                    LoaderMessage.info(
                            Category.DOCUMENT,
                            "File is not valid UTF-8; decoded as ISO-8859-1",
                            path.toString(),
                            0,
                            0));
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }
}
