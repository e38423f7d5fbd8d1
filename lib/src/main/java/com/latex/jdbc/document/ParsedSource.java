package com.latex.jdbc.document;

import com.latex.jdbc.loader.LoaderMessage;
import com.latex.jdbc.loader.ParseResult;
import com.latex.jdbc.loader.lexer.Token;
import java.util.List;
import java.util.Objects;

/**
 * A tokenized and parsed source, before the bibliography is known. Lets a caller read the
 * {@code \bibliography} names, fetch those files and then finish the analysis without parsing
 * twice.
 */
public final class ParsedSource {
    private final String sourceName;
    private final String source;
    private final List<Token> tokens;
    private final ParseResult parseResult;
    private final List<String> bibliographyNames;
    private final List<LoaderMessage> messages;

    ParsedSource(
            String sourceName,
            String source,
            List<Token> tokens,
            ParseResult parseResult,
            List<String> bibliographyNames,
            List<LoaderMessage> messages) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.source = Objects.requireNonNull(source, "source");
        this.tokens = List.copyOf(tokens);
        this.parseResult = Objects.requireNonNull(parseResult, "parseResult");
        this.bibliographyNames = List.copyOf(bibliographyNames);
        this.messages = List.copyOf(messages);
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

    public ParseResult getParseResult() {
        return parseResult;
    }

    /** Names from {@code \bibliography} and {@code \addbibresource}, in order, without repeats. */
    public List<String> getBibliographyNames() {
        return bibliographyNames;
    }

    /** Diagnostics of tokenizing and parsing. */
    public List<LoaderMessage> getMessages() {
        return messages;
    }
}
