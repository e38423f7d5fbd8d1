package com.latex.jdbc.bibtex;

import com.latex.jdbc.loader.LoaderMessage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Entries keyed by citation key in file order, plus per-entry diagnostics. */
public final class BibliographyParseResult {
    private final Map<String, BibEntry> entries;
    private final List<LoaderMessage> messages;

    public BibliographyParseResult(Map<String, BibEntry> entries, List<LoaderMessage> messages) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        this.messages = List.copyOf(messages);
    }

    public Map<String, BibEntry> getEntries() {
        return entries;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }
}
