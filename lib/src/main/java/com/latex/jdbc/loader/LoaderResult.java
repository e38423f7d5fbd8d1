package com.latex.jdbc.loader;

import com.latex.jdbc.document.LatexDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Container for the results of loading a document from disk: the analysed document plus the
 * diagnostics of the loading step itself, followed by those of the analysis.
 */
public final class LoaderResult {
    private final LatexDocument document;
    private final List<LoaderMessage> messages;

    public LoaderResult(LatexDocument document, List<LoaderMessage> loaderMessages) {
        this.document = Objects.requireNonNull(document, "document");
        List<LoaderMessage> all = new ArrayList<>(loaderMessages);
        all.addAll(document.getMessages());
        this.messages = List.copyOf(all);
    }

    public LatexDocument getDocument() {
        return document;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }
}
