package com.latex.jdbc.citation;

import com.latex.jdbc.loader.LoaderMessage;
import java.util.List;

public final class CitationExtraction {
    private final List<Citation> citations;
    private final List<LoaderMessage> messages;

    public CitationExtraction(List<Citation> citations, List<LoaderMessage> messages) {
        this.citations = List.copyOf(citations);
        this.messages = List.copyOf(messages);
    }

    public List<Citation> getCitations() {
        return citations;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }
}
