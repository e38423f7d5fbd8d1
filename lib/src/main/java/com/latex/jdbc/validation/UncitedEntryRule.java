package com.latex.jdbc.validation;

import com.latex.jdbc.bibtex.BibEntry;
import com.latex.jdbc.document.LatexDocument;
import com.latex.jdbc.loader.LoaderMessage;
import com.latex.jdbc.loader.LoaderMessage.Category;
import java.util.ArrayList;
import java.util.List;

final class UncitedEntryRule implements ValidationRule {

    @Override
    public List<LoaderMessage> validate(LatexDocument document) {
        List<LoaderMessage> messages = new ArrayList<>();
        for (BibEntry entry : document.getCitationReport().getUnusedEntries()) {
            messages.add(
                    LoaderMessage.info(
                            Category.BIB_ENTRY,
                            "Bibliography entry `" + entry.getKey() + "' is never cited",
                            entry.getLocation().getSourceName(),
                            entry.getLocation().getLine(),
                            entry.getLocation().getColumn()));
        }
        return messages;
    }
}
