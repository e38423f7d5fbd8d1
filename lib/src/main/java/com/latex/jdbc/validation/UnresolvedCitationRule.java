package com.latex.jdbc.validation;

import com.latex.jdbc.citation.Citation;
import com.latex.jdbc.document.LatexDocument;
import com.latex.jdbc.loader.LoaderMessage;
import com.latex.jdbc.loader.LoaderMessage.Category;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Warns at every citation command naming a key the bibliography lacks. */
final class UnresolvedCitationRule implements ValidationRule {

    @Override
    public List<LoaderMessage> validate(LatexDocument document) {
        Set<String> unresolved = new HashSet<>(document.getCitationReport().getUnresolvedKeys());
        List<LoaderMessage> messages = new ArrayList<>();
        if (unresolved.isEmpty()) {
            return messages;
        }
        for (Citation citation : document.getCitations()) {
            for (String key : citation.getKeys()) {
                if (unresolved.contains(key)) {
                    messages.add(
                            LoaderMessage.warning(
                                    Category.CITATION,
                                    "Citation `" + key + "' undefined",
                                    document.getSourceName(),
                                    citation.getLocation().getLine(),
                                    citation.getLocation().getColumn()));
                }
            }
        }
        return messages;
    }
}
