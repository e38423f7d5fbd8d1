package com.latex.jdbc.validation;

import com.latex.jdbc.document.LatexDocument;
import com.latex.jdbc.loader.LoaderMessage;
import com.latex.jdbc.loader.LoaderMessage.Category;
import com.latex.jdbc.xref.Label;
import java.util.ArrayList;
import java.util.List;

final class DuplicateLabelRule implements ValidationRule {

    @Override
    public List<LoaderMessage> validate(LatexDocument document) {
        List<LoaderMessage> messages = new ArrayList<>();
        for (Label label : document.getCrossReferences().getDuplicateLabels()) {
            messages.add(
                    LoaderMessage.warning(
                            Category.REFERENCE,
                            "Label `" + label.getName() + "' multiply defined; the first definition wins",
                            document.getSourceName(),
                            label.getLocation().getLine(),
                            label.getLocation().getColumn()));
        }
        return messages;
    }
}
