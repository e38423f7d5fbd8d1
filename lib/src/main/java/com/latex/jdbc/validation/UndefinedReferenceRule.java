package com.latex.jdbc.validation;

import com.latex.jdbc.document.LatexDocument;
import com.latex.jdbc.loader.LoaderMessage;
import com.latex.jdbc.loader.LoaderMessage.Category;
import com.latex.jdbc.xref.Reference;
import com.latex.jdbc.xref.ReferenceResolution;
import java.util.ArrayList;
import java.util.List;

/** One warning per reference whose label is never defined, the way LaTeX reports them. */
final class UndefinedReferenceRule implements ValidationRule {

    @Override
    public List<LoaderMessage> validate(LatexDocument document) {
        List<LoaderMessage> messages = new ArrayList<>();
        for (ReferenceResolution resolution : document.getCrossReferences().getResolutions().values()) {
            if (resolution.isResolved()) {
                continue;
            }
            for (Reference reference : resolution.getReferences()) {
                messages.add(
                        LoaderMessage.warning(
                                Category.REFERENCE,
                                "Reference `" + reference.getTargetLabel() + "' on \\" + reference.getCommandName()
                                        + " undefined",
                                document.getSourceName(),
                                reference.getLocation().getLine(),
                                reference.getLocation().getColumn()));
            }
        }
        return messages;
    }
}
