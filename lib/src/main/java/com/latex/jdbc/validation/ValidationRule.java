package com.latex.jdbc.validation;

import com.latex.jdbc.document.LatexDocument;
import com.latex.jdbc.loader.LoaderMessage;
import java.util.List;

/**
 * A single validation rule that inspects an analysed document and emits diagnostics. Rules are
 * deterministic and report problems in document order.
 */
public interface ValidationRule {

    /**
     * Evaluate this rule against the given document.
     *
     * @param document Fully analysed document.
     * @return A list of diagnostics, possibly empty. Implementations must not return null.
     */
    List<LoaderMessage> validate(LatexDocument document);
}
