package com.latex.jdbc.validation;

import com.latex.jdbc.document.LatexDocument;
import com.latex.jdbc.loader.LoaderMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Executes a list of validation rules and aggregates their diagnostics. */
public final class ValidationRunner {

    private final List<ValidationRule> rules;

    public ValidationRunner(List<ValidationRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    /**
     * Convenience factory that wires in the default rule set.
     */
    public static ValidationRunner defaultRules() {
        return new ValidationRunner(
                List.of(
                        new UndefinedReferenceRule(),
                        new DuplicateLabelRule(),
                        new UnresolvedCitationRule(),
                        new UncitedEntryRule()));
    }

    /**
     * Run all configured rules against the provided document.
     *
     * @param document Fully analysed document.
     * @return All diagnostics produced by all rules, in rule order.
     */
    public List<LoaderMessage> run(LatexDocument document) {
        List<LoaderMessage> diagnostics = new ArrayList<>();
        for (ValidationRule rule : rules) {
            diagnostics.addAll(rule.validate(document));
        }
        return diagnostics;
    }
}
