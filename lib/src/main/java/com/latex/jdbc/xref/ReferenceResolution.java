package com.latex.jdbc.xref;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Outcome for one referenced label name: the defining label, or the error {@value #UNDEFINED}. */
public final class ReferenceResolution {

    public static final String UNDEFINED = "undefined";

    private final String labelName;
    private final Label target;
    private final List<Reference> references;

    public ReferenceResolution(String labelName, Label target, List<Reference> references) {
        this.labelName = Objects.requireNonNull(labelName, "labelName");
        this.target = target;
        this.references = List.copyOf(references);
    }

    public String getLabelName() {
        return labelName;
    }

    public Optional<Label> getTarget() {
        return Optional.ofNullable(target);
    }

    public boolean isResolved() {
        return target != null;
    }

    /** {@value #UNDEFINED} when unresolved, otherwise empty. */
    public Optional<String> getError() {
        return target == null ? Optional.of(UNDEFINED) : Optional.empty();
    }

    public List<Reference> getReferences() {
        return references;
    }

    @Override
    public String toString() {
        return labelName + " -> " + (target == null ? UNDEFINED : target.getLocation().toString());
    }
}
