package com.latex.jdbc.xref;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class CrossReferenceReport {
    private final List<Label> labels;
    private final List<Reference> references;
    private final Map<String, ReferenceResolution> resolutions;
    private final List<Label> duplicateLabels;
    private final List<Label> unreferencedLabels;

    public CrossReferenceReport(
            List<Label> labels,
            List<Reference> references,
            Map<String, ReferenceResolution> resolutions,
            List<Label> duplicateLabels,
            List<Label> unreferencedLabels) {
        this.labels = List.copyOf(labels);
        this.references = List.copyOf(references);
        this.resolutions = Collections.unmodifiableMap(new LinkedHashMap<>(resolutions));
        this.duplicateLabels = List.copyOf(duplicateLabels);
        this.unreferencedLabels = List.copyOf(unreferencedLabels);
    }

    /** Every label definition in document order, repeated definitions included. */
    public List<Label> getLabels() {
        return labels;
    }

    public List<Reference> getReferences() {
        return references;
    }

    /** One entry per referenced label name, in order of first reference. */
    public Map<String, ReferenceResolution> getResolutions() {
        return resolutions;
    }

    /** Definitions that repeat an earlier label name and are therefore ignored. */
    public List<Label> getDuplicateLabels() {
        return duplicateLabels;
    }

    public List<Label> getUnreferencedLabels() {
        return unreferencedLabels;
    }
}
