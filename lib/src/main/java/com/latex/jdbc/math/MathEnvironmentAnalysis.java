package com.latex.jdbc.math;

import java.util.List;
import java.util.Objects;

public final class MathEnvironmentAnalysis {
    private final String environmentName;
    private final EnvironmentTraits traits;
    private final int equationCount;
    private final int alignmentPoints;
    private final List<String> labels;
    private final EquationInfo info;

    public MathEnvironmentAnalysis(
            String environmentName,
            EnvironmentTraits traits,
            int equationCount,
            int alignmentPoints,
            List<String> labels,
            EquationInfo info) {
        this.environmentName = Objects.requireNonNull(environmentName, "environmentName");
        this.traits = Objects.requireNonNull(traits, "traits");
        this.equationCount = equationCount;
        this.alignmentPoints = alignmentPoints;
        this.labels = List.copyOf(labels);
        this.info = Objects.requireNonNull(info, "info");
    }

    public String getEnvironmentName() {
        return environmentName;
    }

    public EnvironmentTraits getTraits() {
        return traits;
    }

    /** Non-blank rows separated by {@code \\}. */
    public int getEquationCount() {
        return equationCount;
    }

    /** Unescaped {@code &} characters. */
    public int getAlignmentPoints() {
        return alignmentPoints;
    }

    public List<String> getLabels() {
        return labels;
    }

    public EquationInfo getInfo() {
        return info;
    }
}
