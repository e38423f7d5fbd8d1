package com.latex.jdbc.math;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/** Structural features of one formula. The three symbol sets are sorted and unmodifiable. */
public final class EquationInfo {
    private final String latex;
    private final String environmentName;
    private final Set<String> variables;
    private final Set<String> functions;
    private final Set<String> operators;
    private final double complexityScore;
    private final boolean hasFractions;
    private final boolean hasIntegrals;
    private final boolean hasSummations;
    private final boolean hasMatrices;
    private final boolean hasSubscripts;
    private final boolean hasSuperscripts;
    private final int lineCount;

    public EquationInfo(
            String latex,
            String environmentName,
            Set<String> variables,
            Set<String> functions,
            Set<String> operators,
            double complexityScore,
            boolean hasFractions,
            boolean hasIntegrals,
            boolean hasSummations,
            boolean hasMatrices,
            boolean hasSubscripts,
            boolean hasSuperscripts,
            int lineCount) {
        this.latex = Objects.requireNonNull(latex, "latex");
        this.environmentName = Objects.requireNonNull(environmentName, "environmentName");
        this.variables = Collections.unmodifiableSet(new TreeSet<>(variables));
        this.functions = Collections.unmodifiableSet(new TreeSet<>(functions));
        this.operators = Collections.unmodifiableSet(new TreeSet<>(operators));
        if (complexityScore < 0) {
            throw new IllegalArgumentException("complexityScore must be >= 0: " + complexityScore);
        }
        if (lineCount < 1) {
            throw new IllegalArgumentException("lineCount must be >= 1: " + lineCount);
        }
        this.complexityScore = complexityScore;
        this.hasFractions = hasFractions;
        this.hasIntegrals = hasIntegrals;
        this.hasSummations = hasSummations;
        this.hasMatrices = hasMatrices;
        this.hasSubscripts = hasSubscripts;
        this.hasSuperscripts = hasSuperscripts;
        this.lineCount = lineCount;
    }

    public String getLatex() {
        return latex;
    }

    public String getEnvironmentName() {
        return environmentName;
    }

    public Set<String> getVariables() {
        return variables;
    }

    public Set<String> getFunctions() {
        return functions;
    }

    public Set<String> getOperators() {
        return operators;
    }

    public double getComplexityScore() {
        return complexityScore;
    }

    public boolean hasFractions() {
        return hasFractions;
    }

    public boolean hasIntegrals() {
        return hasIntegrals;
    }

    public boolean hasSummations() {
        return hasSummations;
    }

    public boolean hasMatrices() {
        return hasMatrices;
    }

    public boolean hasSubscripts() {
        return hasSubscripts;
    }

    public boolean hasSuperscripts() {
        return hasSuperscripts;
    }

    public int getLineCount() {
        return lineCount;
    }

    @Override
    public String toString() {
        return "EquationInfo[" + environmentName + ", score=" + complexityScore + ", vars=" + variables + "]";
    }
}
