package com.latex.jdbc.math;

import java.util.Map;

/** Numbering and layout properties of a math environment, looked up by name. */
public final class EnvironmentTraits {

    public static final EnvironmentTraits NONE = new EnvironmentTraits(false, false, false);

    private static final EnvironmentTraits SINGLE_NUMBERED = new EnvironmentTraits(true, false, false);
    private static final EnvironmentTraits ALIGNED_NUMBERED = new EnvironmentTraits(true, true, true);
    private static final EnvironmentTraits ALIGNED = new EnvironmentTraits(false, true, true);
    private static final EnvironmentTraits LINES_NUMBERED = new EnvironmentTraits(true, false, true);
    private static final EnvironmentTraits LINES = new EnvironmentTraits(false, false, true);

    private static final Map<String, EnvironmentTraits> TAXONOMY =
            Map.ofEntries(
                    Map.entry("equation", SINGLE_NUMBERED),
                    Map.entry("equation*", NONE),
                    Map.entry("math", NONE),
                    Map.entry("displaymath", NONE),
                    Map.entry("align", ALIGNED_NUMBERED),
                    Map.entry("align*", ALIGNED),
                    Map.entry("alignat", ALIGNED_NUMBERED),
                    Map.entry("alignat*", ALIGNED),
                    Map.entry("flalign", ALIGNED_NUMBERED),
                    Map.entry("flalign*", ALIGNED),
                    Map.entry("eqnarray", ALIGNED_NUMBERED),
                    Map.entry("eqnarray*", ALIGNED),
                    Map.entry("gather", LINES_NUMBERED),
                    Map.entry("gather*", LINES),
                    Map.entry("multline", LINES_NUMBERED),
                    Map.entry("multline*", LINES),
                    Map.entry("split", ALIGNED),
                    Map.entry("aligned", ALIGNED),
                    Map.entry("gathered", LINES),
                    Map.entry("array", ALIGNED),
                    Map.entry("matrix", ALIGNED),
                    Map.entry("pmatrix", ALIGNED),
                    Map.entry("bmatrix", ALIGNED),
                    Map.entry("Bmatrix", ALIGNED),
                    Map.entry("vmatrix", ALIGNED),
                    Map.entry("Vmatrix", ALIGNED),
                    Map.entry("smallmatrix", ALIGNED),
                    Map.entry("cases", ALIGNED));

    private final boolean numbered;
    private final boolean alignment;
    private final boolean multiline;

    private EnvironmentTraits(boolean numbered, boolean alignment, boolean multiline) {
        this.numbered = numbered;
        this.alignment = alignment;
        this.multiline = multiline;
    }

    /** Traits for {@code environmentName}; {@link #NONE} for names outside the taxonomy. */
    public static EnvironmentTraits forEnvironment(String environmentName) {
        if (environmentName == null) {
            return NONE;
        }
        return TAXONOMY.getOrDefault(environmentName, NONE);
    }

    public static boolean isMathEnvironment(String environmentName) {
        return environmentName != null && TAXONOMY.containsKey(environmentName);
    }

    public static boolean isMatrixEnvironment(String environmentName) {
        return environmentName != null
                && (environmentName.endsWith("matrix") || "array".equals(environmentName));
    }

    public boolean isNumbered() {
        return numbered;
    }

    public boolean hasAlignment() {
        return alignment;
    }

    public boolean isMultiline() {
        return multiline;
    }

    @Override
    public String toString() {
        return "EnvironmentTraits[numbered=" + numbered + ", alignment=" + alignment + ", multiline=" + multiline + "]";
    }
}
