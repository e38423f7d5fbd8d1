package com.latex.jdbc.math;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class EquationAnalyzerTest {

    private final EquationAnalyzer analyzer = new EquationAnalyzer();

    @Test
    void fractionIntegralOutscoresBareVariable() {
        EquationInfo integral = analyzer.analyze("\\frac{1}{2}\\int_0^1 x\\,dx", "equation");
        EquationInfo bare = analyzer.analyze("x", "equation");

        assertTrue(integral.hasFractions());
        assertTrue(integral.hasIntegrals());
        assertTrue(integral.getVariables().contains("x"));
        assertTrue(integral.getComplexityScore() > bare.getComplexityScore());
    }

    @Test
    void scoreAddsWeightsAndBonuses() {
        EquationInfo info = analyzer.analyze("\\sum_{i} a_{i} + \\sin b", "equation");

        assertEquals(Set.of("i", "a_{i}", "b"), info.getVariables());
        assertEquals(Set.of("sin"), info.getFunctions());
        assertEquals(Set.of("sum", "+"), info.getOperators());
        assertTrue(info.hasSummations());
        assertTrue(info.hasSubscripts());
        assertFalse(info.hasSuperscripts());
        double expected =
                3 * EquationAnalyzer.VARIABLE_WEIGHT
                        + EquationAnalyzer.FUNCTION_WEIGHT
                        + 2 * EquationAnalyzer.OPERATOR_WEIGHT
                        + EquationAnalyzer.SUMMATION_BONUS;
        assertEquals(expected, info.getComplexityScore(), 1e-9);
    }

    @Test
    void functionNamesAreNotVariables() {
        EquationInfo info = analyzer.analyze("\\log y + \\exp(z)", "math");

        assertEquals(Set.of("y", "z"), info.getVariables());
        assertEquals(Set.of("log", "exp"), info.getFunctions());
    }

    @Test
    void textAndLabelArgumentsAreNotVariables() {
        EquationInfo info = analyzer.analyze("v = 1 \\text{if ok} \\label{eq:v}", "equation");

        assertEquals(Set.of("v"), info.getVariables());
    }

    @Test
    void detectsMatricesFromEnvironmentOrBody() {
        assertTrue(analyzer.analyze("a & b \\\\ c & d", "pmatrix").hasMatrices());
        assertTrue(analyzer.analyze("\\begin{bmatrix} 1 \\end{bmatrix}", "equation").hasMatrices());
        assertFalse(analyzer.analyze("a + b", "equation").hasMatrices());
    }

    @Test
    void countsLinesFromRowSeparators() {
        assertEquals(1, analyzer.analyze("a", "align").getLineCount());
        assertEquals(3, analyzer.analyze("a \\\\ b \\\\ c", "align").getLineCount());
    }

    @Test
    void environmentAnalysisCountsRowsAlignmentAndLabels() {
        MathEnvironmentAnalysis analysis =
                analyzer.analyzeEnvironment("align", "\n a &= b \\label{one} \\\\\n c &= d \\\\\n");

        assertEquals(2, analysis.getEquationCount());
        assertEquals(2, analysis.getAlignmentPoints());
        assertEquals(List.of("one"), analysis.getLabels());
        assertTrue(analysis.getTraits().isNumbered());
        assertTrue(analysis.getTraits().hasAlignment());
        assertTrue(analysis.getTraits().isMultiline());
    }

    @Test
    void starredEnvironmentsAreUnnumbered() {
        assertFalse(EnvironmentTraits.forEnvironment("equation*").isNumbered());
        assertTrue(EnvironmentTraits.forEnvironment("equation").isNumbered());
        assertTrue(EnvironmentTraits.isMathEnvironment("gather*"));
        assertFalse(EnvironmentTraits.isMathEnvironment("itemize"));
    }
}
