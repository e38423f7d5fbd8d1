package com.latex.jdbc.schema;

import com.latex.jdbc.document.DocumentEquation;
import com.latex.jdbc.math.EquationInfo;
import com.latex.jdbc.math.MathEnvironmentAnalysis;
import java.util.ArrayList;
import java.util.List;

/**
 * One row per analysed equation. The environment-only columns ({@code numbered},
 * {@code equation_count}, {@code alignment_points}, {@code labels}) are null for inline and
 * display math spans.
 */
public final class MathTable {
    public static final String NAME = "math";

    private static final TableDefinition DEFINITION =
            new TableDefinition(
                    NAME,
                    "Math environments and spans",
                    List.of(
                            ColumnDescriptor.integer("id", false),
                            ColumnDescriptor.varchar("origin", false),
                            ColumnDescriptor.varchar("environment_name", false),
                            ColumnDescriptor.varchar("latex", false),
                            ColumnDescriptor.varchar("variables", true),
                            ColumnDescriptor.varchar("functions", true),
                            ColumnDescriptor.varchar("operators", true),
                            ColumnDescriptor.real("complexity_score", false),
                            ColumnDescriptor.bool("has_fractions", false),
                            ColumnDescriptor.bool("has_integrals", false),
                            ColumnDescriptor.bool("has_summations", false),
                            ColumnDescriptor.bool("has_matrices", false),
                            ColumnDescriptor.bool("has_subscripts", false),
                            ColumnDescriptor.bool("has_superscripts", false),
                            ColumnDescriptor.integer("line_count", false),
                            ColumnDescriptor.bool("numbered", true),
                            ColumnDescriptor.integer("equation_count", true),
                            ColumnDescriptor.integer("alignment_points", true),
                            ColumnDescriptor.varchar("labels", true),
                            ColumnDescriptor.integer("source_lineno", false),
                            ColumnDescriptor.integer("source_column", false)));

    private MathTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<DocumentEquation> equations) {
        List<Object[]> rows = new ArrayList<>(equations.size());
        int id = 1;
        for (DocumentEquation equation : equations) {
            EquationInfo info = equation.getInfo();
            MathEnvironmentAnalysis analysis = equation.getEnvironmentAnalysis().orElse(null);
            rows.add(
                    new Object[] {
                        id++,
                        equation.getOrigin().name(),
                        equation.getName(),
                        info.getLatex(),
                        Rows.joinOrNull(info.getVariables()),
                        Rows.joinOrNull(info.getFunctions()),
                        Rows.joinOrNull(info.getOperators()),
                        info.getComplexityScore(),
                        info.hasFractions(),
                        info.hasIntegrals(),
                        info.hasSummations(),
                        info.hasMatrices(),
                        info.hasSubscripts(),
                        info.hasSuperscripts(),
                        info.getLineCount(),
                        analysis == null ? null : analysis.getTraits().isNumbered(),
                        analysis == null ? null : analysis.getEquationCount(),
                        analysis == null ? null : analysis.getAlignmentPoints(),
                        analysis == null ? null : Rows.joinOrNull(analysis.getLabels()),
                        equation.getLocation().getLine(),
                        equation.getLocation().getColumn()
                    });
        }
        return rows;
    }
}
