package com.latex.jdbc.math;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts variables, functions, operators and structural flags from a formula and folds them
 * into a complexity score. The score only ranks formulas against each other; it has no absolute
 * meaning. Stateless and safe to share.
 */
public final class EquationAnalyzer {

    static final double VARIABLE_WEIGHT = 0.5;
    static final double FUNCTION_WEIGHT = 1.0;
    static final double OPERATOR_WEIGHT = 0.3;
    static final double FRACTION_BONUS = 2.0;
    static final double INTEGRAL_BONUS = 3.0;
    static final double SUMMATION_BONUS = 2.5;
    static final double MATRIX_BONUS = 3.5;

    private static final Set<String> FUNCTIONS =
            Set.of(
                    "sin", "cos", "tan", "sec", "csc", "cot", "arcsin", "arccos", "arctan", "sinh", "cosh",
                    "tanh", "log", "ln", "lg", "exp", "sqrt", "lim", "max", "min", "det", "dim", "ker", "gcd",
                    "lcm", "sup", "inf");

    private static final Set<String> NAMED_OPERATORS =
            Set.of(
                    "leq", "geq", "neq", "approx", "propto", "infty", "partial", "nabla", "Delta", "int",
                    "oint", "sum", "prod", "cup", "cap", "in", "notin", "subset", "supset", "subseteq",
                    "supseteq", "wedge", "vee", "neg", "Rightarrow", "Leftrightarrow", "forall", "exists");

    private static final String OPERATOR_GLYPHS = "+-*/=<>≤≥≠≈∝∞∂∇∆∫∮∑∏⋃⋂∈∉⊂⊃⊆⊇∧∨¬⇒⇔∀∃";

    private static final Set<String> FRACTIONS = Set.of("frac", "dfrac", "tfrac");
    private static final Set<String> INTEGRALS = Set.of("int", "iint", "iiint", "oint");
    private static final Set<String> SUMMATIONS = Set.of("sum", "prod");
    private static final Set<String> MATRICES = Set.of("matrix", "pmatrix", "bmatrix", "Bmatrix", "vmatrix", "Vmatrix");

    private static final Pattern MATRIX_BEGIN = Pattern.compile("\\\\begin\\s*\\{\\s*[A-Za-z]*matrix\\s*\\}");
    /** Commands whose brace argument is a name or prose rather than formula content. */
    private static final Pattern NON_FORMULA_ARGUMENT =
            Pattern.compile(
                    "\\\\(?:begin|end|label|ref|eqref|text|textrm|textbf|textit|mathrm|mbox|operatorname|tag)\\*?\\s*\\{[^{}]*\\}");
    private static final Pattern LABEL = Pattern.compile("\\\\label\\s*\\{([^}]+)\\}");

    public EquationInfo analyze(String latex, String environmentName) {
        Objects.requireNonNull(latex, "latex");
        String environment = environmentName == null ? "" : environmentName;
        String cleaned = clean(latex);
        Set<String> commandNames = commandNames(cleaned);

        Set<String> variables = extractVariables(NON_FORMULA_ARGUMENT.matcher(cleaned).replaceAll(" "));
        Set<String> functions = new HashSet<>();
        Set<String> operators = new HashSet<>();
        for (String name : commandNames) {
            if (FUNCTIONS.contains(name)) {
                functions.add(name);
            }
            if (NAMED_OPERATORS.contains(name)) {
                operators.add(name);
            }
        }
        for (int i = 0; i < cleaned.length(); i++) {
            char c = cleaned.charAt(i);
            if (OPERATOR_GLYPHS.indexOf(c) >= 0 && !isEscaped(cleaned, i)) {
                operators.add(String.valueOf(c));
            }
        }

        boolean fractions = intersects(commandNames, FRACTIONS);
        boolean integrals = intersects(commandNames, INTEGRALS);
        boolean summations = intersects(commandNames, SUMMATIONS);
        boolean matrices =
                intersects(commandNames, MATRICES)
                        || MATRIX_BEGIN.matcher(cleaned).find()
                        || EnvironmentTraits.isMatrixEnvironment(environment);
        boolean subscripts = containsUnescaped(cleaned, '_');
        boolean superscripts = containsUnescaped(cleaned, '^');

        double score =
                VARIABLE_WEIGHT * variables.size()
                        + FUNCTION_WEIGHT * functions.size()
                        + OPERATOR_WEIGHT * operators.size();
        if (fractions) {
            score += FRACTION_BONUS;
        }
        if (integrals) {
            score += INTEGRAL_BONUS;
        }
        if (summations) {
            score += SUMMATION_BONUS;
        }
        if (matrices) {
            score += MATRIX_BONUS;
        }
        int lineCount = Math.max(1, countOccurrences(cleaned, "\\\\") + 1);
        return new EquationInfo(
                latex,
                environment,
                variables,
                functions,
                operators,
                score,
                fractions,
                integrals,
                summations,
                matrices,
                subscripts,
                superscripts,
                lineCount);
    }

    /** Analyses the body of a math environment: rows, alignment points and labels on top of {@link #analyze}. */
    public MathEnvironmentAnalysis analyzeEnvironment(String environmentName, String content) {
        Objects.requireNonNull(environmentName, "environmentName");
        Objects.requireNonNull(content, "content");
        int rows = 0;
        for (String row : content.split("\\\\\\\\", -1)) {
            if (!row.isBlank()) {
                rows++;
            }
        }
        int alignmentPoints = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '&' && !isEscaped(content, i)) {
                alignmentPoints++;
            }
        }
        List<String> labels = new ArrayList<>();
        Matcher matcher = LABEL.matcher(content);
        while (matcher.find()) {
            labels.add(matcher.group(1).trim());
        }
        return new MathEnvironmentAnalysis(
                environmentName,
                EnvironmentTraits.forEnvironment(environmentName),
                rows,
                alignmentPoints,
                labels,
                analyze(content, environmentName));
    }

    /** Drops comments and collapses whitespace runs. */
    static String clean(String latex) {
        StringBuilder out = new StringBuilder(latex.length());
        int i = 0;
        while (i < latex.length()) {
            char c = latex.charAt(i);
            if (c == '\\' && i + 1 < latex.length()) {
                out.append(c).append(latex.charAt(i + 1));
                i += 2;
            } else if (c == '%') {
                while (i < latex.length() && latex.charAt(i) != '\n') {
                    i++;
                }
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString().replaceAll("\\s+", " ").trim();
    }

    private static Set<String> commandNames(String text) {
        Set<String> names = new LinkedHashSet<>();
        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) != '\\') {
                i++;
                continue;
            }
            int end = i + 1;
            while (end < text.length() && isAsciiLetter(text.charAt(end))) {
                end++;
            }
            if (end > i + 1) {
                names.add(text.substring(i + 1, end));
                i = end;
            } else {
                i += 2;
            }
        }
        return names;
    }

    /**
     * Letters outside command names. A letter run spelling a known function is skipped; any other
     * run is read as a product of single-letter variables, and the last letter keeps a braced
     * {@code _{..}} and {@code ^{..}} suffix.
     */
    private static Set<String> extractVariables(String text) {
        Set<String> variables = new HashSet<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                int end = i + 1;
                while (end < text.length() && isAsciiLetter(text.charAt(end))) {
                    end++;
                }
                i = end > i + 1 ? end : i + 2;
                continue;
            }
            if (!isAsciiLetter(c)) {
                i++;
                continue;
            }
            int end = i;
            while (end < text.length() && isAsciiLetter(text.charAt(end))) {
                end++;
            }
            String word = text.substring(i, end);
            if (FUNCTIONS.contains(word)) {
                i = end;
                continue;
            }
            for (int k = 0; k < word.length() - 1; k++) {
                variables.add(String.valueOf(word.charAt(k)));
            }
            int suffixEnd = braced(text, end, '_');
            suffixEnd = braced(text, suffixEnd, '^');
            variables.add(word.charAt(word.length() - 1) + text.substring(end, suffixEnd));
            i = suffixEnd;
        }
        return variables;
    }

    /** End of a {@code marker{...}} group starting at {@code index}, or {@code index} when absent. */
    private static int braced(String text, int index, char marker) {
        if (index + 1 >= text.length() || text.charAt(index) != marker || text.charAt(index + 1) != '{') {
            return index;
        }
        int close = text.indexOf('}', index + 2);
        return close < 0 ? index : close + 1;
    }

    private static boolean intersects(Set<String> names, Set<String> vocabulary) {
        for (String name : names) {
            if (vocabulary.contains(name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsUnescaped(String text, char c) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c && !isEscaped(text, i)) {
                return true;
            }
        }
        return false;
    }

    /** True when an odd number of backslashes precedes {@code index}. */
    private static boolean isEscaped(String text, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    private static int countOccurrences(String text, String needle) {
        int count = 0;
        int from = text.indexOf(needle);
        while (from >= 0) {
            count++;
            from = text.indexOf(needle, from + needle.length());
        }
        return count;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
