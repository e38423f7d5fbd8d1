package com.latex.jdbc.schema;

import java.util.List;

/** Cell rendering shared by the table materializers. */
final class Rows {

    private Rows() {}

    /** Renders arguments the way they were written, e.g. {@code {a}{b}} or {@code [x]}. */
    static String renderArguments(List<String> arguments, char open, char close) {
        if (arguments.isEmpty()) {
            return null;
        }
        StringBuilder builder = new StringBuilder();
        for (String argument : arguments) {
            builder.append(open).append(argument).append(close);
        }
        return builder.toString();
    }

    static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    static String joinOrNull(Iterable<String> values) {
        String joined = String.join(",", values);
        return joined.isEmpty() ? null : joined;
    }
}
