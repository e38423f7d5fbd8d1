package com.latex.jdbc.loader;

import com.latex.jdbc.loader.ast.Command;
import com.latex.jdbc.loader.ast.Environment;
import com.latex.jdbc.loader.ast.MathSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Output of {@link LatexParser}: every command in document order, the top-level matched
 * environments (nested ones hang off their parents), the paired math spans and the diagnostics
 * recorded while recovering from malformed input.
 */
public final class ParseResult {
    private final List<Command> commands;
    private final List<Environment> environments;
    private final List<MathSpan> mathSpans;
    private final List<LoaderMessage> messages;

    public ParseResult(
            List<Command> commands,
            List<Environment> environments,
            List<MathSpan> mathSpans,
            List<LoaderMessage> messages) {
        this.commands = List.copyOf(Objects.requireNonNull(commands, "commands"));
        this.environments = List.copyOf(Objects.requireNonNull(environments, "environments"));
        this.mathSpans = List.copyOf(Objects.requireNonNull(mathSpans, "mathSpans"));
        this.messages = List.copyOf(Objects.requireNonNull(messages, "messages"));
    }

    public List<Command> getCommands() {
        return commands;
    }

    public List<Environment> getEnvironments() {
        return environments;
    }

    /** All matched environments, parents before children, in document order. */
    public List<Environment> getAllEnvironments() {
        List<Environment> all = new ArrayList<>();
        for (Environment environment : environments) {
            all.addAll(environment.flatten());
        }
        return all;
    }

    public List<MathSpan> getMathSpans() {
        return mathSpans;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }
}
