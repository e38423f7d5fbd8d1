package com.latex.jdbc.loader.ast;

import java.util.List;
import java.util.Objects;

/**
 * A command invocation with its bracket and brace arguments. Argument strings are copied out of
 * the source verbatim, without their outer delimiters.
 */
public final class Command implements LatexNode {
    private final String name;
    private final List<String> arguments;
    private final List<String> optionalArguments;
    private final boolean starForm;
    private final SourceLocation location;
    private final int endOffset;

    public Command(
            String name,
            List<String> arguments,
            List<String> optionalArguments,
            boolean starForm,
            SourceLocation location,
            int endOffset) {
        this.name = Objects.requireNonNull(name, "name");
        this.arguments = List.copyOf(arguments);
        this.optionalArguments = List.copyOf(optionalArguments);
        this.starForm = starForm;
        this.location = Objects.requireNonNull(location, "location");
        this.endOffset = endOffset;
    }

    @Override
    public String getName() {
        return name;
    }

    public List<String> getArguments() {
        return arguments;
    }

    public List<String> getOptionalArguments() {
        return optionalArguments;
    }

    /** First mandatory argument, or {@code null} when the command has none. */
    public String firstArgument() {
        return arguments.isEmpty() ? null : arguments.get(0);
    }

    public boolean isStarForm() {
        return starForm;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public int getOffset() {
        return location.getOffset();
    }

    /** Offset one past the last consumed argument delimiter. */
    public int getEndOffset() {
        return endOffset;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Command)) {
            return false;
        }
        Command other = (Command) obj;
        return starForm == other.starForm
                && endOffset == other.endOffset
                && name.equals(other.name)
                && arguments.equals(other.arguments)
                && optionalArguments.equals(other.optionalArguments)
                && location.equals(other.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments, optionalArguments, starForm, location, endOffset);
    }

    @Override
    public String toString() {
        return "\\" + name + (starForm ? "*" : "") + optionalArguments + arguments + " @" + location;
    }
}
