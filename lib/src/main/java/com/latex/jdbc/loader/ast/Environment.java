package com.latex.jdbc.loader.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A matched {@code \begin{name}...\end{name}} block. Only balanced blocks are ever constructed;
 * {@code content} is the exact source between the end of the begin command (including its
 * arguments) and the start of the matching end command.
 */
public final class Environment implements LatexNode {
    private final String name;
    private final List<String> beginArguments;
    private final List<String> beginOptionalArguments;
    private final String content;
    private final SourceLocation location;
    private final SourceLocation endLocation;
    private final int endOffset;
    private final List<Environment> nestedEnvironments;

    public Environment(
            String name,
            List<String> beginArguments,
            List<String> beginOptionalArguments,
            String content,
            SourceLocation location,
            SourceLocation endLocation,
            int endOffset,
            List<Environment> nestedEnvironments) {
        this.name = Objects.requireNonNull(name, "name");
        this.beginArguments = List.copyOf(beginArguments);
        this.beginOptionalArguments = List.copyOf(beginOptionalArguments);
        this.content = Objects.requireNonNull(content, "content");
        this.location = Objects.requireNonNull(location, "location");
        this.endLocation = Objects.requireNonNull(endLocation, "endLocation");
        this.endOffset = endOffset;
        this.nestedEnvironments = List.copyOf(nestedEnvironments);
    }

    @Override
    public String getName() {
        return name;
    }

    /** Arguments of the begin command after the environment name, e.g. {@code {ll}} of a tabular. */
    public List<String> getBeginArguments() {
        return beginArguments;
    }

    public List<String> getBeginOptionalArguments() {
        return beginOptionalArguments;
    }

    public String getContent() {
        return content;
    }

    /** Location of the {@code \begin} command. */
    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public int getBeginOffset() {
        return location.getOffset();
    }

    /** Location of the matching {@code \end} command. */
    public SourceLocation getEndLocation() {
        return endLocation;
    }

    /** Offset one past the closing brace of the matching {@code \end{name}}. */
    public int getEndOffset() {
        return endOffset;
    }

    public List<Environment> getNestedEnvironments() {
        return nestedEnvironments;
    }

    public boolean contains(int offset) {
        return offset >= getBeginOffset() && offset < endOffset;
    }

    /** This environment followed by all nested environments, depth-first in document order. */
    public List<Environment> flatten() {
        List<Environment> out = new ArrayList<>();
        collect(this, out);
        return out;
    }

    private static void collect(Environment environment, List<Environment> out) {
        out.add(environment);
        for (Environment nested : environment.nestedEnvironments) {
            collect(nested, out);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Environment)) {
            return false;
        }
        Environment other = (Environment) obj;
        return endOffset == other.endOffset
                && name.equals(other.name)
                && beginArguments.equals(other.beginArguments)
                && beginOptionalArguments.equals(other.beginOptionalArguments)
                && content.equals(other.content)
                && location.equals(other.location)
                && endLocation.equals(other.endLocation)
                && nestedEnvironments.equals(other.nestedEnvironments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, beginArguments, beginOptionalArguments, content, location, endOffset);
    }

    @Override
    public String toString() {
        return "Environment[" + name + " @" + location + ", nested=" + nestedEnvironments.size() + "]";
    }
}
