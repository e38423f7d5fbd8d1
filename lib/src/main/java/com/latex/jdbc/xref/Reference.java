package com.latex.jdbc.xref;

import com.latex.jdbc.loader.ast.SourceLocation;
import java.util.Objects;

/** One target of a reference command; {@code \cref{a,b}} yields two. */
public final class Reference {
    private final String commandName;
    private final String targetLabel;
    private final SourceLocation location;

    public Reference(String commandName, String targetLabel, SourceLocation location) {
        this.commandName = Objects.requireNonNull(commandName, "commandName");
        this.targetLabel = Objects.requireNonNull(targetLabel, "targetLabel");
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getCommandName() {
        return commandName;
    }

    public String getTargetLabel() {
        return targetLabel;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Reference)) {
            return false;
        }
        Reference other = (Reference) obj;
        return commandName.equals(other.commandName)
                && targetLabel.equals(other.targetLabel)
                && location.equals(other.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commandName, targetLabel, location);
    }

    @Override
    public String toString() {
        return "\\" + commandName + "{" + targetLabel + "} @" + location;
    }
}
