package com.latex.jdbc.xref;

import com.latex.jdbc.loader.ast.SourceLocation;
import java.util.Objects;

/** A {@code \label{name}} definition. */
public final class Label {
    private final String name;
    private final SourceLocation location;

    public Label(String name, SourceLocation location) {
        this.name = Objects.requireNonNull(name, "name");
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getName() {
        return name;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Label)) {
            return false;
        }
        Label other = (Label) obj;
        return name.equals(other.name) && location.equals(other.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, location);
    }

    @Override
    public String toString() {
        return "Label[" + name + " @" + location + "]";
    }
}
