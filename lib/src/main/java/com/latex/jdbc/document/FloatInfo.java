package com.latex.jdbc.document;

import com.latex.jdbc.loader.ast.SourceLocation;
import java.util.List;
import java.util.Objects;

/** A figure or table float with its caption, label and included graphics. */
public final class FloatInfo {

    public enum Kind {
        FIGURE,
        TABLE
    }

    private final String environmentName;
    private final Kind kind;
    private final String caption;
    private final String label;
    private final List<String> graphics;
    private final SourceLocation location;

    public FloatInfo(
            String environmentName,
            Kind kind,
            String caption,
            String label,
            List<String> graphics,
            SourceLocation location) {
        this.environmentName = Objects.requireNonNull(environmentName, "environmentName");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.caption = caption;
        this.label = label;
        this.graphics = List.copyOf(graphics);
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getEnvironmentName() {
        return environmentName;
    }

    public Kind getKind() {
        return kind;
    }

    /** First {@code \caption} argument, or {@code null}. */
    public String getCaption() {
        return caption;
    }

    /** First {@code \label} inside the float, or {@code null}. */
    public String getLabel() {
        return label;
    }

    public List<String> getGraphics() {
        return graphics;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
