package com.latex.jdbc.document;

import com.latex.jdbc.loader.ast.SourceLocation;
import com.latex.jdbc.math.EquationInfo;
import com.latex.jdbc.math.MathEnvironmentAnalysis;
import java.util.Objects;
import java.util.Optional;

/** An analysed formula of the document: a math environment or a delimited math span. */
public final class DocumentEquation {

    public enum Origin {
        ENVIRONMENT,
        INLINE,
        DISPLAY
    }

    private final Origin origin;
    private final String name;
    private final SourceLocation location;
    private final EquationInfo info;
    private final MathEnvironmentAnalysis environmentAnalysis;

    public DocumentEquation(
            Origin origin,
            String name,
            SourceLocation location,
            EquationInfo info,
            MathEnvironmentAnalysis environmentAnalysis) {
        this.origin = Objects.requireNonNull(origin, "origin");
        this.name = Objects.requireNonNull(name, "name");
        this.location = Objects.requireNonNull(location, "location");
        this.info = Objects.requireNonNull(info, "info");
        this.environmentAnalysis = environmentAnalysis;
    }

    public Origin getOrigin() {
        return origin;
    }

    /** Environment name, or the opening delimiter for a math span. */
    public String getName() {
        return name;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public EquationInfo getInfo() {
        return info;
    }

    /** Present for {@link Origin#ENVIRONMENT} only. */
    public Optional<MathEnvironmentAnalysis> getEnvironmentAnalysis() {
        return Optional.ofNullable(environmentAnalysis);
    }
}
