package com.latex.jdbc.loader.ast;

import java.util.List;
import java.util.Objects;

/** One node of the section outline. Levels are 1-based: part = 1 through subparagraph = 7. */
public final class DocumentSection {
    private final String title;
    private final String commandName;
    private final int level;
    private final boolean starForm;
    private final SourceLocation location;
    private final List<LatexNode> elements;
    private final List<DocumentSection> subsections;

    public DocumentSection(
            String title,
            String commandName,
            int level,
            boolean starForm,
            SourceLocation location,
            List<LatexNode> elements,
            List<DocumentSection> subsections) {
        this.title = Objects.requireNonNull(title, "title");
        this.commandName = Objects.requireNonNull(commandName, "commandName");
        this.level = level;
        this.starForm = starForm;
        this.location = Objects.requireNonNull(location, "location");
        this.elements = List.copyOf(elements);
        this.subsections = List.copyOf(subsections);
    }

    public String getTitle() {
        return title;
    }

    public String getCommandName() {
        return commandName;
    }

    public int getLevel() {
        return level;
    }

    public boolean isStarForm() {
        return starForm;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** Commands and environments between this heading and the next heading, in document order. */
    public List<LatexNode> getElements() {
        return elements;
    }

    public List<DocumentSection> getSubsections() {
        return subsections;
    }

    @Override
    public String toString() {
        return "DocumentSection[" + level + " " + title + ", subsections=" + subsections.size() + "]";
    }
}
