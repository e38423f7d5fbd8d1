package com.latex.jdbc.loader;

import java.util.Objects;

/**
 * Represents a diagnostic produced while analysing a LaTeX document or one of its bibliographies.
 * Every recoverable problem is reported this way and attached to the structural unit it concerns,
 * so batch callers decide for themselves whether a document is usable.
 */
public final class LoaderMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    public enum Category {
        TOKEN,
        COMMAND,
        ARGUMENT,
        ENVIRONMENT,
        MATH,
        CITATION,
        BIB_ENTRY,
        REFERENCE,
        DOCUMENT
    }

    private final Level level;
    private final Category category;
    private final String message;
    private final String sourceFilename;
    private final int sourceLineno;
    private final int sourceColumn;

    public LoaderMessage(
            Level level,
            Category category,
            String message,
            String sourceFilename,
            int sourceLineno,
            int sourceColumn) {
        this.level = Objects.requireNonNull(level, "level");
        this.category = Objects.requireNonNull(category, "category");
        this.message = Objects.requireNonNull(message, "message");
        this.sourceFilename = sourceFilename == null ? "" : sourceFilename;
        this.sourceLineno = sourceLineno;
        this.sourceColumn = sourceColumn;
    }

    public static LoaderMessage warning(Category category, String message, String sourceFilename, int line, int column) {
        return new LoaderMessage(Level.WARNING, category, message, sourceFilename, line, column);
    }

    public static LoaderMessage error(Category category, String message, String sourceFilename, int line, int column) {
        return new LoaderMessage(Level.ERROR, category, message, sourceFilename, line, column);
    }

    public static LoaderMessage info(Category category, String message, String sourceFilename, int line, int column) {
        return new LoaderMessage(Level.INFO, category, message, sourceFilename, line, column);
    }

    public Level getLevel() {
        return level;
    }

    public Category getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public String getSourceFilename() {
        return sourceFilename;
    }

    public int getSourceLineno() {
        return sourceLineno;
    }

    public int getSourceColumn() {
        return sourceColumn;
    }

    @Override
    public String toString() {
        return level + " [" + category + "] " + sourceFilename + ":" + sourceLineno + ":" + sourceColumn + " " + message;
    }
}
