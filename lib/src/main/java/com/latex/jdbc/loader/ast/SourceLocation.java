package com.latex.jdbc.loader.ast;

import java.util.Objects;

/** Position of a construct in a named source: 1-based line and column plus the 0-based offset. */
public final class SourceLocation {
    private final String sourceName;
    private final int line;
    private final int column;
    private final int offset;

    public SourceLocation(String sourceName, int line, int column, int offset) {
        this.sourceName = sourceName == null ? "" : sourceName;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourceLocation)) {
            return false;
        }
        SourceLocation other = (SourceLocation) obj;
        return line == other.line
                && column == other.column
                && offset == other.offset
                && Objects.equals(sourceName, other.sourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, line, column, offset);
    }

    @Override
    public String toString() {
        return sourceName + ":" + line + ":" + column;
    }
}
