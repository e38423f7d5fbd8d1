package com.latex.jdbc.loader.ast;

import java.util.Objects;

/** A delimited math region in running text: {@code $..$}, {@code $$..$$}, {@code \(..\)} or {@code \[..\]}. */
public final class MathSpan {
    private final boolean display;
    private final String delimiter;
    private final String content;
    private final SourceLocation location;
    private final int endOffset;

    public MathSpan(boolean display, String delimiter, String content, SourceLocation location, int endOffset) {
        this.display = display;
        this.delimiter = Objects.requireNonNull(delimiter, "delimiter");
        this.content = Objects.requireNonNull(content, "content");
        this.location = Objects.requireNonNull(location, "location");
        this.endOffset = endOffset;
    }

    public boolean isDisplay() {
        return display;
    }

    /** The opening delimiter as written. */
    public String getDelimiter() {
        return delimiter;
    }

    public String getContent() {
        return content;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int getEndOffset() {
        return endOffset;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MathSpan)) {
            return false;
        }
        MathSpan other = (MathSpan) obj;
        return display == other.display
                && endOffset == other.endOffset
                && delimiter.equals(other.delimiter)
                && content.equals(other.content)
                && location.equals(other.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(display, delimiter, content, location, endOffset);
    }
}
