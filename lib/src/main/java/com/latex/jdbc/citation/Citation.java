package com.latex.jdbc.citation;

import com.latex.jdbc.loader.ast.SourceLocation;
import java.util.List;
import java.util.Objects;

/** One citation command. {@code keys} is never empty; a combined citation carries several. */
public final class Citation {
    private final List<String> keys;
    private final CitationType citationType;
    private final String prenote;
    private final String postnote;
    private final boolean starForm;
    private final SourceLocation location;
    private final String rawText;

    public Citation(
            List<String> keys,
            CitationType citationType,
            String prenote,
            String postnote,
            boolean starForm,
            SourceLocation location,
            String rawText) {
        Objects.requireNonNull(keys, "keys");
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("A citation needs at least one key");
        }
        this.keys = List.copyOf(keys);
        this.citationType = Objects.requireNonNull(citationType, "citationType");
        this.prenote = prenote == null ? "" : prenote;
        this.postnote = postnote == null ? "" : postnote;
        this.starForm = starForm;
        this.location = Objects.requireNonNull(location, "location");
        this.rawText = rawText == null ? "" : rawText;
    }

    public List<String> getKeys() {
        return keys;
    }

    public boolean isMultiple() {
        return keys.size() > 1;
    }

    public CitationType getCitationType() {
        return citationType;
    }

    public String getPrenote() {
        return prenote;
    }

    public String getPostnote() {
        return postnote;
    }

    public boolean isStarForm() {
        return starForm;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getRawText() {
        return rawText;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Citation)) {
            return false;
        }
        Citation other = (Citation) obj;
        return starForm == other.starForm
                && keys.equals(other.keys)
                && citationType == other.citationType
                && prenote.equals(other.prenote)
                && postnote.equals(other.postnote)
                && location.equals(other.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keys, citationType, prenote, postnote, starForm, location);
    }

    @Override
    public String toString() {
        return "\\" + citationType.getCommandName() + keys + " @" + location;
    }
}
