package com.latex.jdbc.loader;

import java.util.Locale;

/** How the BibTeX parser treats a key that appears more than once in one bibliography. */
public enum DuplicateKeyPolicy {
    /** Later entries replace earlier ones; a warning is recorded. */
    KEEP_LAST,
    /** The first entry is kept and later ones are skipped; a warning is recorded. */
    KEEP_FIRST,
    /** Every entry carrying the key is dropped and an error is recorded. */
    REJECT;

    public static DuplicateKeyPolicy fromName(String name) {
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (DuplicateKeyPolicy policy : values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown duplicate key policy: " + name);
    }
}
