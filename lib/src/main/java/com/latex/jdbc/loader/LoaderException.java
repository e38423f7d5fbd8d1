package com.latex.jdbc.loader;

/**
 * Checked exception signalling that a document or bibliography could not be read. Malformed LaTeX
 * or BibTeX never raises this; those problems are reported as {@link LoaderMessage diagnostics}.
 */
public final class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
