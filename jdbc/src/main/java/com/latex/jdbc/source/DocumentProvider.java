package com.latex.jdbc.source;

import com.latex.jdbc.loader.LatexLoader;
import com.latex.jdbc.loader.LoaderException;
import com.latex.jdbc.loader.LoaderOptions;
import com.latex.jdbc.loader.LoaderResult;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Shared entry point for loading LaTeX documents, used by both the driver and the Calcite schema
 * factory so they run the same pipeline with the same options.
 */
public final class DocumentProvider {

    private DocumentProvider() {}

    public static LoaderResult load(Path documentPath) throws LoaderException {
        return load(documentPath, LoaderOptions.defaults());
    }

    public static LoaderResult load(Path documentPath, LoaderOptions options) throws LoaderException {
        Objects.requireNonNull(documentPath, "documentPath");
        Objects.requireNonNull(options, "options");
        return new LatexLoader(options).load(documentPath);
    }
}
