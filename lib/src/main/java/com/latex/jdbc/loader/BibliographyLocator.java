package com.latex.jdbc.loader;

import java.nio.file.Path;
import java.util.Optional;

/** Turns a {@code \bibliography} name into the file that holds it. */
public interface BibliographyLocator {

    /**
     * @param document the flattened {@code .tex} file being loaded
     * @param bibliographyName a name as written in {@code \bibliography{...}}, with or without extension
     * @return the bibliography file, or empty when it cannot be found
     */
    Optional<Path> locate(Path document, String bibliographyName);
}
