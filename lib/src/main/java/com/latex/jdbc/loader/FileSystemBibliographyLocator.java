package com.latex.jdbc.loader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** Looks for {@code <name>.bib} relative to the directory of the document. */
public final class FileSystemBibliographyLocator implements BibliographyLocator {

    @Override
    public Optional<Path> locate(Path document, String bibliographyName) {
        String fileName = bibliographyName.endsWith(".bib") ? bibliographyName : bibliographyName + ".bib";
        Path directory = document.toAbsolutePath().getParent();
        Path candidate = directory == null ? Path.of(fileName) : directory.resolve(fileName);
        return Files.isRegularFile(candidate) ? Optional.of(candidate.normalize()) : Optional.empty();
    }
}
