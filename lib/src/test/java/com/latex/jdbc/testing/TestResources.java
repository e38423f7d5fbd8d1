package com.latex.jdbc.testing;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Copies classpath fixtures to a temporary directory so tests can load them through the file
 * system. Fixtures from the same classpath directory land in the same directory, which keeps
 * sibling {@code .bib} lookup working.
 */
public final class TestResources {

    private static final Path CLASSPATH_CACHE_DIR = initClasspathCacheDir();

    private TestResources() {}

    public static Path resolveResource(String resourceName) {
        String normalized = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
        try (InputStream in = TestResources.class.getClassLoader().getResourceAsStream(normalized)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + normalized);
            }
            Path target = CLASSPATH_CACHE_DIR.resolve(normalized).normalize();
            Files.createDirectories(target.getParent());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            target.toFile().deleteOnExit();
            return target;
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to extract " + normalized, ex);
        }
    }

    public static String readResource(String resourceName) {
        try {
            return Files.readString(resolveResource(resourceName), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + resourceName, ex);
        }
    }

    private static Path initClasspathCacheDir() {
        try {
            Path dir = Files.createTempDirectory("latex_test_resources");
            dir.toFile().deleteOnExit();
            return dir;
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to create classpath cache directory", ex);
        }
    }
}
