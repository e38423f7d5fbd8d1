package com.latex.jdbc.document;

import com.latex.jdbc.loader.ast.Command;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Document class and loaded packages, read from the {@code documentclass} and {@code usepackage}
 * commands.
 */
public final class PreambleInfo {
    private final String documentClass;
    private final List<String> documentClassOptions;
    private final List<String> packages;

    public PreambleInfo(String documentClass, List<String> documentClassOptions, List<String> packages) {
        this.documentClass = documentClass == null ? "" : documentClass;
        this.documentClassOptions = List.copyOf(documentClassOptions);
        this.packages = List.copyOf(packages);
    }

    /**
     * Reads the first {@code documentclass} and every {@code usepackage} command. Comma lists are
     * split and repeated package names are kept once, at their first position.
     */
    public static PreambleInfo from(List<Command> commands) {
        Objects.requireNonNull(commands, "commands");
        String documentClass = "";
        List<String> options = new ArrayList<>();
        Set<String> packages = new LinkedHashSet<>();
        boolean classSeen = false;
        for (Command command : commands) {
            if ("documentclass".equals(command.getName()) && !classSeen && command.firstArgument() != null) {
                classSeen = true;
                documentClass = command.firstArgument().trim();
                for (String optional : command.getOptionalArguments()) {
                    options.addAll(splitList(optional));
                }
            } else if ("usepackage".equals(command.getName()) && command.firstArgument() != null) {
                packages.addAll(splitList(command.firstArgument()));
            }
        }
        return new PreambleInfo(documentClass, options, new ArrayList<>(packages));
    }

    static List<String> splitList(String value) {
        List<String> out = new ArrayList<>();
        for (String part : value.split(",")) {
            String item = part.trim();
            if (!item.isEmpty()) {
                out.add(item);
            }
        }
        return out;
    }

    /** Empty when the source has no {@code \documentclass}. */
    public String getDocumentClass() {
        return documentClass;
    }

    public List<String> getDocumentClassOptions() {
        return documentClassOptions;
    }

    public List<String> getPackages() {
        return packages;
    }

    public boolean usesPackage(String name) {
        return packages.contains(name);
    }
}
