package com.latex.jdbc.xref;

import com.latex.jdbc.loader.ast.Command;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Joins {@code \label} definitions against reference commands. Every reference ends up in the
 * resolution map, either pointing at the first definition of its label or marked undefined.
 */
public final class CrossReferenceResolver {

    public static final Set<String> REFERENCE_COMMANDS =
            Set.of("ref", "eqref", "pageref", "nameref", "autoref", "vref", "cref", "Cref");

    private static final Set<String> LIST_COMMANDS = Set.of("cref", "Cref");

    public List<Label> extractLabels(List<Command> commands) {
        List<Label> labels = new ArrayList<>();
        for (Command command : commands) {
            if ("label".equals(command.getName()) && command.firstArgument() != null) {
                String name = command.firstArgument().trim();
                if (!name.isEmpty()) {
                    labels.add(new Label(name, command.getLocation()));
                }
            }
        }
        return labels;
    }

    public List<Reference> extractReferences(List<Command> commands) {
        List<Reference> references = new ArrayList<>();
        for (Command command : commands) {
            String name = command.getName();
            if (!REFERENCE_COMMANDS.contains(name) || command.firstArgument() == null) {
                continue;
            }
            String argument = command.firstArgument();
            List<String> targets = LIST_COMMANDS.contains(name) ? List.of(argument.split(",")) : List.of(argument);
            for (String target : targets) {
                String label = target.trim();
                if (!label.isEmpty()) {
                    references.add(new Reference(name, label, command.getLocation()));
                }
            }
        }
        return references;
    }

    /** Label name to its first definition. */
    public Map<String, Label> index(List<Label> labels) {
        Map<String, Label> byName = new LinkedHashMap<>();
        for (Label label : labels) {
            byName.putIfAbsent(label.getName(), label);
        }
        return byName;
    }

    public Map<String, ReferenceResolution> resolve(Map<String, Label> labels, List<Reference> references) {
        Objects.requireNonNull(labels, "labels");
        Objects.requireNonNull(references, "references");
        Map<String, List<Reference>> byTarget = new LinkedHashMap<>();
        for (Reference reference : references) {
            byTarget.computeIfAbsent(reference.getTargetLabel(), key -> new ArrayList<>()).add(reference);
        }
        Map<String, ReferenceResolution> resolutions = new LinkedHashMap<>();
        for (Map.Entry<String, List<Reference>> entry : byTarget.entrySet()) {
            resolutions.put(
                    entry.getKey(),
                    new ReferenceResolution(entry.getKey(), labels.get(entry.getKey()), entry.getValue()));
        }
        return resolutions;
    }

    public CrossReferenceReport analyze(List<Command> commands) {
        Objects.requireNonNull(commands, "commands");
        List<Label> labels = extractLabels(commands);
        List<Reference> references = extractReferences(commands);
        Map<String, Label> index = index(labels);
        Map<String, ReferenceResolution> resolutions = resolve(index, references);

        List<Label> duplicates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Label label : labels) {
            if (!seen.add(label.getName())) {
                duplicates.add(label);
            }
        }
        List<Label> unreferenced = new ArrayList<>();
        for (Label label : index.values()) {
            if (!resolutions.containsKey(label.getName())) {
                unreferenced.add(label);
            }
        }
        return new CrossReferenceReport(labels, references, resolutions, duplicates, unreferenced);
    }
}
