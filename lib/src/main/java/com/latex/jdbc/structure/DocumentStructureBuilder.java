package com.latex.jdbc.structure;

import com.latex.jdbc.loader.ast.Command;
import com.latex.jdbc.loader.ast.DocumentSection;
import com.latex.jdbc.loader.ast.Environment;
import com.latex.jdbc.loader.ast.LatexNode;
import com.latex.jdbc.loader.ast.SourceLocation;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Builds the section outline from sectioning commands. A new heading closes every open section
 * at the same or a deeper depth and nests under whatever remains on top of the stack.
 */
public final class DocumentStructureBuilder {

    public List<DocumentSection> build(List<Command> commands) {
        return build(commands, List.of());
    }

    /**
     * Builds the outline and attaches each non-heading command and each given environment to the
     * section it appears in. Elements before the first heading belong to no section.
     */
    public List<DocumentSection> build(List<Command> commands, List<Environment> environments) {
        Objects.requireNonNull(commands, "commands");
        Objects.requireNonNull(environments, "environments");
        List<LatexNode> nodes = new ArrayList<>(commands.size() + environments.size());
        nodes.addAll(commands);
        nodes.addAll(environments);
        nodes.sort(Comparator.comparingInt(node -> node.getLocation().getOffset()));

        List<Node> roots = new ArrayList<>();
        Deque<Node> open = new ArrayDeque<>();
        for (LatexNode node : nodes) {
            if (node instanceof Command command && SectionLevels.isSectioning(command.getName())) {
                int depth = SectionLevels.depthOf(command.getName());
                while (!open.isEmpty() && open.peek().depth >= depth) {
                    open.pop();
                }
                Node section = new Node(command, depth);
                if (open.isEmpty()) {
                    roots.add(section);
                } else {
                    open.peek().children.add(section);
                }
                open.push(section);
            } else if (!open.isEmpty() && isElement(node)) {
                open.peek().elements.add(node);
            }
        }
        List<DocumentSection> result = new ArrayList<>(roots.size());
        for (Node root : roots) {
            result.add(root.freeze());
        }
        return List.copyOf(result);
    }

    private static boolean isElement(LatexNode node) {
        if (node instanceof Command command) {
            return !"begin".equals(command.getName()) && !"end".equals(command.getName());
        }
        return true;
    }

    private static final class Node {
        private final Command heading;
        private final int depth;
        private final List<LatexNode> elements = new ArrayList<>();
        private final List<Node> children = new ArrayList<>();

        private Node(Command heading, int depth) {
            this.heading = heading;
            this.depth = depth;
        }

        private DocumentSection freeze() {
            List<DocumentSection> subsections = new ArrayList<>(children.size());
            for (Node child : children) {
                subsections.add(child.freeze());
            }
            String title = heading.firstArgument();
            if (title == null) {
                title = "Untitled " + heading.getName();
            }
            SourceLocation location = heading.getLocation();
            return new DocumentSection(
                    title, heading.getName(), depth + 1, heading.isStarForm(), location, elements, subsections);
        }
    }
}
