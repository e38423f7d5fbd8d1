package com.latex.jdbc.structure;

import java.util.List;
import java.util.Map;

/** Sectioning commands and their depth, {@code part} = 0 through {@code subparagraph} = 6. */
public final class SectionLevels {

    public static final List<String> COMMANDS =
            List.of("part", "chapter", "section", "subsection", "subsubsection", "paragraph", "subparagraph");

    private static final Map<String, Integer> DEPTHS =
            Map.of(
                    "part", 0,
                    "chapter", 1,
                    "section", 2,
                    "subsection", 3,
                    "subsubsection", 4,
                    "paragraph", 5,
                    "subparagraph", 6);

    private SectionLevels() {}

    public static boolean isSectioning(String commandName) {
        return DEPTHS.containsKey(commandName);
    }

    /** Depth of the command, or -1 when it is not a sectioning command. */
    public static int depthOf(String commandName) {
        Integer depth = DEPTHS.get(commandName);
        return depth == null ? -1 : depth;
    }
}
