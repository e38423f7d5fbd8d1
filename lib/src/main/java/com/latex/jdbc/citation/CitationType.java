package com.latex.jdbc.citation;

import java.util.Locale;

/** The citation commands the extractor recognises, from plain LaTeX, natbib and biblatex. */
public enum CitationType {
    CITE("cite"),
    CITEP("citep"),
    CITET("citet"),
    CITEALP("citealp"),
    CITEALT("citealt"),
    CITEAUTHOR("citeauthor"),
    CITEYEAR("citeyear"),
    FOOTCITE("footcite"),
    PARENCITE("parencite"),
    TEXTCITE("textcite"),
    AUTOCITE("autocite"),
    FULLCITE("fullcite"),
    FOOTFULLCITE("footfullcite");

    private final String commandName;

    CitationType(String commandName) {
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }

    /** Case-insensitive lookup by command name, so biblatex's {@code \Textcite} maps to TEXTCITE. */
    public static CitationType fromCommandName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (CitationType type : values()) {
            if (type.commandName.equals(lower)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown citation command: " + name);
    }
}
