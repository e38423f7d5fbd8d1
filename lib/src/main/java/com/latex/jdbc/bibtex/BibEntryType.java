package com.latex.jdbc.bibtex;

import java.util.Locale;
import java.util.Optional;

public enum BibEntryType {
    ARTICLE("article"),
    BOOK("book"),
    INBOOK("inbook"),
    INCOLLECTION("incollection"),
    INPROCEEDINGS("inproceedings"),
    PROCEEDINGS("proceedings"),
    CONFERENCE("conference"),
    MASTERSTHESIS("mastersthesis"),
    PHDTHESIS("phdthesis"),
    TECHREPORT("techreport"),
    MANUAL("manual"),
    MISC("misc"),
    UNPUBLISHED("unpublished"),
    ONLINE("online"),
    ELECTRONIC("electronic");

    private final String bibtexName;

    BibEntryType(String bibtexName) {
        this.bibtexName = bibtexName;
    }

    public String getBibtexName() {
        return bibtexName;
    }

    public static Optional<BibEntryType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        for (BibEntryType type : values()) {
            if (type.bibtexName.equals(lower)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
