package com.latex.jdbc.citation;

import com.latex.jdbc.bibtex.BibEntry;
import com.latex.jdbc.bibtex.BibEntryType;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** Joins extracted citations against a parsed bibliography. Pure; performs no parsing. */
public final class CitationResolver {

    public CitationReport resolve(List<Citation> citations, Map<String, BibEntry> bibliography) {
        Objects.requireNonNull(citations, "citations");
        Objects.requireNonNull(bibliography, "bibliography");

        Map<CitationType, Integer> typeCounts = new EnumMap<>(CitationType.class);
        Set<String> citedKeys = new LinkedHashSet<>();
        for (Citation citation : citations) {
            typeCounts.merge(citation.getCitationType(), 1, Integer::sum);
            citedKeys.addAll(citation.getKeys());
        }

        Map<String, BibEntry> resolved = new LinkedHashMap<>();
        List<String> unresolved = new ArrayList<>();
        for (String key : citedKeys) {
            BibEntry entry = bibliography.get(key);
            if (entry != null) {
                resolved.put(key, entry);
            } else {
                unresolved.add(key);
            }
        }

        List<BibEntry> unused = new ArrayList<>();
        for (Map.Entry<String, BibEntry> entry : bibliography.entrySet()) {
            if (!citedKeys.contains(entry.getKey())) {
                unused.add(entry.getValue());
            }
        }

        Map<Integer, Integer> years = new HashMap<>();
        Map<BibEntryType, Integer> types = new EnumMap<>(BibEntryType.class);
        Map<String, Integer> firstAuthors = new HashMap<>();
        Map<String, Integer> journals = new HashMap<>();
        for (BibEntry entry : resolved.values()) {
            if (entry.getYear() != null) {
                years.merge(entry.getYear(), 1, Integer::sum);
            }
            types.merge(entry.getEntryType(), 1, Integer::sum);
            String surname = entry.getFirstAuthorLastName();
            if (!surname.isEmpty()) {
                firstAuthors.merge(surname, 1, Integer::sum);
            }
            String journal = entry.getJournal();
            if (!journal.isEmpty()) {
                journals.merge(journal, 1, Integer::sum);
            }
        }
        return new CitationReport(
                citations.size(), resolved, unresolved, unused, typeCounts, years, types, firstAuthors, journals);
    }
}
