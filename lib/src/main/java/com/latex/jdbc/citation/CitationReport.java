package com.latex.jdbc.citation;

import com.latex.jdbc.bibtex.BibEntry;
import com.latex.jdbc.bibtex.BibEntryType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Result of joining citations against a bibliography. Every cited key is either resolved or
 * unresolved; distributions count each resolved entry once, however often it is cited.
 */
public final class CitationReport {
    private final int totalCitations;
    private final Map<String, BibEntry> resolved;
    private final List<String> unresolvedKeys;
    private final List<BibEntry> unusedEntries;
    private final Map<CitationType, Integer> citationTypeCounts;
    private final SortedMap<Integer, Integer> yearDistribution;
    private final Map<BibEntryType, Integer> entryTypeDistribution;
    private final SortedMap<String, Integer> firstAuthorDistribution;
    private final SortedMap<String, Integer> journalDistribution;

    CitationReport(
            int totalCitations,
            Map<String, BibEntry> resolved,
            List<String> unresolvedKeys,
            List<BibEntry> unusedEntries,
            Map<CitationType, Integer> citationTypeCounts,
            Map<Integer, Integer> yearDistribution,
            Map<BibEntryType, Integer> entryTypeDistribution,
            Map<String, Integer> firstAuthorDistribution,
            Map<String, Integer> journalDistribution) {
        this.totalCitations = totalCitations;
        this.resolved = Collections.unmodifiableMap(new LinkedHashMap<>(resolved));
        this.unresolvedKeys = List.copyOf(unresolvedKeys);
        this.unusedEntries = List.copyOf(unusedEntries);
        this.citationTypeCounts = Collections.unmodifiableMap(copyOf(citationTypeCounts, CitationType.class));
        this.yearDistribution = Collections.unmodifiableSortedMap(new TreeMap<>(yearDistribution));
        this.entryTypeDistribution = Collections.unmodifiableMap(copyOf(entryTypeDistribution, BibEntryType.class));
        this.firstAuthorDistribution = Collections.unmodifiableSortedMap(new TreeMap<>(firstAuthorDistribution));
        this.journalDistribution = Collections.unmodifiableSortedMap(new TreeMap<>(journalDistribution));
    }

    private static <E extends Enum<E>> Map<E, Integer> copyOf(Map<E, Integer> source, Class<E> type) {
        Map<E, Integer> copy = new EnumMap<>(type);
        copy.putAll(source);
        return copy;
    }

    /** Number of citation commands, not keys. */
    public int getTotalCitations() {
        return totalCitations;
    }

    /** Resolved keys in first-cited order. */
    public Map<String, BibEntry> getResolved() {
        return resolved;
    }

    /** Cited keys missing from the bibliography, in first-cited order. */
    public List<String> getUnresolvedKeys() {
        return unresolvedKeys;
    }

    /** Bibliography entries never cited, in bibliography order. */
    public List<BibEntry> getUnusedEntries() {
        return unusedEntries;
    }

    public Map<CitationType, Integer> getCitationTypeCounts() {
        return citationTypeCounts;
    }

    public SortedMap<Integer, Integer> getYearDistribution() {
        return yearDistribution;
    }

    public Map<BibEntryType, Integer> getEntryTypeDistribution() {
        return entryTypeDistribution;
    }

    public SortedMap<String, Integer> getFirstAuthorDistribution() {
        return firstAuthorDistribution;
    }

    public SortedMap<String, Integer> getJournalDistribution() {
        return journalDistribution;
    }

    /** resolved / (resolved + unresolved) over distinct keys; 0 when nothing is cited. */
    public double getResolutionRate() {
        int attempted = resolved.size() + unresolvedKeys.size();
        return attempted == 0 ? 0.0 : (double) resolved.size() / attempted;
    }
}
