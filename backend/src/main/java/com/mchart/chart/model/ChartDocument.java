package com.mchart.chart.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mchart.chart.error.ChartValidationException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A fully assembled chart. Entries are ascending by rank; equal ranks keep discovery order.
 */
public record ChartDocument(
    @JsonProperty("descriptor") ChartDescriptor descriptor,
    @JsonProperty("published_date") LocalDate publishedDate,
    @JsonProperty("kind") ChartKind kind,
    @JsonProperty("entries") List<ChartEntry> entries
) {
    public ChartDocument {
        if (descriptor == null) {
            throw new ChartValidationException("Chart document requires a descriptor");
        }
        if (publishedDate == null) {
            throw new ChartValidationException("Chart document requires a published date");
        }
        if (kind == null) {
            throw new ChartValidationException("Chart document requires a kind");
        }
        if (kind != descriptor.kind()) {
            throw new ChartValidationException(
                "Chart kind " + kind.tag() + " does not match descriptor kind " + descriptor.kind().tag()
            );
        }
        entries = entries == null ? List.of() : List.copyOf(entries);
        EntryKind expected = kind.entryKind();
        int previousRank = 0;
        for (ChartEntry entry : entries) {
            if (entry.kind() != expected) {
                throw new ChartValidationException(
                    "Entry at rank " + entry.rank() + " is a " + entry.kind().tag() + " on a " + kind.tag() + " chart"
                );
            }
            if (entry.rank() < previousRank) {
                throw new ChartValidationException(
                    "Entries out of rank order: " + entry.rank() + " after " + previousRank
                );
            }
            previousRank = entry.rank();
        }
    }

    @JsonIgnore
    public int totalEntries() {
        return entries.size();
    }

    public List<ChartEntry> top(int n) {
        if (n <= 0) {
            return List.of();
        }
        return entries.subList(0, Math.min(n, entries.size()));
    }

    public List<ChartEntry> findByArtist(String artist) {
        if (artist == null || artist.isBlank()) {
            return List.of();
        }
        String needle = artist.toLowerCase(Locale.ROOT);
        List<ChartEntry> matches = new ArrayList<>();
        for (ChartEntry entry : entries) {
            if (entry.primaryArtist().toLowerCase(Locale.ROOT).contains(needle)
                || entry.artists().stream().anyMatch(a -> a.toLowerCase(Locale.ROOT).contains(needle))) {
                matches.add(entry);
            }
        }
        return matches;
    }

    public List<ChartEntry> findByTitle(String title) {
        if (title == null || title.isBlank()) {
            return List.of();
        }
        String needle = title.toLowerCase(Locale.ROOT);
        return entries.stream()
            .filter(entry -> entry.title().toLowerCase(Locale.ROOT).contains(needle))
            .toList();
    }
}
