package com.rally.leaguesync.service;

import com.rally.leaguesync.util.NameNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory index of one league's team names, built once per run and extended as teams are created.
 * Lookups use normalized names (collapsed whitespace, lower case).
 */
public class TeamIndex {

    private static final String PREFIX_SEPARATORS = " -(";

    private record Entry(Long id, String normalizedName) {}

    private final Map<String, Long> byName = new HashMap<>();
    private final List<Entry> entries = new ArrayList<>();

    public void add(Long id, String teamName) {
        String normalized = NameNormalizer.normalize(teamName);
        if (id == null || normalized == null || normalized.isEmpty()) return;
        entries.add(new Entry(id, normalized));
        byName.merge(normalized, id, Math::min);
    }

    public int size() { return entries.size(); }

    public Optional<Long> exact(String normalizedName) {
        return Optional.ofNullable(byName.get(normalizedName));
    }

    /** Team whose name extends {@code normalizedName} after a separator; shortest name, then lowest id. */
    public Optional<Long> prefix(String normalizedName) {
        int len = normalizedName.length();
        return entries.stream()
                .filter(e -> e.normalizedName().length() > len
                        && e.normalizedName().startsWith(normalizedName)
                        && PREFIX_SEPARATORS.indexOf(e.normalizedName().charAt(len)) >= 0)
                .min(Comparator.comparingInt((Entry e) -> e.normalizedName().length()).thenComparing(Entry::id))
                .map(Entry::id);
    }
}
