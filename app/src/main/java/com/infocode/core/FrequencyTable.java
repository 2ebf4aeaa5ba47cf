package com.infocode.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Occurrence counts per symbol.
 *
 * Symbols are kept in the order they were first seen. That order is the
 * tie-breaker for every ranking derived from the table, so builders and
 * filters that use {@link #ranked()} are deterministic.
 *
 * @param <S> symbol type
 */
public final class FrequencyTable<S> {

    private final Map<S, Long> counts;
    private final long total;

    private FrequencyTable(Map<S, Long> counts) {
        this.counts = Collections.unmodifiableMap(counts);
        long sum = 0;
        for (long c : counts.values()) {
            sum += c;
        }
        this.total = sum;
    }

    /**
     * Count every symbol of a sequence.
     *
     * @param sequence Input symbols
     * @return Table with one entry per distinct symbol, in first-seen order
     */
    public static <S> FrequencyTable<S> of(Iterable<S> sequence) {
        Objects.requireNonNull(sequence, "sequence");
        Map<S, Long> counts = new LinkedHashMap<>();
        for (S symbol : sequence) {
            counts.merge(Objects.requireNonNull(symbol, "symbol"), 1L, Long::sum);
        }
        return new FrequencyTable<>(counts);
    }

    /**
     * Wrap explicit counts. Iteration order of the given map becomes the first-seen order.
     *
     * @throws IllegalArgumentException if any count is not positive
     */
    public static <S> FrequencyTable<S> fromCounts(Map<S, ? extends Number> counts) {
        Objects.requireNonNull(counts, "counts");
        Map<S, Long> copy = new LinkedHashMap<>();
        for (Map.Entry<S, ? extends Number> entry : counts.entrySet()) {
            long count = entry.getValue().longValue();
            if (count <= 0) {
                throw new IllegalArgumentException(
                    "Count for symbol " + entry.getKey() + " must be positive: " + count);
            }
            copy.put(Objects.requireNonNull(entry.getKey(), "symbol"), count);
        }
        return new FrequencyTable<>(copy);
    }

    public long count(S symbol) {
        return counts.getOrDefault(symbol, 0L);
    }

    public long total() {
        return total;
    }

    public int distinctCount() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public boolean contains(S symbol) {
        return counts.containsKey(symbol);
    }

    /**
     * Distinct symbols in first-seen order.
     */
    public Set<S> symbols() {
        return counts.keySet();
    }

    /**
     * Read-only view of the counts, in first-seen order.
     */
    public Map<S, Long> asMap() {
        return counts;
    }

    /**
     * Probability of a symbol, or 0 for an empty table.
     */
    public double probability(S symbol) {
        if (total == 0) return 0;
        return (double) count(symbol) / total;
    }

    /**
     * Symbols ordered by count, highest first. Equal counts keep first-seen order.
     */
    public List<S> ranked() {
        List<S> ranking = new ArrayList<>(counts.keySet());
        // List.sort is stable, so ties stay in insertion order
        ranking.sort(Comparator.comparingLong((S s) -> counts.get(s)).reversed());
        return ranking;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrequencyTable)) return false;
        return counts.equals(((FrequencyTable<?>) o).counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return "FrequencyTable" + counts;
    }
}
