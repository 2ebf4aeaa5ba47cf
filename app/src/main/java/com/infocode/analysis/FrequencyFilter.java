package com.infocode.analysis;

import com.infocode.core.FrequencyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops the most or least frequent symbols from a sequence.
 */
public final class FrequencyFilter {
    
    private static final Logger logger = LoggerFactory.getLogger(FrequencyFilter.class);
    
    private FrequencyFilter() {
    }
    
    /**
     * Remove a fraction of the distinct symbols, picked from one end of the
     * count ranking (ties keep first-seen order).
     * 
     * <p>The number removed is {@code max(1, round(fraction * distinct))},
     * rounding half to even and capped at the number of distinct symbols.
     * Retained symbols keep their order and multiplicity.
     * 
     * @param sequence Input symbols
     * @param mode TOP removes the highest counts, BOTTOM the lowest
     * @param fraction Share of distinct symbols to remove, finite and not negative
     * @return Filtered sequence and removed symbols; unchanged input and an
     *         empty set if the sequence is empty
     */
    public static <S> FilterResult<S> removeByFrequency(List<S> sequence, FilterMode mode, double fraction) {
        if (Double.isNaN(fraction) || Double.isInfinite(fraction) || fraction < 0) {
            throw new IllegalArgumentException("Fraction must be finite and not negative: " + fraction);
        }
        
        FrequencyTable<S> frequencies = FrequencyTable.of(sequence);
        if (frequencies.isEmpty()) {
            return new FilterResult<>(new ArrayList<>(sequence), new LinkedHashSet<>());
        }
        
        int distinct = frequencies.distinctCount();
        int removeCount = removeCount(fraction, distinct);
        List<S> ranked = frequencies.ranked();
        List<S> picked = (mode == FilterMode.TOP)
            ? ranked.subList(0, removeCount)
            : ranked.subList(distinct - removeCount, distinct);
        Set<S> toRemove = new LinkedHashSet<>(picked);
        
        List<S> filtered = new ArrayList<>(sequence.size());
        for (S symbol : sequence) {
            if (!toRemove.contains(symbol)) {
                filtered.add(symbol);
            }
        }
        
        logger.debug("Removed {} of {} symbols ({}): {}", removeCount, distinct, mode, toRemove);
        return new FilterResult<>(filtered, toRemove);
    }
    
    static int removeCount(double fraction, int distinct) {
        long rounded = (long) Math.rint(fraction * distinct);
        return (int) Math.min(distinct, Math.max(1, rounded));
    }
}
