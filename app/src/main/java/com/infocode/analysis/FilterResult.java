package com.infocode.analysis;

import com.infocode.core.FrequencyTable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Sequence left after removing symbols, and the symbols removed.
 *
 * @param <S> symbol type
 */
public final class FilterResult<S> {
    
    private final List<S> filtered;
    private final Set<S> removed;
    
    FilterResult(List<S> filtered, Set<S> removed) {
        this.filtered = Collections.unmodifiableList(filtered);
        this.removed = Collections.unmodifiableSet(new LinkedHashSet<>(removed));
    }
    
    public List<S> filtered() {
        return filtered;
    }
    
    /**
     * Removed symbols in ranking order.
     */
    public Set<S> removed() {
        return removed;
    }
    
    public double entropy() {
        return EntropyAnalyzer.entropy(FrequencyTable.of(filtered));
    }
    
    /**
     * Entropy of the filtered sequence minus the given baseline.
     */
    public double entropyDelta(double baselineEntropy) {
        return entropy() - baselineEntropy;
    }
}
