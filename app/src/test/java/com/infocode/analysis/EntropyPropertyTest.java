package com.infocode.analysis;

import com.infocode.core.FrequencyTable;
import net.jqwik.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

/**
 * Property-based tests for entropy bounds.
 */
class EntropyPropertyTest {
    
    @Property
    void entropyShouldBeZeroOnlyForDegenerateAlphabets(@ForAll("frequencies") Map<String, Long> counts) {
        FrequencyTable<String> table = FrequencyTable.fromCounts(counts);
        double entropy = EntropyAnalyzer.entropy(table);
        
        assertTrue(entropy >= 0);
        assertEquals(table.distinctCount() <= 1, entropy == 0.0);
    }
    
    @Property
    void entropyShouldNotExceedUniformCodeLength(@ForAll("frequencies") Map<String, Long> counts) {
        FrequencyTable<String> table = FrequencyTable.fromCounts(counts);
        double codeLength = EntropyAnalyzer.idealCodeLength(table.distinctCount());
        
        assertTrue(EntropyAnalyzer.entropy(table) <= codeLength + 1e-9);
        double redundancy = EntropyAnalyzer.redundancy(EntropyAnalyzer.entropy(table), codeLength);
        assertTrue(redundancy >= -1e-9 && redundancy <= 1);
    }
    
    @Provide
    Arbitrary<Map<String, Long>> frequencies() {
        return Arbitraries.maps(
                Arbitraries.strings().withCharRange('a', 'z').ofLength(1),
                Arbitraries.longs().between(1, 10_000))
            .ofMinSize(0).ofMaxSize(26);
    }
}
