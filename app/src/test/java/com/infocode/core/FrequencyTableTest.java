package com.infocode.core;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unit tests for frequency tables.
 */
class FrequencyTableTest {
    
    @Test
    void testCountsAbracadabra() {
        FrequencyTable<String> table = FrequencyTable.of(TokenMode.UNIGRAM.tokenize("abracadabra"));
        
        assertEquals(11, table.total());
        assertEquals(5, table.distinctCount());
        assertEquals(5, table.count("a"));
        assertEquals(2, table.count("b"));
        assertEquals(2, table.count("r"));
        assertEquals(1, table.count("c"));
        assertEquals(1, table.count("d"));
        assertEquals(0, table.count("z"));
    }
    
    @Test
    void testSymbolsKeepFirstSeenOrder() {
        FrequencyTable<String> table = FrequencyTable.of(TokenMode.UNIGRAM.tokenize("abracadabra"));
        
        assertEquals(List.of("a", "b", "r", "c", "d"), List.copyOf(table.symbols()));
    }
    
    @Test
    void testRankedBreaksTiesByFirstSeen() {
        FrequencyTable<String> table = FrequencyTable.of(TokenMode.UNIGRAM.tokenize("cbbcaad"));
        
        // c, b and a all occur twice; c was seen first
        assertEquals(List.of("c", "b", "a", "d"), table.ranked());
    }
    
    @Test
    void testProbability() {
        FrequencyTable<String> table = FrequencyTable.of(List.of("x", "y", "x", "x"));
        
        assertEquals(0.75, table.probability("x"), 1e-12);
        assertEquals(0.25, table.probability("y"), 1e-12);
    }
    
    @Test
    void testEmptyTable() {
        FrequencyTable<String> table = FrequencyTable.of(List.of());
        
        assertTrue(table.isEmpty());
        assertEquals(0, table.total());
        assertEquals(0, table.probability("a"));
        assertTrue(table.ranked().isEmpty());
    }
    
    @Test
    void testFromCountsRejectsNonPositive() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("a", 3);
        counts.put("b", 0);
        
        assertThrows(IllegalArgumentException.class, () -> FrequencyTable.fromCounts(counts));
    }
    
    @Test
    void testFromCountsMatchesCountedTable() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("a", 2);
        counts.put("b", 1);
        
        assertEquals(FrequencyTable.of(List.of("a", "b", "a")), FrequencyTable.fromCounts(counts));
    }
}
