package com.infocode.analysis;

import com.infocode.core.TokenMode;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;

/**
 * Unit tests for frequency-based symbol removal.
 */
class FrequencyFilterTest {
    
    private static List<String> chars(String text) {
        return TokenMode.UNIGRAM.tokenize(text);
    }
    
    private static String join(List<String> symbols) {
        return TokenMode.UNIGRAM.detokenize(symbols);
    }
    
    @Test
    void testRemoveTop() {
        FilterResult<String> result = FrequencyFilter.removeByFrequency(chars("aaabbbccd"), FilterMode.TOP, 0.34);
        
        // a and b both occur three times; a ranks first because it was seen first
        assertEquals(Set.of("a"), result.removed());
        assertEquals("bbbccd", join(result.filtered()));
    }
    
    @Test
    void testRemoveBottom() {
        FilterResult<String> result = FrequencyFilter.removeByFrequency(chars("aaabbbccd"), FilterMode.BOTTOM, 0.34);
        
        assertEquals(Set.of("d"), result.removed());
        assertEquals("aaabbbcc", join(result.filtered()));
    }
    
    @Test
    void testBottomTiesUseRankingOrder() {
        FilterResult<String> result = FrequencyFilter.removeByFrequency(chars("abcabc"), FilterMode.BOTTOM, 0.34);
        
        assertEquals(Set.of("c"), result.removed());
        assertEquals("abab", join(result.filtered()));
    }
    
    @Test
    void testRetainedOrderAndMultiplicity() {
        FilterResult<String> result = FrequencyFilter.removeByFrequency(chars("xaybxazx"), FilterMode.TOP, 0.2);
        
        assertEquals(Set.of("x"), result.removed());
        assertEquals(List.of("a", "y", "b", "a", "z"), result.filtered());
    }
    
    @Test
    void testAtLeastOneSymbolIsRemoved() {
        FilterResult<String> result = FrequencyFilter.removeByFrequency(chars("aab"), FilterMode.TOP, 0.0);
        
        assertEquals(Set.of("a"), result.removed());
        assertEquals("b", join(result.filtered()));
    }
    
    @Test
    void testSupplementaryCharacterIsOneSymbol() {
        String smile = "\uD83D\uDE00";
        FilterResult<String> result = FrequencyFilter.removeByFrequency(chars("aa" + smile), FilterMode.TOP, 0.2);
        
        assertEquals(Set.of("a"), result.removed());
        assertEquals(List.of(smile), result.filtered());
        assertEquals(smile, join(result.filtered()));
        assertEquals(0.0, result.entropy());
    }
    
    @Test
    void testRemoveCountRoundsHalfToEven() {
        assertEquals(1, FrequencyFilter.removeCount(0.34, 4));
        assertEquals(2, FrequencyFilter.removeCount(0.5, 5));   // 2.5 -> 2
        assertEquals(2, FrequencyFilter.removeCount(0.375, 4)); // 1.5 -> 2
        assertEquals(1, FrequencyFilter.removeCount(0.5, 1));   // 0.5 -> 0, then at least 1
        assertEquals(3, FrequencyFilter.removeCount(2.0, 3));   // capped at the alphabet size
    }
    
    @Test
    void testEmptySequence() {
        FilterResult<String> result = FrequencyFilter.removeByFrequency(List.<String>of(), FilterMode.TOP, 0.2);
        
        assertTrue(result.filtered().isEmpty());
        assertTrue(result.removed().isEmpty());
    }
    
    @Test
    void testInvalidFraction() {
        assertThrows(IllegalArgumentException.class,
            () -> FrequencyFilter.removeByFrequency(chars("abc"), FilterMode.TOP, -0.1));
        assertThrows(IllegalArgumentException.class,
            () -> FrequencyFilter.removeByFrequency(chars("abc"), FilterMode.TOP, Double.NaN));
    }
    
    @Test
    void testEntropyDelta() {
        FilterResult<String> result = FrequencyFilter.removeByFrequency(chars("aaabbbccd"), FilterMode.TOP, 0.34);
        double baseline = 1.8910611120726524;
        
        assertEquals(1.4591479170272446, result.entropy(), 1e-12);
        assertEquals(1.4591479170272446 - baseline, result.entropyDelta(baseline), 1e-12);
    }
    
    @Test
    void testFilterModeFromName() {
        assertEquals(FilterMode.BOTTOM, FilterMode.fromName("bottom"));
        assertThrows(IllegalArgumentException.class, () -> FilterMode.fromName("middle"));
    }
}
