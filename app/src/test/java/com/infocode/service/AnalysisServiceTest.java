package com.infocode.service;

import com.infocode.analysis.FilterMode;
import com.infocode.core.TokenMode;
import com.infocode.model.AnalysisReport;
import com.infocode.model.CodingReport;
import com.infocode.model.EntropyReport;
import com.infocode.model.FilterReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;

/**
 * Tests for the end-to-end analysis pipeline.
 */
class AnalysisServiceTest {
    
    private static final List<CodingAlgorithm> BOTH =
        List.of(CodingAlgorithm.HUFFMAN, CodingAlgorithm.SHANNON_FANO);
    
    private AnalysisService service;
    
    @BeforeEach
    void setUp() {
        service = new AnalysisService(true);
    }
    
    @Test
    void testUnigramAnalysis() {
        AnalysisReport report = service.analyze("abracadabra", TokenMode.UNIGRAM, BOTH);
        
        EntropyReport entropy = report.getEntropyReport();
        assertEquals(2.0403733936884962, entropy.getEntropy(), 1e-12);
        assertEquals(Math.log(5) / Math.log(2), entropy.getIdealCodeLength(), 1e-12);
        assertEquals(1 - entropy.getEntropy() / entropy.getIdealCodeLength(), entropy.getRedundancy(), 1e-12);
        
        assertEquals(2, report.getCodingReports().size());
        assertTrue(report.isAllRoundTripsOk());
        
        CodingReport huffman = report.getCodingReports().get(0);
        assertEquals("Huffman", huffman.getAlgorithmName());
        assertEquals(23.0 / 11, huffman.getAverageCodeLength(), 1e-9);
        assertEquals(entropy.getEntropy() / (23.0 / 11), huffman.getEfficiency(), 1e-9);
        assertEquals("abracadabra", huffman.getDecoded());
        assertEquals(3, huffman.getPackedBytes());
        
        CodingReport shannonFano = report.getCodingReports().get(1);
        assertEquals("Shannon-Fano", shannonFano.getAlgorithmName());
        assertEquals(24.0 / 11, shannonFano.getAverageCodeLength(), 1e-9);
        assertEquals(24, shannonFano.getEncodedBits());
    }
    
    @Test
    void testBigramAnalysis() {
        AnalysisReport report = service.analyze("abracadabra", TokenMode.BIGRAM, BOTH);
        
        assertEquals(10, report.getEntropyReport().getFrequencies().total());
        assertEquals(7, report.getEntropyReport().getFrequencies().distinctCount());
        for (CodingReport coding : report.getCodingReports()) {
            assertTrue(coding.isRoundTripOk(), coding.getAlgorithmName());
            assertEquals("abracadabra", coding.getDecoded());
        }
    }
    
    @Test
    void testDegenerateAlphabetSkipsCoding() {
        AnalysisReport report = service.analyze("aaaa", TokenMode.UNIGRAM, BOTH);
        
        assertTrue(report.getEntropyReport().isDegenerate());
        assertEquals(0.0, report.getEntropyReport().getEntropy());
        assertEquals(0.0, report.getEntropyReport().getIdealCodeLength());
        assertEquals(0.0, report.getEntropyReport().getRedundancy());
        assertTrue(report.getCodingReports().isEmpty());
        assertTrue(service.code("aaaa", TokenMode.UNIGRAM, CodingAlgorithm.HUFFMAN).isEmpty());
    }
    
    @Test
    void testEmptyText() {
        AnalysisReport report = service.analyze("", TokenMode.UNIGRAM, BOTH);
        
        assertEquals(0.0, report.getEntropyReport().getEntropy());
        assertTrue(report.getCodingReports().isEmpty());
    }
    
    @Test
    void testSupplementaryCharactersCountOnce() {
        String text = "a\uD83D\uDE00a\uD83D\uDE00b";
        AnalysisReport report = service.analyze(text, TokenMode.UNIGRAM, BOTH);
        
        assertEquals(5, report.getEntropyReport().getFrequencies().total());
        assertEquals(3, report.getEntropyReport().getFrequencies().distinctCount());
        for (CodingReport coding : report.getCodingReports()) {
            assertTrue(coding.isRoundTripOk(), coding.getAlgorithmName());
            assertEquals(text, coding.getDecoded());
            assertEquals(coding.getEncodedBits() / 5.0, coding.getBitsPerCharacter(), 1e-12);
        }
    }
    
    @Test
    void testSingleAlgorithm() {
        CodingReport report = service.code("mississippi", TokenMode.UNIGRAM, CodingAlgorithm.SHANNON_FANO)
            .orElseThrow();
        
        assertEquals("Shannon-Fano", report.getAlgorithmName());
        assertTrue(report.isRoundTripOk());
        assertEquals(report.getEncodedBits() / 11.0, report.getBitsPerCharacter(), 1e-12);
    }
    
    @Test
    void testFilter() {
        FilterReport report = service.filter("aaabbbccd", FilterMode.TOP, 0.34);
        
        assertEquals("bbbccd", report.getFilteredText());
        assertEquals(Set.of("a"), report.getRemoved());
        assertEquals(1.8910611120726524, report.getBaselineEntropy(), 1e-12);
        assertEquals(1.4591479170272446, report.getFilteredEntropy(), 1e-12);
        assertTrue(report.getEntropyDelta() < 0);
    }
}
