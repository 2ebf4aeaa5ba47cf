package com.infocode.service;

import com.infocode.analysis.EntropyAnalyzer;
import com.infocode.analysis.FilterMode;
import com.infocode.analysis.FilterResult;
import com.infocode.analysis.FrequencyFilter;
import com.infocode.config.AppConfig;
import com.infocode.core.BitPacking;
import com.infocode.core.CodeBuilder;
import com.infocode.core.Codec;
import com.infocode.core.FrequencyTable;
import com.infocode.core.PrefixCodec;
import com.infocode.core.SymbolDecoder;
import com.infocode.core.TokenMode;
import com.infocode.model.AnalysisReport;
import com.infocode.model.CodingReport;
import com.infocode.model.EntropyReport;
import com.infocode.model.FilterReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the analysis steps for one text: frequencies, entropy, code
 * construction, encode, decode and round-trip check.
 *
 * Holds no state between calls, so one instance can serve concurrent analyses.
 */
public class AnalysisService {
    
    private static final Logger logger = LoggerFactory.getLogger(AnalysisService.class);
    
    private final boolean failOnRoundTripMismatch;
    
    public AnalysisService(AppConfig config) {
        this(config.isVerifyRoundTrip());
    }
    
    /**
     * @param failOnRoundTripMismatch Throw instead of only reporting when decoding
     *        does not reproduce the input
     */
    public AnalysisService(boolean failOnRoundTripMismatch) {
        this.failOnRoundTripMismatch = failOnRoundTripMismatch;
    }
    
    /**
     * Full analysis: entropy statistics plus one coding report per algorithm.
     * Coding is skipped for an alphabet of at most one symbol.
     */
    public AnalysisReport analyze(String text, TokenMode mode, List<CodingAlgorithm> algorithms) {
        List<String> symbols = mode.tokenize(text);
        FrequencyTable<String> frequencies = FrequencyTable.of(symbols);
        EntropyReport entropyReport = entropyReport(mode, frequencies);
        
        List<CodingReport> codingReports = new ArrayList<>();
        if (entropyReport.isDegenerate()) {
            logger.info("Degenerate alphabet ({} distinct symbols), skipping code construction",
                frequencies.distinctCount());
        } else {
            for (CodingAlgorithm algorithm : algorithms) {
                codingReports.add(code(text, mode, symbols, frequencies, algorithm));
            }
        }
        return new AnalysisReport(entropyReport, codingReports);
    }
    
    /**
     * Frequencies, entropy, uniform code length and redundancy of a text.
     */
    public EntropyReport analyzeEntropy(String text, TokenMode mode) {
        return entropyReport(mode, FrequencyTable.of(mode.tokenize(text)));
    }
    
    /**
     * Code a text with one algorithm.
     * 
     * @return Empty when the alphabet is degenerate and no code is built
     */
    public Optional<CodingReport> code(String text, TokenMode mode, CodingAlgorithm algorithm) {
        List<String> symbols = mode.tokenize(text);
        FrequencyTable<String> frequencies = FrequencyTable.of(symbols);
        if (frequencies.distinctCount() <= 1) {
            return Optional.empty();
        }
        return Optional.of(code(text, mode, symbols, frequencies, algorithm));
    }
    
    /**
     * Remove the most or least frequent characters and report the entropy change.
     */
    public FilterReport filter(String text, FilterMode filterMode, double fraction) {
        List<String> symbols = TokenMode.UNIGRAM.tokenize(text);
        double baseline = EntropyAnalyzer.entropy(FrequencyTable.of(symbols));
        
        FilterResult<String> result = FrequencyFilter.removeByFrequency(symbols, filterMode, fraction);
        String filteredText = TokenMode.UNIGRAM.detokenize(result.filtered());
        double filteredEntropy = result.entropy();
        
        logger.info("Filter {} {}: removed {}, entropy {} -> {}", filterMode, fraction,
            result.removed(), baseline, filteredEntropy);
        return new FilterReport(filterMode, fraction, filteredText, result.removed(), baseline, filteredEntropy);
    }
    
    private EntropyReport entropyReport(TokenMode mode, FrequencyTable<String> frequencies) {
        double entropy = EntropyAnalyzer.entropy(frequencies);
        double codeLength = EntropyAnalyzer.idealCodeLength(frequencies.distinctCount());
        double redundancy = EntropyAnalyzer.redundancy(entropy, codeLength);
        
        logger.info("Entropy ({}): {} symbols, {} distinct, H={}, L={}, R={}", mode.getConfigName(),
            frequencies.total(), frequencies.distinctCount(), entropy, codeLength, redundancy);
        return new EntropyReport(mode, frequencies, entropy, codeLength, redundancy);
    }
    
    private CodingReport code(String text, TokenMode mode, List<String> symbols,
                              FrequencyTable<String> frequencies, CodingAlgorithm algorithm) {
        CodeBuilder builder = algorithm.createBuilder();
        
        Codec<String> codec = builder.build(frequencies);
        Optional<SymbolDecoder<String>> structuralDecoder = builder.buildDecoder(frequencies);
        
        String encoded = PrefixCodec.encode(symbols, codec);
        List<String> decodedSymbols = PrefixCodec.decode(encoded, codec);
        String decoded = mode.detokenize(decodedSymbols);
        
        boolean roundTripOk = decoded.equals(text);
        if (structuralDecoder.isPresent() && !structuralDecoder.get().decode(encoded).equals(decodedSymbols)) {
            logger.warn("{}: structural decode and table decode disagree", builder.getName());
            roundTripOk = false;
        }
        if (!roundTripOk) {
            logger.warn("{}: decoded text does not match input ({} vs {} chars)",
                builder.getName(), decoded.length(), text.length());
            if (failOnRoundTripMismatch) {
                throw new IllegalStateException(builder.getName() + " round trip failed");
            }
        }
        
        double entropy = EntropyAnalyzer.entropy(frequencies);
        double averageLength = PrefixCodec.averageCodeLength(codec, frequencies);
        double efficiency = PrefixCodec.codingEfficiency(entropy, averageLength);
        
        int packedBytes = BitPacking.pack(encoded).getByteLength();
        
        CodingReport report = new CodingReport(builder.getName(), codec, encoded, decoded, roundTripOk,
            averageLength, efficiency, text.codePointCount(0, text.length()), packedBytes);
        logger.info("{}", report);
        return report;
    }
}
