package com.infocode.model;

import com.infocode.core.FrequencyTable;
import com.infocode.core.TokenMode;

import java.util.Locale;
import java.util.Map;

/**
 * Frequency and entropy statistics of one tokenized text.
 */
public class EntropyReport {
    
    private final TokenMode tokenMode;
    private final FrequencyTable<String> frequencies;
    private final double entropy;
    private final double idealCodeLength;
    private final double redundancy;
    
    public EntropyReport(TokenMode tokenMode, FrequencyTable<String> frequencies,
                         double entropy, double idealCodeLength, double redundancy) {
        this.tokenMode = tokenMode;
        this.frequencies = frequencies;
        this.entropy = entropy;
        this.idealCodeLength = idealCodeLength;
        this.redundancy = redundancy;
    }
    
    public TokenMode getTokenMode() {
        return tokenMode;
    }
    
    public FrequencyTable<String> getFrequencies() {
        return frequencies;
    }
    
    public double getEntropy() {
        return entropy;
    }
    
    public double getIdealCodeLength() {
        return idealCodeLength;
    }
    
    public double getRedundancy() {
        return redundancy;
    }
    
    /**
     * True when the alphabet has at most one symbol: every statistic is 0 and no code is built.
     */
    public boolean isDegenerate() {
        return frequencies.distinctCount() <= 1;
    }
    
    /**
     * Get formatted summary for display.
     */
    public String getSummary(int precision) {
        String number = "%." + precision + "f";
        StringBuilder sb = new StringBuilder();
        sb.append("Frequencies (").append(tokenMode.getConfigName()).append("):\n");
        for (Map.Entry<String, Long> entry : frequencies.asMap().entrySet()) {
            sb.append(" * ").append(ReportFormat.visible(entry.getKey()))
              .append(": ").append(entry.getValue()).append('\n');
        }
        sb.append("Entropy: ").append(String.format(Locale.ROOT, number, entropy)).append(" bits/symbol\n");
        sb.append("Uniform code length: ").append(String.format(Locale.ROOT, number, idealCodeLength)).append(" bits\n");
        sb.append("Redundancy: ").append(String.format(Locale.ROOT, number, redundancy)).append('\n');
        return sb.toString();
    }
    
    @Override
    public String toString() {
        return String.format(Locale.ROOT, "EntropyReport[%s, %d symbols, H=%.4f, L=%.4f, R=%.4f]",
            tokenMode.getConfigName(), frequencies.distinctCount(), entropy, idealCodeLength, redundancy);
    }
}
