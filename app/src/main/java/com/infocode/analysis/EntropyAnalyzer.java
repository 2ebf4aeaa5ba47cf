package com.infocode.analysis;

import com.infocode.core.FrequencyTable;

/**
 * Shannon entropy and uniform-code statistics of a frequency table.
 */
public final class EntropyAnalyzer {
    
    private static final double LN_2 = Math.log(2);
    
    private EntropyAnalyzer() {
    }
    
    /**
     * Shannon entropy in bits per symbol, the sum of -p log2 p.
     * 
     * @return 0 for an empty table or a single distinct symbol, otherwise a positive value
     */
    public static double entropy(FrequencyTable<?> frequencies) {
        long total = frequencies.total();
        if (total == 0 || frequencies.distinctCount() <= 1) {
            return 0.0;
        }
        
        double entropy = 0.0;
        for (long count : frequencies.asMap().values()) {
            double probability = (double) count / total;
            entropy -= probability * log2(probability);
        }
        return entropy;
    }
    
    /**
     * Bits per symbol of a fixed-length code for the alphabet: log2(size),
     * or 0 when the alphabet has at most one symbol.
     */
    public static double idealCodeLength(int alphabetSize) {
        if (alphabetSize <= 1) return 0.0;
        return log2(alphabetSize);
    }
    
    /**
     * Fraction of a fixed-length code that is wasted: 1 - entropy / codeLength.
     * Returns 0 for a non-positive code length (degenerate alphabet).
     */
    public static double redundancy(double entropy, double codeLength) {
        if (codeLength <= 0) return 0.0;
        return 1 - entropy / codeLength;
    }
    
    static double log2(double x) {
        return Math.log(x) / LN_2;
    }
}
