package com.infocode.service;

import com.infocode.core.CodeBuilder;
import com.infocode.core.HuffmanBuilder;
import com.infocode.core.ShannonFanoBuilder;

import java.util.Locale;

/**
 * Prefix-code construction algorithms available to an analysis.
 */
public enum CodingAlgorithm {
    
    HUFFMAN("huffman"),
    SHANNON_FANO("shannon-fano");
    
    private final String configName;
    
    CodingAlgorithm(String configName) {
        this.configName = configName;
    }
    
    public String getConfigName() {
        return configName;
    }
    
    /**
     * Create a builder for this algorithm.
     */
    public CodeBuilder createBuilder() {
        switch (this) {
            case HUFFMAN:
                return new HuffmanBuilder();
            case SHANNON_FANO:
                return new ShannonFanoBuilder();
            default:
                throw new IllegalStateException("Unknown algorithm: " + this);
        }
    }
    
    public static CodingAlgorithm fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (CodingAlgorithm algorithm : values()) {
            if (algorithm.configName.equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown coding algorithm: " + name);
    }
}
