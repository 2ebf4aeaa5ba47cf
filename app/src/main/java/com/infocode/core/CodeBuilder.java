package com.infocode.core;

import java.util.Optional;

/**
 * Builds a prefix-free codec from symbol frequencies.
 */
public interface CodeBuilder {
    
    /**
     * Build a codec covering every symbol in the table.
     * 
     * @param frequencies Symbol counts
     * @return Prefix-free codec
     * @throws InvalidInputException if the table is empty
     */
    <S> Codec<S> build(FrequencyTable<S> frequencies);
    
    /**
     * Build a decoder that walks the structure the code came from, so table
     * lookups can be cross-checked against it. Empty when the builder keeps
     * no such structure.
     */
    default <S> Optional<SymbolDecoder<S>> buildDecoder(FrequencyTable<S> frequencies) {
        return Optional.empty();
    }
    
    /**
     * Get algorithm name.
     */
    String getName();
}
