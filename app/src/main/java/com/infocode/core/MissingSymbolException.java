package com.infocode.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Raised when a sequence contains symbols that have no codeword in the codec.
 */
public class MissingSymbolException extends CodingException {
    
    private final Set<?> missingSymbols;
    
    public MissingSymbolException(Set<?> missingSymbols) {
        super("Missing symbols: " + missingSymbols);
        this.missingSymbols = Collections.unmodifiableSet(new LinkedHashSet<>(missingSymbols));
    }
    
    /**
     * Symbols without a codeword, in the order they first appeared in the input.
     */
    public Set<?> getMissingSymbols() {
        return missingSymbols;
    }
}
