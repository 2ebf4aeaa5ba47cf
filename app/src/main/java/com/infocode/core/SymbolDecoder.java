package com.infocode.core;

import java.util.List;

/**
 * Turns a bitstring back into symbols.
 *
 * @param <S> symbol type
 */
public interface SymbolDecoder<S> {
    
    /**
     * @throws CorruptStreamException if the bits do not form a sequence of codewords
     */
    List<S> decode(CharSequence bits);
}
