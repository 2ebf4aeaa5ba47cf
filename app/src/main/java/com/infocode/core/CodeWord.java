package com.infocode.core;

import java.util.Objects;

/**
 * A non-empty sequence of binary digits assigned to one symbol.
 */
public final class CodeWord {
    
    private final String bits;
    
    private CodeWord(String bits) {
        this.bits = bits;
    }
    
    /**
     * Create a codeword from its textual form, e.g. "0110".
     * 
     * @throws IllegalArgumentException if the text is empty or has characters other than 0 and 1
     */
    public static CodeWord of(String bits) {
        Objects.requireNonNull(bits, "bits");
        if (bits.isEmpty()) {
            throw new IllegalArgumentException("Codeword must not be empty");
        }
        for (int i = 0; i < bits.length(); i++) {
            char c = bits.charAt(i);
            if (c != '0' && c != '1') {
                throw new IllegalArgumentException("Invalid character in bit string: " + c);
            }
        }
        return new CodeWord(bits);
    }
    
    public int length() {
        return bits.length();
    }
    
    /**
     * Bit at a position, 0 or 1.
     */
    public int bitAt(int index) {
        return bits.charAt(index) - '0';
    }
    
    /**
     * True if this codeword is a proper or equal prefix of the other.
     */
    public boolean isPrefixOf(CodeWord other) {
        return other.bits.startsWith(bits);
    }
    
    public String bits() {
        return bits;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodeWord)) return false;
        return bits.equals(((CodeWord) o).bits);
    }
    
    @Override
    public int hashCode() {
        return bits.hashCode();
    }
    
    @Override
    public String toString() {
        return bits;
    }
}
