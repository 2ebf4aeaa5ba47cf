package com.infocode.core;

/**
 * Raised when a bitstring cannot be split into complete codewords.
 */
public class CorruptStreamException extends CodingException {
    
    private final long offset;
    private final String pendingBits;
    
    public CorruptStreamException(long offset, String pendingBits) {
        this(offset, pendingBits, "Unresolved trailing bits");
    }
    
    public CorruptStreamException(long offset, String pendingBits, String reason) {
        super(reason + ": offset=" + offset + ", pending=\"" + pendingBits + "\"");
        this.offset = offset;
        this.pendingBits = pendingBits;
    }
    
    /**
     * Bit position at which decoding gave up.
     */
    public long getOffset() {
        return offset;
    }
    
    /**
     * Bits that were buffered but never matched a codeword.
     */
    public String getPendingBits() {
        return pendingBits;
    }
}
