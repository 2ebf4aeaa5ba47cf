package com.infocode.core;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

/**
 * Unit tests for packing bitstrings into bytes.
 */
class BitPackingTest {
    
    @Test
    void testPackPartialByte() {
        BitPacking.PackedBits packed = BitPacking.pack("101");
        
        assertEquals(3, packed.getBitLength());
        assertArrayEquals(new byte[] {(byte) 0xA0}, packed.getBytes());
    }
    
    @Test
    void testPackFullBytes() {
        BitPacking.PackedBits packed = BitPacking.pack("1111111100000001");
        
        assertArrayEquals(new byte[] {(byte) 0xFF, 0x01}, packed.getBytes());
    }
    
    @Test
    void testEmpty() {
        BitPacking.PackedBits packed = BitPacking.pack("");
        
        assertEquals(0, packed.getByteLength());
        assertEquals("", BitPacking.unpack(packed));
    }
    
    @Test
    void testUnpackDropsPadding() {
        assertEquals("0000001", BitPacking.unpack(BitPacking.pack("0000001")));
    }
    
    @Test
    void testPackedEncodingStillDecodes() {
        List<String> symbols = TokenMode.UNIGRAM.tokenize("abracadabra");
        Codec<String> codec = new HuffmanBuilder().build(FrequencyTable.of(symbols));
        String encoded = PrefixCodec.encode(symbols, codec);
        
        BitPacking.PackedBits packed = BitPacking.pack(encoded);
        
        assertEquals(3, packed.getByteLength());
        assertEquals(symbols, PrefixCodec.decode(BitPacking.unpack(packed), codec));
    }
    
    @Test
    void testInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> BitPacking.pack("10a"));
        assertThrows(IllegalArgumentException.class, () -> new BitPacking.PackedBits(new byte[1], 9));
    }
}
