package com.infocode.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Packs textual bitstrings into bytes and back.
 *
 * Bits are written most significant first and the last byte is padded with
 * zeros. The bit length travels with the bytes, so unpacking is exact.
 */
public final class BitPacking {

    private BitPacking() {
    }

    /**
     * Pack a string of 0 and 1 characters.
     *
     * @throws IllegalArgumentException on any other character
     */
    public static PackedBits pack(CharSequence bits) {
        byte[] bytes = new byte[(bits.length() + 7) / 8];
        int currentByte = 0;
        int numBitsFilled = 0;
        int index = 0;

        for (int i = 0; i < bits.length(); i++) {
            char c = bits.charAt(i);
            int bit;
            if (c == '0') {
                bit = 0;
            } else if (c == '1') {
                bit = 1;
            } else {
                throw new IllegalArgumentException("Invalid character in bit string: " + c);
            }

            currentByte = (currentByte << 1) | bit;
            numBitsFilled++;

            if (numBitsFilled == 8) {
                bytes[index++] = (byte) currentByte;
                numBitsFilled = 0;
                currentByte = 0;
            }
        }

        if (numBitsFilled > 0) {
            currentByte <<= (8 - numBitsFilled); // Pad with zeros
            bytes[index] = (byte) currentByte;
        }
        return new PackedBits(bytes, bits.length());
    }

    /**
     * Restore the exact bitstring that was packed.
     */
    public static String unpack(PackedBits packed) {
        StringBuilder sb = new StringBuilder(packed.getBitLength());
        byte[] bytes = packed.getBytes();
        for (int i = 0; i < packed.getBitLength(); i++) {
            int bit = (bytes[i >>> 3] >> (7 - (i & 7))) & 1;
            sb.append(bit == 1 ? '1' : '0');
        }
        return sb.toString();
    }

    /**
     * Bytes plus the number of meaningful bits in them.
     */
    public static final class PackedBits {
        private final byte[] bytes;
        private final int bitLength;

        public PackedBits(byte[] bytes, int bitLength) {
            Objects.requireNonNull(bytes, "bytes");
            if (bitLength < 0 || bitLength > bytes.length * 8L) {
                throw new IllegalArgumentException(
                    "Bit length " + bitLength + " does not fit in " + bytes.length + " bytes");
            }
            this.bytes = bytes.clone();
            this.bitLength = bitLength;
        }

        public byte[] getBytes() {
            return bytes.clone();
        }

        public int getBitLength() {
            return bitLength;
        }

        public int getByteLength() {
            return bytes.length;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof PackedBits)) return false;
            PackedBits other = (PackedBits) o;
            return bitLength == other.bitLength && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(bytes) + bitLength;
        }
    }
}
