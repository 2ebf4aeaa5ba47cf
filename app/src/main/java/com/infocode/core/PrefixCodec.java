package com.infocode.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Encode and decode symbol sequences with any prefix-free {@link Codec}.
 *
 * Bitstrings are plain text made of '0' and '1'. For any sequence the codec
 * covers, {@code decode(encode(seq, codec), codec)} returns {@code seq}.
 */
public final class PrefixCodec {

    private static final Logger logger = LoggerFactory.getLogger(PrefixCodec.class);

    private PrefixCodec() {
    }

    /**
     * Concatenate the codeword of every symbol, in input order.
     *
     * @param sequence Symbols to encode
     * @param codec Codec covering every symbol of the sequence
     * @return Bitstring
     * @throws MissingSymbolException listing all symbols without a codeword
     */
    public static <S> String encode(List<S> sequence, Codec<S> codec) {
        Set<S> missing = new LinkedHashSet<>();
        for (S symbol : sequence) {
            if (!codec.contains(symbol)) {
                missing.add(symbol);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingSymbolException(missing);
        }

        StringBuilder sb = new StringBuilder();
        for (S symbol : sequence) {
            sb.append(codec.codeFor(symbol).bits());
        }
        logger.debug("Encoded {} symbols into {} bits", sequence.size(), sb.length());
        return sb.toString();
    }

    /**
     * Decode a bitstring bit by bit. After each bit the buffer is looked up in
     * the codec's inverse table; a hit emits the symbol and clears the buffer.
     * Prefix-freeness makes the first hit the only possible one.
     *
     * @throws CorruptStreamException if a character is not 0 or 1, or if bits are
     *         left over that do not form a codeword
     */
    public static <S> List<S> decode(CharSequence bits, Codec<S> codec) {
        List<S> decoded = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        int bufferStart = 0;
        int maxLength = codec.maxCodeLength();

        for (int i = 0; i < bits.length(); i++) {
            char c = bits.charAt(i);
            if (c != '0' && c != '1') {
                throw new CorruptStreamException(i, buffer.toString(), "Invalid character '" + c + "'");
            }
            buffer.append(c);

            S symbol = codec.symbolFor(buffer);
            if (symbol != null) {
                decoded.add(symbol);
                buffer.setLength(0);
                bufferStart = i + 1;
            } else if (buffer.length() >= maxLength) {
                // No codeword is this long, so nothing can match any more
                throw new CorruptStreamException(bufferStart, buffer.toString(), "No codeword matches");
            }
        }

        if (buffer.length() > 0) {
            throw new CorruptStreamException(bufferStart, buffer.toString());
        }
        return decoded;
    }

    /**
     * Expected bits per symbol: sum of p(s) * len(code(s)) over symbols present
     * in both the codec and the table. Returns 0 for an empty table.
     */
    public static <S> double averageCodeLength(Codec<S> codec, FrequencyTable<S> frequencies) {
        long total = frequencies.total();
        if (total == 0) return 0;

        double average = 0;
        for (Map.Entry<S, Long> entry : frequencies.asMap().entrySet()) {
            CodeWord code = codec.codeFor(entry.getKey());
            if (code != null) {
                average += ((double) entry.getValue() / total) * code.length();
            }
        }
        return average;
    }

    /**
     * Entropy divided by average code length. Returns 0 when the average
     * length is not positive, since the ratio is undefined there.
     */
    public static double codingEfficiency(double entropy, double averageCodeLength) {
        if (averageCodeLength <= 0) return 0;
        return entropy / averageCodeLength;
    }
}
