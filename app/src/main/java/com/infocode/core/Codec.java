package com.infocode.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Prefix-free mapping from symbols to codewords.
 *
 * Construction checks that no codeword is a prefix of another (which also
 * rules out duplicates), so every instance can be decoded left to right
 * without backtracking.
 *
 * @param <S> symbol type
 */
public final class Codec<S> {

    private final Map<S, CodeWord> codes;
    private final Map<String, S> inverse;
    private final int maxCodeLength;

    /**
     * @param codes Codeword per symbol; iteration order is kept for display
     * @throws IllegalArgumentException if the codewords are not prefix-free
     */
    public Codec(Map<S, CodeWord> codes) {
        Objects.requireNonNull(codes, "codes");
        Map<S, CodeWord> copy = new LinkedHashMap<>(codes);
        Map<String, S> reversed = new HashMap<>();
        int maxLen = 0;
        for (Map.Entry<S, CodeWord> entry : copy.entrySet()) {
            CodeWord code = Objects.requireNonNull(entry.getValue(), "codeword");
            S previous = reversed.put(code.bits(), entry.getKey());
            if (previous != null) {
                throw new IllegalArgumentException("Codeword " + code + " assigned to both "
                    + previous + " and " + entry.getKey());
            }
            maxLen = Math.max(maxLen, code.length());
        }
        checkPrefixFree(reversed.keySet());
        this.codes = Collections.unmodifiableMap(copy);
        this.inverse = reversed;
        this.maxCodeLength = maxLen;
    }

    /**
     * Build a codec from textual codewords, e.g. {a=0, b=10, c=11}.
     */
    public static <S> Codec<S> fromBits(Map<S, String> bits) {
        Map<S, CodeWord> codes = new LinkedHashMap<>();
        for (Map.Entry<S, String> entry : bits.entrySet()) {
            codes.put(entry.getKey(), CodeWord.of(entry.getValue()));
        }
        return new Codec<>(codes);
    }

    // In lexicographic order a prefix always sorts directly before some word
    // it prefixes, so checking neighbours is enough.
    private static void checkPrefixFree(Set<String> words) {
        List<String> sorted = new ArrayList<>(words);
        Collections.sort(sorted);
        for (int i = 1; i < sorted.size(); i++) {
            String shorter = sorted.get(i - 1);
            String longer = sorted.get(i);
            if (longer.startsWith(shorter)) {
                throw new IllegalArgumentException(
                    "Codeword " + shorter + " is a prefix of " + longer);
            }
        }
    }

    /**
     * Codeword for a symbol, or null if the symbol is not covered.
     */
    public CodeWord codeFor(S symbol) {
        return codes.get(symbol);
    }

    /**
     * Symbol whose codeword is exactly the given bits, or null.
     */
    public S symbolFor(CharSequence bits) {
        return inverse.get(bits.toString());
    }

    public boolean contains(S symbol) {
        return codes.containsKey(symbol);
    }

    public int size() {
        return codes.size();
    }

    public int maxCodeLength() {
        return maxCodeLength;
    }

    public Map<S, CodeWord> asMap() {
        return codes;
    }

    /**
     * Kraft sum of the code lengths. Equals 1 for a complete binary code tree.
     */
    public double kraftSum() {
        double sum = 0;
        for (CodeWord code : codes.values()) {
            sum += Math.pow(2, -code.length());
        }
        return sum;
    }

    @Override
    public String toString() {
        return "Codec" + codes;
    }
}
