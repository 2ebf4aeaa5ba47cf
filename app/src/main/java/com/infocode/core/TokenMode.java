package com.infocode.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * How a text is cut into symbols.
 */
public enum TokenMode {

    /** One symbol per character (Unicode code point). */
    UNIGRAM("unigram"),

    /** Overlapping two-character windows: "abcd" becomes [ab, bc, cd]. */
    BIGRAM("bigram");

    private final String configName;

    TokenMode(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Split text into symbols.
     *
     * Symbols are built from code points, so a surrogate pair is never split.
     */
    public List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        int[] codePoints = text.codePoints().toArray();
        switch (this) {
            case UNIGRAM:
                for (int cp : codePoints) {
                    tokens.add(new String(Character.toChars(cp)));
                }
                break;
            case BIGRAM:
                for (int i = 0; i + 1 < codePoints.length; i++) {
                    tokens.add(new String(codePoints, i, 2));
                }
                break;
            default:
                throw new IllegalStateException("Unknown token mode: " + this);
        }
        return tokens;
    }

    /**
     * Rebuild text from decoded symbols.
     *
     * Bigram tokens overlap by one character, so the first token is emitted
     * whole and every later token contributes only its last character.
     */
    public String detokenize(List<String> symbols) {
        StringBuilder sb = new StringBuilder();
        switch (this) {
            case UNIGRAM:
                for (String symbol : symbols) {
                    sb.append(symbol);
                }
                break;
            case BIGRAM:
                for (int i = 0; i < symbols.size(); i++) {
                    String token = symbols.get(i);
                    if (i == 0) {
                        sb.append(token);
                    } else {
                        sb.append(token, token.offsetByCodePoints(token.length(), -1), token.length());
                    }
                }
                break;
            default:
                throw new IllegalStateException("Unknown token mode: " + this);
        }
        return sb.toString();
    }

    /**
     * Parse a configuration or command-line name ("unigram", "bigram").
     */
    public static TokenMode fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (TokenMode mode : values()) {
            if (mode.configName.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown token mode: " + name);
    }
}
