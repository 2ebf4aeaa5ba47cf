package com.infocode.text;

/**
 * Removes spaces and ASCII punctuation from raw text before analysis.
 */
public class TextCleaner {
    
    /** The 32 ASCII punctuation characters. */
    public static final String PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";
    
    private final boolean stripSpaces;
    private final boolean stripPunctuation;
    
    public TextCleaner(boolean stripSpaces, boolean stripPunctuation) {
        this.stripSpaces = stripSpaces;
        this.stripPunctuation = stripPunctuation;
    }
    
    /**
     * Cleaner that strips both spaces and punctuation.
     */
    public static TextCleaner standard() {
        return new TextCleaner(true, true);
    }
    
    public String clean(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (stripSpaces && c == ' ') continue;
            if (stripPunctuation && PUNCTUATION.indexOf(c) >= 0) continue;
            sb.append(c);
        }
        return sb.toString();
    }
}
