package com.infocode.model;

/**
 * Small display helpers shared by the reports.
 */
final class ReportFormat {
    
    private ReportFormat() {
    }
    
    /**
     * Make whitespace in a symbol readable.
     */
    static String visible(String symbol) {
        return symbol.replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t");
    }
    
    /**
     * Cut long text for display, noting how much was left out.
     */
    static String abbreviate(String text, int maxChars) {
        int length = text.codePointCount(0, text.length());
        if (maxChars <= 0 || length <= maxChars) return text;
        return text.substring(0, text.offsetByCodePoints(0, maxChars)) + "... (" + length + " total)";
    }
}
