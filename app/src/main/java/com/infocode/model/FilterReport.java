package com.infocode.model;

import com.infocode.analysis.FilterMode;

import java.util.Locale;
import java.util.Set;

/**
 * Entropy change after dropping the most or least frequent symbols.
 */
public class FilterReport {
    
    private final FilterMode mode;
    private final double fraction;
    private final String filteredText;
    private final Set<String> removed;
    private final double baselineEntropy;
    private final double filteredEntropy;
    
    public FilterReport(FilterMode mode, double fraction, String filteredText, Set<String> removed,
                        double baselineEntropy, double filteredEntropy) {
        this.mode = mode;
        this.fraction = fraction;
        this.filteredText = filteredText;
        this.removed = removed;
        this.baselineEntropy = baselineEntropy;
        this.filteredEntropy = filteredEntropy;
    }
    
    public FilterMode getMode() {
        return mode;
    }
    
    public double getFraction() {
        return fraction;
    }
    
    public String getFilteredText() {
        return filteredText;
    }
    
    public Set<String> getRemoved() {
        return removed;
    }
    
    public double getBaselineEntropy() {
        return baselineEntropy;
    }
    
    public double getFilteredEntropy() {
        return filteredEntropy;
    }
    
    public double getEntropyDelta() {
        return filteredEntropy - baselineEntropy;
    }
    
    public String getSummary(int precision, int maxTextChars) {
        String number = "%." + precision + "f";
        StringBuilder sb = new StringBuilder();
        sb.append("After removing ").append(String.format(Locale.ROOT, "%.0f%%", fraction * 100))
          .append(mode == FilterMode.TOP ? " most" : " least").append(" frequent symbols:\n");
        sb.append(" * Text: ").append(ReportFormat.abbreviate(ReportFormat.visible(filteredText), maxTextChars)).append('\n');
        sb.append(" * Removed: ").append(removed).append('\n');
        sb.append(" * Entropy: ").append(String.format(Locale.ROOT, number, filteredEntropy)).append('\n');
        sb.append(" * Change: ").append(String.format(Locale.ROOT, "%+." + precision + "f", getEntropyDelta())).append('\n');
        return sb.toString();
    }
    
    @Override
    public String toString() {
        return String.format(Locale.ROOT, "FilterReport[%s %.2f, removed=%s, delta=%.4f]",
            mode, fraction, removed, getEntropyDelta());
    }
}
