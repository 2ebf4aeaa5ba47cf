package com.infocode.model;

import java.util.Collections;
import java.util.List;

/**
 * Entropy statistics of a text plus one coding report per algorithm run.
 */
public class AnalysisReport {
    
    private final EntropyReport entropyReport;
    private final List<CodingReport> codingReports;
    
    public AnalysisReport(EntropyReport entropyReport, List<CodingReport> codingReports) {
        this.entropyReport = entropyReport;
        this.codingReports = Collections.unmodifiableList(codingReports);
    }
    
    public EntropyReport getEntropyReport() {
        return entropyReport;
    }
    
    /**
     * Coding results, empty when the alphabet is degenerate.
     */
    public List<CodingReport> getCodingReports() {
        return codingReports;
    }
    
    public boolean isAllRoundTripsOk() {
        return codingReports.stream().allMatch(CodingReport::isRoundTripOk);
    }
    
    public String getSummary(int precision, int maxEncodedChars) {
        StringBuilder sb = new StringBuilder(entropyReport.getSummary(precision));
        for (CodingReport report : codingReports) {
            sb.append('\n').append(report.getSummary(precision, maxEncodedChars));
        }
        return sb.toString();
    }
}
