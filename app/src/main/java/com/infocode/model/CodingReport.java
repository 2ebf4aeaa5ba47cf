package com.infocode.model;

import com.infocode.core.Codec;
import com.infocode.core.CodeWord;

import java.util.Locale;
import java.util.Map;

/**
 * Result of coding one text with one prefix-code algorithm.
 */
public class CodingReport {
    
    private final String algorithmName;
    private final Codec<String> codec;
    private final String encoded;
    private final String decoded;
    private final boolean roundTripOk;
    private final double averageCodeLength;
    private final double efficiency;
    private final int sourceLength;
    private final int packedBytes;
    
    public CodingReport(String algorithmName, Codec<String> codec,
                        String encoded, String decoded, boolean roundTripOk,
                        double averageCodeLength, double efficiency, int sourceLength,
                        int packedBytes) {
        this.algorithmName = algorithmName;
        this.codec = codec;
        this.encoded = encoded;
        this.decoded = decoded;
        this.roundTripOk = roundTripOk;
        this.averageCodeLength = averageCodeLength;
        this.efficiency = efficiency;
        this.sourceLength = sourceLength;
        this.packedBytes = packedBytes;
    }
    
    public String getAlgorithmName() {
        return algorithmName;
    }
    
    public Codec<String> getCodec() {
        return codec;
    }
    
    public String getEncoded() {
        return encoded;
    }
    
    public String getDecoded() {
        return decoded;
    }
    
    public boolean isRoundTripOk() {
        return roundTripOk;
    }
    
    public double getAverageCodeLength() {
        return averageCodeLength;
    }
    
    public double getEfficiency() {
        return efficiency;
    }
    
    public long getEncodedBits() {
        return encoded.length();
    }
    
    /**
     * Size of the encoded bits once packed eight to a byte.
     */
    public int getPackedBytes() {
        return packedBytes;
    }
    
    /**
     * Encoded bits per character of the source text, or 0 for an empty text.
     */
    public double getBitsPerCharacter() {
        if (sourceLength == 0) return 0;
        return (double) encoded.length() / sourceLength;
    }
    
    /**
     * Get formatted summary for display.
     */
    public String getSummary(int precision, int maxEncodedChars) {
        String number = "%." + precision + "f";
        StringBuilder sb = new StringBuilder();
        sb.append(algorithmName).append(" codes:\n");
        for (Map.Entry<String, CodeWord> entry : codec.asMap().entrySet()) {
            sb.append(" * ").append(ReportFormat.visible(entry.getKey()))
              .append(": ").append(entry.getValue()).append('\n');
        }
        sb.append("Encoded: ").append(ReportFormat.abbreviate(encoded, maxEncodedChars)).append('\n');
        sb.append("Decoded: ").append(ReportFormat.abbreviate(ReportFormat.visible(decoded), maxEncodedChars))
          .append(" (matches: ").append(roundTripOk ? "yes" : "no").append(")\n");
        sb.append("Encoded size: ").append(encoded.length()).append(" bits (")
          .append(packedBytes).append(" bytes packed)\n");
        sb.append("Average code length: ").append(String.format(Locale.ROOT, number, averageCodeLength))
          .append(" bits/symbol\n");
        sb.append("Bits per character: ").append(String.format(Locale.ROOT, number, getBitsPerCharacter())).append('\n');
        sb.append("Efficiency: ").append(String.format(Locale.ROOT, number, efficiency))
          .append(" (").append(String.format(Locale.ROOT, "%.2f%%", efficiency * 100)).append(")\n");
        return sb.toString();
    }
    
    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s: %d symbols, %d bits, avg=%.4f, efficiency=%.2f%%, roundTrip=%s",
            algorithmName, codec.size(), encoded.length(), averageCodeLength, efficiency * 100, roundTripOk);
    }
}
