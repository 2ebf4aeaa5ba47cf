package com.infocode.config;

import com.infocode.analysis.FilterMode;
import com.infocode.core.TokenMode;
import com.infocode.service.CodingAlgorithm;
import com.infocode.text.TextCleaner;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

/**
 * Application configuration wrapper.
 */
public class AppConfig {
    
    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);
    private final Config config;
    
    public AppConfig() {
        this(ConfigFactory.load());
    }
    
    public AppConfig(Config config) {
        this.config = config.getConfig("infocode");
    }
    
    // Text settings
    public boolean isStripSpaces() {
        return config.getBoolean("text.strip-spaces");
    }
    
    public boolean isStripPunctuation() {
        return config.getBoolean("text.strip-punctuation");
    }
    
    public TextCleaner createTextCleaner() {
        return new TextCleaner(isStripSpaces(), isStripPunctuation());
    }
    
    // Analysis settings
    public TokenMode getTokenMode() {
        String name = config.getString("analysis.token-mode");
        try {
            return TokenMode.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(config.origin(), "analysis.token-mode", e.getMessage(), e);
        }
    }
    
    public List<CodingAlgorithm> getAlgorithms() {
        List<CodingAlgorithm> algorithms = new ArrayList<>();
        for (String name : config.getStringList("analysis.algorithms")) {
            try {
                algorithms.add(CodingAlgorithm.fromName(name));
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(config.origin(), "analysis.algorithms", e.getMessage(), e);
            }
        }
        if (algorithms.isEmpty()) {
            logger.warn("No coding algorithms configured, only entropy will be reported");
        }
        return algorithms;
    }
    
    public boolean isVerifyRoundTrip() {
        return config.getBoolean("analysis.verify-round-trip");
    }
    
    // Filter settings
    public FilterMode getFilterMode() {
        String name = config.getString("filter.mode");
        try {
            return FilterMode.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(config.origin(), "filter.mode", "Unknown filter mode: " + name, e);
        }
    }
    
    public double getFilterFraction() {
        double fraction = config.getDouble("filter.fraction");
        if (fraction < 0) {
            throw new ConfigException.BadValue(config.origin(), "filter.fraction",
                "must not be negative: " + fraction);
        }
        return fraction;
    }
    
    // Report settings
    public int getReportPrecision() {
        return config.getInt("report.precision");
    }
    
    public int getMaxEncodedChars() {
        return config.getInt("report.max-encoded-chars");
    }
    
    // Input settings
    public Charset getInputCharset() {
        return Charset.forName(config.getString("input.charset"));
    }
}
