package com.infocode.analysis;

import java.util.Locale;

/**
 * Which end of the frequency ranking to remove.
 */
public enum FilterMode {
    /** Most frequent symbols. */
    TOP,
    /** Least frequent symbols. */
    BOTTOM;
    
    public static FilterMode fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
