package com.infocode.core;

/**
 * Base class for failures raised while building or applying a prefix code.
 */
public class CodingException extends RuntimeException {
    
    public CodingException(String message) {
        super(message);
    }
}
