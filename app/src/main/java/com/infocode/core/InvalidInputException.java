package com.infocode.core;

/**
 * Raised when a code builder is given input it cannot build a code from,
 * such as an empty frequency table.
 */
public class InvalidInputException extends CodingException {
    
    public InvalidInputException(String message) {
        super(message);
    }
}
