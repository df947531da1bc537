package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a cell key supplied by the caller isn't a valid
 * cell identifier.
 * For example, "Invalid cell reference: A0".
 */
public class InvalidCellReferenceException extends RuntimeException {
    public InvalidCellReferenceException(String message) {
        super(message);
    }
}
