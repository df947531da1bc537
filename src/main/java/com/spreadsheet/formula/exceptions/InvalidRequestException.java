package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a request body is missing a required field,
 * e.g. a formula evaluation request without a "formula".
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
