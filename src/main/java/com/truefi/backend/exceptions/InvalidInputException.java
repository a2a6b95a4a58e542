package com.truefi.backend.exceptions;

/**
 * Malformed or inconsistent transaction data: missing amount/date/currency, or mixed
 * currencies without a conversion table.
 */
public class InvalidInputException extends BadRequestException {

    public InvalidInputException(String message) {
        super(message);
    }
}
