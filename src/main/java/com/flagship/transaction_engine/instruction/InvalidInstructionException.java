package com.flagship.transaction_engine.instruction;

/**
 * An instruction's shape is invalid (missing account, non-positive amount, ...).
 * Validation errors are reported to the caller and never reach the queue.
 */
public class InvalidInstructionException extends IllegalArgumentException {

    public InvalidInstructionException(String message) {
        super(message);
    }

    public InvalidInstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
