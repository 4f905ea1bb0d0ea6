package com.flagship.transaction_engine.instruction;

/**
 * A queued payload could not be decoded into a valid instruction.
 * Decoding never succeeds on retry, so the processor treats this as poison.
 */
public class MalformedInstructionException extends RuntimeException {

    public MalformedInstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
