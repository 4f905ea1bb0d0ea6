package com.flagship.transaction_engine.transaction;

/**
 * Failure to apply an instruction. Nothing was mutated and nothing was appended.
 *
 * The retryable flag is what the transaction processor branches on: retryable
 * failures are requeued, terminal ones are acknowledged since retrying cannot
 * change their outcome.
 */
public abstract class MutationException extends RuntimeException {

    protected MutationException(String message) {
        super(message);
    }

    protected MutationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();

    /**
     * Short machine-readable reason, used for metrics and logs.
     */
    public abstract String reason();
}
