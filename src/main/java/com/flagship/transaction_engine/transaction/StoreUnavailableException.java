package com.flagship.transaction_engine.transaction;

/**
 * Transient infrastructure fault: lock timeout, deadlock abort, lost connection,
 * failed commit. The transaction was rolled back; retrying is safe.
 */
public class StoreUnavailableException extends MutationException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    @Override
    public String reason() {
        return "store_unavailable";
    }
}
