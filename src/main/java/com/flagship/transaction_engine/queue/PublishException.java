package com.flagship.transaction_engine.queue;

/**
 * The broker did not confirm a publish. Delivery must not be assumed.
 */
public class PublishException extends RuntimeException {

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
