package com.flagship.transaction_engine.account;

/**
 * An account with the same phone number already exists.
 */
public class DuplicateAccountException extends RuntimeException {

    public DuplicateAccountException(String phone) {
        super("Account already exists for phone: " + phone);
    }
}
