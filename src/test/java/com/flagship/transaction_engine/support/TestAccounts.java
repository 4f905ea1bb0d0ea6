package com.flagship.transaction_engine.support;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Unique account attributes so tests sharing a database do not collide.
 */
public final class TestAccounts {

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private TestAccounts() {
    }

    public static String uniquePhone() {
        long base = ThreadLocalRandom.current().nextLong(1_000_000_000L, 9_000_000_000L);
        return String.valueOf(base + SEQUENCE.incrementAndGet());
    }

    public static String uniqueUsername() {
        return "user" + SEQUENCE.incrementAndGet() + "-" + ThreadLocalRandom.current().nextInt(10_000);
    }
}
