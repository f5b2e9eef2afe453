package com.example.deal_bot.source;

import java.time.Duration;

/**
 * Blocks the calling thread. Replaced in tests with a clock-advancing fake.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return d -> Thread.sleep(d.toMillis());
    }
}
