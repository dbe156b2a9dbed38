package com.eventharvester.fetch;

/**
 * Blocking pause used between requests and retry attempts; replaced by a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;
}
