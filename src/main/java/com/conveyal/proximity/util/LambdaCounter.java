package com.conveyal.proximity.util;

import org.slf4j.Logger;

/**
 * Counts scopes as they are processed, including from worker threads, and logs progress every so often. An instance that is effectively final can have its increment method called inside a lambda.
 */
public class LambdaCounter {

    private final Logger logger;

    private int count = 0;

    private final int total;

    private final int logFrequency;

    private String message;

    /**
     * Create a counter that will log the number of iterations out of a specified total.
     * It expects a message string with two {} placeholders. The first is the count and the second is the total.
     */
    public LambdaCounter (Logger logger, int total, int logFrequency, String message) {
        this.logger = logger;
        this.total = total;
        this.logFrequency = Math.max(1, logFrequency);
        this.message = message;
    }

    public synchronized void increment () {
        count += 1;
        if (count % logFrequency == 0) {
            log();
        }
    }

    private void log () {
        logger.info(message, count, total);
    }

    public synchronized void done () {
        message = "Done. " + message;
        log();
    }

}
