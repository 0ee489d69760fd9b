package com.scidata.dfe.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging.
 * Remote delivery retries against a dead manager fail in tight loops; this keeps
 * one line per interval in the log and counts the rest.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(0);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    public void log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        // CAS so only one thread logs per interval
        if ((last == 0 || now - last > minIntervalNanos) && lastLogTime.compareAndSet(last, now)) {
            long dropped = suppressed.getAndSet(0);
            if (dropped > 0)
                logger.error("{} ({} similar errors suppressed)", message, dropped, t);
            else
                logger.error(message, t);
        } else {
            suppressed.incrementAndGet();
        }
    }

    /** Number of messages dropped since the last one that was logged. */
    public long suppressedCount() {
        return suppressed.get();
    }
}
