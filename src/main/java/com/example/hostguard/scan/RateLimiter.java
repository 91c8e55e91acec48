package com.example.hostguard.scan;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Token bucket shared by every scan in the process.
 *
 * Tokens refill continuously at {@code ratePerSecond} up to {@code capacity}.
 * {@link #acquire()} never drops a request: it computes how long until the
 * next token exists, sleeps outside the lock and tries again.
 */
@Slf4j
public class RateLimiter {

    /** Blocks the calling thread; swapped out in tests */
    @FunctionalInterface
    interface Sleeper {
        void sleepNanos(long nanos) throws InterruptedException;
    }

    private final double ratePerSecond;
    private final int capacity;
    private final LongSupplier nanoTime;
    private final Sleeper sleeper;

    private final ReentrantLock lock = new ReentrantLock();
    private double tokens;
    private long lastRefillNanos;

    public RateLimiter(double ratePerSecond, int capacity) {
        this(ratePerSecond, capacity, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    RateLimiter(double ratePerSecond, int capacity, LongSupplier nanoTime, Sleeper sleeper) {
        if (!(ratePerSecond > 0) || Double.isInfinite(ratePerSecond)) {
            throw new IllegalArgumentException("ratePerSecond must be positive, got " + ratePerSecond);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.ratePerSecond = ratePerSecond;
        this.capacity = capacity;
        this.nanoTime = nanoTime;
        this.sleeper = sleeper;
        this.tokens = capacity;
        this.lastRefillNanos = nanoTime.getAsLong();
    }

    /**
     * Take one token, waiting as long as needed.
     *
     * @return nanoseconds spent waiting
     */
    public long acquire() throws InterruptedException {
        long waited = 0;
        while (true) {
            long waitNanos;
            lock.lock();
            try {
                refillLocked();
                if (tokens >= 1.0) {
                    tokens -= 1.0;
                    return waited;
                }
                waitNanos = (long) Math.ceil((1.0 - tokens) / ratePerSecond * 1_000_000_000L);
            } finally {
                lock.unlock();
            }
            log.debug("Rate limit reached, waiting {}ms for a token", TimeUnit.NANOSECONDS.toMillis(waitNanos));
            sleeper.sleepNanos(waitNanos);
            waited += waitNanos;
        }
    }

    boolean tryAcquire() {
        lock.lock();
        try {
            refillLocked();
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    double availableTokens() {
        lock.lock();
        try {
            refillLocked();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public double getRatePerSecond() {
        return ratePerSecond;
    }

    public int getCapacity() {
        return capacity;
    }

    private void refillLocked() {
        long now = nanoTime.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed / 1_000_000_000.0 * ratePerSecond);
            lastRefillNanos = now;
        }
    }
}
