// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.base.Ticker;

import java.time.Duration;

/**
 * An absolute deadline on a given clock. The guard only answers whether the
 * deadline has passed; stopping work is up to whoever polls it.
 */
public final class TimeGuard {
    private final Ticker ticker;
    private final long deadlineNanos;

    private TimeGuard(Ticker ticker, long deadlineNanos) {
        this.ticker = ticker;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * @param budget time allowed from now; must not be negative
     * @param ticker the clock to measure against
     */
    public static TimeGuard start(Duration budget, Ticker ticker) {
        if (budget.isNegative()) throw new IllegalArgumentException("negative time budget " + budget);
        long nanos;
        try {
            nanos = budget.toNanos();
        } catch (ArithmeticException e) {
            nanos = Long.MAX_VALUE / 2;  // effectively unbounded
        }
        return new TimeGuard(ticker, ticker.read() + nanos);
    }

    public boolean expired() {
        // Compare as a difference, as with System.nanoTime().
        return ticker.read() - deadlineNanos >= 0;
    }

    public Duration remaining() {
        long left = deadlineNanos - ticker.read();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }
}
