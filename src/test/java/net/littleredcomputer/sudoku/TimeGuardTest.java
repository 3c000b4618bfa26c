// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.base.Ticker;
import org.junit.Test;

import java.time.Duration;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class TimeGuardTest {
    /** A clock that only moves when told to. */
    private static class ManualTicker extends Ticker {
        long now;

        ManualTicker(long start) { now = start; }

        void advance(Duration d) { now += d.toNanos(); }

        @Override
        public long read() { return now; }
    }

    @Test
    public void expiresAtDeadline() {
        ManualTicker t = new ManualTicker(1000);
        TimeGuard g = TimeGuard.start(Duration.ofHours(1), t);
        assertThat(g.expired(), is(false));
        t.advance(Duration.ofMinutes(59));
        assertThat(g.expired(), is(false));
        assertThat(g.remaining(), is(Duration.ofMinutes(1)));
        t.advance(Duration.ofMinutes(1));
        assertThat(g.expired(), is(true));
        assertThat(g.remaining(), is(Duration.ZERO));
        t.advance(Duration.ofDays(1));
        assertThat(g.expired(), is(true));
    }

    @Test
    public void tickerNearOverflow() {
        ManualTicker t = new ManualTicker(Long.MAX_VALUE - Duration.ofSeconds(1).toNanos());
        TimeGuard g = TimeGuard.start(Duration.ofSeconds(10), t);
        t.advance(Duration.ofSeconds(5));
        assertThat(g.expired(), is(false));
        t.advance(Duration.ofSeconds(5));
        assertThat(g.expired(), is(true));
    }

    @Test
    public void zeroBudgetIsAlreadyExpired() {
        assertThat(TimeGuard.start(Duration.ZERO, new ManualTicker(0)).expired(), is(true));
    }

    @Test
    public void hugeBudgetNeverExpires() {
        ManualTicker t = new ManualTicker(0);
        TimeGuard g = TimeGuard.start(Duration.ofSeconds(Long.MAX_VALUE), t);
        t.advance(Duration.ofDays(365 * 100));
        assertThat(g.expired(), is(false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeBudget() {
        TimeGuard.start(Duration.ofSeconds(-1), Ticker.systemTicker());
    }
}
