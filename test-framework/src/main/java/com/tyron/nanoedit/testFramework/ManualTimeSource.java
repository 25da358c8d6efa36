package com.tyron.nanoedit.testFramework;

import com.tyron.nanoedit.api.history.TimeSource;

import java.time.Duration;

/**
 * A {@link TimeSource} that only moves when told to, so grouping timeouts can be tested without sleeping.
 */
public final class ManualTimeSource implements TimeSource {

    private long now;

    public ManualTimeSource() {
        this(1_000_000L);
    }

    public ManualTimeSource(long startMillis) {
        this.now = startMillis;
    }

    @Override
    public long nowMillis() {
        return now;
    }

    public void advance(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("time only moves forward: " + millis);
        }
        now += millis;
    }

    public void advance(Duration duration) {
        advance(duration.toMillis());
    }
}
