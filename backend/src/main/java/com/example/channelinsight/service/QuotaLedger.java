package com.example.channelinsight.service;

import com.example.channelinsight.exception.QuotaExceededException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Budget counter for one provider, reset at each window boundary in {@code zone}. Every update is
 * a compare-and-set on an immutable snapshot, so concurrent reservations never overshoot.
 */
public class QuotaLedger {

    private static final Logger log = LoggerFactory.getLogger(QuotaLedger.class);

    private final String name;
    private final long budget;
    private final Duration window;
    private final ZoneId zone;
    private final Clock clock;
    private final AtomicReference<Usage> usage;

    public QuotaLedger(String name, long budget, Duration window, ZoneId zone, Clock clock) {
        if (budget < 0) {
            throw new IllegalArgumentException("budget must not be negative");
        }
        if (window.toSeconds() < 1) {
            throw new IllegalArgumentException("window must be at least one second");
        }
        this.name = name;
        this.budget = budget;
        this.window = window;
        this.zone = zone;
        this.clock = clock;
        this.usage = new AtomicReference<>(new Usage(windowIndex(clock.instant()), 0));
    }

    public void reserve(long units) {
        if (units < 0) {
            throw new IllegalArgumentException("units must not be negative");
        }
        while (true) {
            Instant now = clock.instant();
            Usage current = current(now);
            long next = current.consumed() + units;
            if (next > budget) {
                long remaining = Math.max(0, budget - current.consumed());
                log.warn("{} quota exhausted: requested={}, remaining={}", name, units, remaining);
                throw new QuotaExceededException(name, units, remaining, untilReset(now));
            }
            if (usage.compareAndSet(current, new Usage(current.window(), next))) {
                return;
            }
        }
    }

    public void release(long units) {
        if (units <= 0) {
            return;
        }
        usage.updateAndGet(u -> {
            Usage current = rollover(u, windowIndex(clock.instant()));
            return new Usage(current.window(), Math.max(0, current.consumed() - units));
        });
    }

    public void record(long units) {
        if (units <= 0) {
            return;
        }
        usage.updateAndGet(u -> {
            Usage current = rollover(u, windowIndex(clock.instant()));
            return new Usage(current.window(), current.consumed() + units);
        });
    }

    public long consumed() {
        return current(clock.instant()).consumed();
    }

    public long remaining() {
        return Math.max(0, budget - consumed());
    }

    public long budget() {
        return budget;
    }

    public String name() {
        return name;
    }

    public Duration untilReset() {
        return untilReset(clock.instant());
    }

    private Usage current(Instant now) {
        long index = windowIndex(now);
        while (true) {
            Usage current = usage.get();
            if (current.window() >= index) {
                return current;
            }
            Usage fresh = new Usage(index, 0);
            if (usage.compareAndSet(current, fresh)) {
                log.info("{} quota window rolled over; consumed {} of {} in previous window", name,
                        current.consumed(), budget);
                return fresh;
            }
        }
    }

    private static Usage rollover(Usage usage, long index) {
        return usage.window() >= index ? usage : new Usage(index, 0);
    }

    private long windowIndex(Instant instant) {
        long localSeconds = instant.getEpochSecond() + zone.getRules().getOffset(instant).getTotalSeconds();
        return Math.floorDiv(localSeconds, window.toSeconds());
    }

    private Duration untilReset(Instant now) {
        long localSeconds = now.getEpochSecond() + zone.getRules().getOffset(now).getTotalSeconds();
        long windowSeconds = window.toSeconds();
        long elapsed = Math.floorMod(localSeconds, windowSeconds);
        return Duration.ofSeconds(windowSeconds - elapsed);
    }

    private record Usage(long window, long consumed) {
    }
}
