package io.github.distinctid.core.support;

import io.github.distinctid.core.log.Log;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Start of the current UTC calendar year in epoch millis, cached until the year changes.
 * <p>
 * Readers never block. Two threads racing on a year change compute the same value, so
 * whichever write lands last is correct.
 */
public class EpochBase {

    private final Log log = Log.get(EpochBase.class);

    private final MillisClock clock;
    private volatile Cached cached;

    public EpochBase(MillisClock clock) {
        this.clock = clock;
    }

    public long get() {
        return get(clock.now());
    }

    long get(long now) {
        int year = yearOf(now);
        Cached current = cached;
        if (current != null && current.year == year) {
            return current.base;
        }
        Cached fresh = new Cached(year, startOfYear(year));
        cached = fresh;
        log.debug(() -> "epoch base for " + year + ": " + fresh.base
                        + (current == null ? "" : " (was " + current.year + ")"));
        return fresh.base;
    }

    public int cachedYear() {
        Cached current = cached;
        return current == null ? -1 : current.year;
    }

    public static long startOfYear(int year) {
        return LocalDate.of(year, 1, 1).atStartOfDay().toInstant(ZoneOffset.UTC).toEpochMilli();
    }

    public static int yearOf(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis).atZone(ZoneOffset.UTC).getYear();
    }

    private static final class Cached {
        private final int year;
        private final long base;

        private Cached(int year, long base) {
            this.year = year;
            this.base = base;
        }
    }
}
