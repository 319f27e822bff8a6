package io.github.distinctid.core.support;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

public class GeneratorMetrics {

    private final LongAdder generated = new LongAdder();
    private final LongAdder backendCalls = new LongAdder();
    private final LongAdder backendFailures = new LongAdder();
    private final LongAdder backendNanos = new LongAdder();

    void recordGenerated(int count) {
        generated.add(count);
    }

    void recordBackendCall(long nanos, boolean failed) {
        backendCalls.increment();
        backendNanos.add(nanos);
        if (failed) {
            backendFailures.increment();
        }
    }

    public long getGenerated() {
        return generated.sum();
    }

    public long getBackendCalls() {
        return backendCalls.sum();
    }

    public long getBackendFailures() {
        return backendFailures.sum();
    }

    public long getBackendMillis() {
        return TimeUnit.NANOSECONDS.toMillis(backendNanos.sum());
    }

    public void reset() {
        generated.reset();
        backendCalls.reset();
        backendFailures.reset();
        backendNanos.reset();
    }

    @Override
    public String toString() {
        return "generated=" + getGenerated()
               + ", backendCalls=" + getBackendCalls()
               + ", backendFailures=" + getBackendFailures()
               + ", backendMillis=" + getBackendMillis();
    }
}
