package io.github.distinctid.core.support;

import io.github.distinctid.core.BackendUnavailableException;
import io.github.distinctid.core.ConfigurationException;
import io.github.distinctid.core.DistinctIdException;
import io.github.distinctid.core.IdGenerator;
import io.github.distinctid.core.IdGeneratorFactory;
import io.github.distinctid.core.backend.AsyncCounterBackend;
import io.github.distinctid.core.backend.CounterBackend;
import io.github.distinctid.core.log.Log;
import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Allocates identifiers of the form {@code timeDelta | shard | counter mod 2^sequenceBits},
 * where the time delta is measured from the start of the current UTC year and the counter
 * comes from a {@link CounterBackend} shared by every producer.
 * <p>
 * Thread safe. Buffering and metrics can be toggled at any time; a call already in flight
 * when buffering is disabled may still be served from the discarded buffer.
 */
public class DistinctIdGenerator implements IdGeneratorFactory {

    public static final String DEFAULT_COUNTER_KEY = "distinctid";

    private final Log log = Log.get(DistinctIdGenerator.class);

    private final CounterBackend backend;
    private final AsyncCounterBackend asyncBackend;
    private final IdGeneratorConfig config;
    private final IdComposer composer;
    private final MillisClock clock;
    private final EpochBase epochBase;

    private final GeneratorMetrics metrics = new GeneratorMetrics();
    private final Map<String, IdGenerator> generators = new ConcurrentHashMap<>();
    private final CounterBackend meteredBackend = new MeteredBackend();
    private final AsyncCounterBackend meteredAsyncBackend = new MeteredAsyncBackend();

    private volatile Buffers buffers;
    private volatile boolean metricsEnabled;

    public DistinctIdGenerator(CounterBackend backend) {
        this(backend, null);
    }

    public DistinctIdGenerator(CounterBackend backend, AsyncCounterBackend asyncBackend) {
        this(backend, asyncBackend, new IdGeneratorConfig(), MillisClock.SYSTEM);
    }

    /**
     * @param asyncBackend used by the asynchronous methods; may be {@code null}, in which case
     *                     {@code backend} is used if it is itself an {@link AsyncCounterBackend}
     */
    public DistinctIdGenerator(CounterBackend backend,
                               AsyncCounterBackend asyncBackend,
                               IdGeneratorConfig config,
                               MillisClock clock) {
        this.backend = Objects.requireNonNull(backend);
        this.asyncBackend = asyncBackend != null || !(backend instanceof AsyncCounterBackend)
                ? asyncBackend
                : (AsyncCounterBackend) backend;
        this.config = Objects.requireNonNull(config);
        this.composer = new IdComposer(config);
        this.clock = Objects.requireNonNull(clock);
        this.epochBase = new EpochBase(clock);
    }

    @Override
    public IdGenerator getIdGenerator(@NotNull String key) {
        Objects.requireNonNull(key);
        return generators.computeIfAbsent(key, k -> new KeyedIdGenerator(this, k));
    }

    public long nextId(int shardId) {
        return nextId(shardId, DEFAULT_COUNTER_KEY);
    }

    public long nextId(int shardId, @NotNull String counterKey) {
        composer.validateShard(shardId);
        Buffers current = buffers;
        long counterValue = current != null
                ? current.get(counterKey).next(meteredBackend, counterKey)
                : meteredBackend.increment(counterKey);
        return composeOne(shardId, counterValue);
    }

    public long[] nextIds(int count, int shardId) {
        return nextIds(count, shardId, DEFAULT_COUNTER_KEY);
    }

    public long[] nextIds(int count, int shardId, @NotNull String counterKey) {
        composer.validateCount(count);
        composer.validateShard(shardId);
        long total = meteredBackend.incrementBy(counterKey, count);
        return composeBatch(count, shardId, total);
    }

    public CompletableFuture<Long> nextIdAsync(int shardId) {
        return nextIdAsync(shardId, DEFAULT_COUNTER_KEY);
    }

    /**
     * Same allocation as {@link #nextId(int, String)} without blocking the caller on the
     * backend. Validation and configuration errors are thrown, backend failures complete the
     * returned future exceptionally.
     */
    public CompletableFuture<Long> nextIdAsync(int shardId, @NotNull String counterKey) {
        composer.validateShard(shardId);
        requireAsyncBackend();
        Buffers current = buffers;
        CompletableFuture<Long> counterValue = current != null
                ? current.get(counterKey).nextAsync(meteredAsyncBackend, counterKey)
                : meteredAsyncBackend.incrementAsync(counterKey);
        return counterValue.thenApply(value -> composeOne(shardId, value));
    }

    public CompletableFuture<long[]> nextIdsAsync(int count, int shardId) {
        return nextIdsAsync(count, shardId, DEFAULT_COUNTER_KEY);
    }

    public CompletableFuture<long[]> nextIdsAsync(int count, int shardId, @NotNull String counterKey) {
        composer.validateCount(count);
        composer.validateShard(shardId);
        requireAsyncBackend();
        return meteredAsyncBackend.incrementByAsync(counterKey, count)
                .thenApply(total -> composeBatch(count, shardId, total));
    }

    private long composeOne(int shardId, long counterValue) {
        long now = clock.now();
        long id = composer.compose(now - epochBase.get(now), shardId, counterValue);
        if (metricsEnabled) {
            metrics.recordGenerated(1);
        }
        return id;
    }

    private long[] composeBatch(int count, int shardId, long total) {
        if (count > config.getSequenceMax()) {
            log.warn(() -> "batch of " + count + " exceeds the sequence space of "
                           + config.getSequenceMax() + ", identifiers will repeat");
        }
        long start = total - count + 1;
        long now = clock.now();
        long[] ids = composer.composeRange(now - epochBase.get(now), shardId, start, count);
        if (metricsEnabled) {
            metrics.recordGenerated(count);
        }
        return ids;
    }

    private void requireAsyncBackend() {
        if (asyncBackend == null) {
            throw new ConfigurationException(
                    "no asynchronous counter backend configured, see AsyncCounterBackend.of(backend, executor)"
            );
        }
    }

    public void enableBuffering() {
        enableBuffering(config.getBufferSize());
    }

    /**
     * Discards any buffered ranges and starts buffering with ranges of {@code bufferSize}.
     */
    public void enableBuffering(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive, got " + bufferSize);
        }
        buffers = new Buffers(bufferSize);
        log.info(() -> "buffering enabled, size " + bufferSize);
    }

    public void disableBuffering() {
        buffers = null;
        log.info(() -> "buffering disabled");
    }

    public boolean isBufferingEnabled() {
        return buffers != null;
    }

    /**
     * The buffer currently serving {@code counterKey}, or {@code null} when buffering is off.
     */
    public LocalIdBuffer getBuffer(String counterKey) {
        Buffers current = buffers;
        return current == null ? null : current.get(counterKey);
    }

    public void enableMetrics(boolean enabled) {
        metricsEnabled = enabled;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public GeneratorMetrics metrics() {
        return metrics;
    }

    /**
     * Absolute creation time of {@code id} in epoch millis, assuming it was created this year.
     */
    public long timestampOf(long id) {
        return composer.timeDelta(id) + epochBase.get();
    }

    public IdComposer getComposer() {
        return composer;
    }

    public EpochBase getEpochBase() {
        return epochBase;
    }

    public IdGeneratorConfig getConfig() {
        return config;
    }

    private static RuntimeException translate(String key, Throwable e) {
        if (e instanceof DistinctIdException) {
            return (DistinctIdException) e;
        }
        return BackendUnavailableException.of(key, e);
    }

    private void record(long start, boolean failed) {
        long nanos = System.nanoTime() - start;
        metrics.recordBackendCall(nanos, failed);
        log.debug(() -> "backend call " + (failed ? "failed" : "completed") + " in " + nanos + "ns");
    }

    private static final class Buffers {
        private final int bufferSize;
        private final Map<String, LocalIdBuffer> byKey = new ConcurrentHashMap<>();

        private Buffers(int bufferSize) {
            this.bufferSize = bufferSize;
        }

        private LocalIdBuffer get(String key) {
            return byKey.computeIfAbsent(key, k -> new LocalIdBuffer(bufferSize));
        }
    }

    private final class MeteredBackend implements CounterBackend {

        @Override
        public long increment(String key) {
            long start = System.nanoTime();
            boolean failed = true;
            try {
                long total = backend.increment(key);
                failed = false;
                return total;
            } catch (RuntimeException e) {
                throw translate(key, e);
            } finally {
                if (metricsEnabled) {
                    record(start, failed);
                }
            }
        }

        @Override
        public long incrementBy(String key, long delta) {
            long start = System.nanoTime();
            boolean failed = true;
            try {
                long total = backend.incrementBy(key, delta);
                failed = false;
                return total;
            } catch (RuntimeException e) {
                throw translate(key, e);
            } finally {
                if (metricsEnabled) {
                    record(start, failed);
                }
            }
        }
    }

    private final class MeteredAsyncBackend implements AsyncCounterBackend {

        @Override
        public CompletableFuture<Long> incrementAsync(String key) {
            return metered(key, () -> asyncBackend.incrementAsync(key));
        }

        @Override
        public CompletableFuture<Long> incrementByAsync(String key, long delta) {
            return metered(key, () -> asyncBackend.incrementByAsync(key, delta));
        }

        private CompletableFuture<Long> metered(String key, Supplier<CompletableFuture<Long>> call) {
            long start = System.nanoTime();
            CompletableFuture<Long> result = new CompletableFuture<>();
            CompletableFuture<Long> source;
            try {
                source = call.get();
            } catch (RuntimeException e) {
                if (metricsEnabled) {
                    record(start, true);
                }
                result.completeExceptionally(translate(key, e));
                return result;
            }
            source.whenComplete((total, e) -> {
                if (metricsEnabled) {
                    record(start, e != null);
                }
                if (e == null) {
                    result.complete(total);
                } else {
                    result.completeExceptionally(translate(key, AsyncCounterBackend.unwrap(e)));
                }
            });
            return result;
        }
    }
}
