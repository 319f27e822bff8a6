package io.github.distinctid.core.support;

import io.github.distinctid.core.IdGenerator;

import java.util.concurrent.CompletableFuture;

class KeyedIdGenerator implements IdGenerator {

    private final DistinctIdGenerator generator;
    private final String key;

    KeyedIdGenerator(DistinctIdGenerator generator, String key) {
        this.generator = generator;
        this.key = key;
    }

    @Override
    public long nextId(int shardId) {
        return generator.nextId(shardId, key);
    }

    @Override
    public long[] nextIds(int count, int shardId) {
        return generator.nextIds(count, shardId, key);
    }

    @Override
    public CompletableFuture<Long> nextIdAsync(int shardId) {
        return generator.nextIdAsync(shardId, key);
    }

    @Override
    public CompletableFuture<long[]> nextIdsAsync(int count, int shardId) {
        return generator.nextIdsAsync(count, shardId, key);
    }
}
