package io.github.distinctid.core;

import java.util.concurrent.CompletableFuture;

/**
 * Identifier source bound to one counter key.
 */
public interface IdGenerator {

    long nextId(int shardId);

    long[] nextIds(int count, int shardId);

    CompletableFuture<Long> nextIdAsync(int shardId);

    CompletableFuture<long[]> nextIdsAsync(int count, int shardId);

}
