package io.github.distinctid.core;

public class InvalidShardException extends DistinctIdException {

    private final int shardId;

    public InvalidShardException(int shardId, int shardMax) {
        super("shard id must be in range 0-" + (shardMax - 1) + ", got " + shardId);
        this.shardId = shardId;
    }

    public int getShardId() {
        return shardId;
    }
}
