package io.github.distinctid.core.support;

import io.github.distinctid.core.InvalidCountException;
import io.github.distinctid.core.InvalidShardException;

/**
 * Packs and unpacks identifiers. Stateless apart from the layout, shared by the
 * blocking and the asynchronous allocation paths.
 */
public class IdComposer {

    private final IdGeneratorConfig config;

    public IdComposer(IdGeneratorConfig config) {
        this.config = config;
    }

    public void validateShard(int shardId) {
        if (shardId < 0 || shardId >= config.getShardMax()) {
            throw new InvalidShardException(shardId, config.getShardMax());
        }
    }

    public void validateCount(int count) {
        if (count <= 0) {
            throw new InvalidCountException(count);
        }
    }

    public long compose(long timeDelta, int shardId, long counterValue) {
        long sequence = Math.floorMod(counterValue, config.getSequenceMax());
        return timeDelta << config.getTimeShift()
               | (long) shardId << config.getShardShift()
               | sequence;
    }

    /**
     * Composes {@code count} identifiers sharing one time delta from the counter range
     * {@code [start, start + count - 1]}.
     */
    public long[] composeRange(long timeDelta, int shardId, long start, int count) {
        long[] ids = new long[count];
        for (int i = 0; i < count; i++) {
            ids[i] = compose(timeDelta, shardId, start + i);
        }
        return ids;
    }

    public long timeDelta(long id) {
        return id >> config.getTimeShift();
    }

    public int shard(long id) {
        return (int) ((id >>> config.getShardShift()) & (config.getShardMax() - 1));
    }

    public long sequence(long id) {
        return id & config.getSequenceMask();
    }

    public IdGeneratorConfig getConfig() {
        return config;
    }
}
