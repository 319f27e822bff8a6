package io.github.distinctid.core.support;

/**
 * Bit layout of an identifier, most significant first: time delta, shard, sequence.
 */
public class IdGeneratorConfig {

    public static final int DEFAULT_SEQUENCE_BITS = 10;
    public static final int DEFAULT_SHARD_BITS = 13;
    public static final int DEFAULT_BUFFER_SIZE = 10_000;

    private final int sequenceBits;
    private final long sequenceMax;
    private final long sequenceMask;

    private final int shardBits;
    private final int shardMax;
    private final int shardShift;
    private final int timeShift;

    private final int bufferSize;

    public IdGeneratorConfig() {
        this(DEFAULT_SEQUENCE_BITS, DEFAULT_SHARD_BITS, DEFAULT_BUFFER_SIZE);
    }

    public IdGeneratorConfig(int sequenceBits, int shardBits, int bufferSize) {
        if (sequenceBits <= 0 || shardBits <= 0 || sequenceBits + shardBits >= Long.SIZE - 1) {
            throw new IllegalArgumentException(
                    "sequenceBits=" + sequenceBits + ", shardBits=" + shardBits
            );
        }
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive, got " + bufferSize);
        }
        this.sequenceBits = sequenceBits;
        this.sequenceMax = 1L << sequenceBits;
        this.sequenceMask = sequenceMax - 1;

        this.shardBits = shardBits;
        this.shardMax = 1 << shardBits;
        this.shardShift = sequenceBits;
        this.timeShift = sequenceBits + shardBits;

        this.bufferSize = bufferSize;
    }

    public int getSequenceBits() {
        return sequenceBits;
    }

    public long getSequenceMax() {
        return sequenceMax;
    }

    public long getSequenceMask() {
        return sequenceMask;
    }

    public int getShardBits() {
        return shardBits;
    }

    public int getShardMax() {
        return shardMax;
    }

    public int getShardShift() {
        return shardShift;
    }

    public int getTimeShift() {
        return timeShift;
    }

    public int getBufferSize() {
        return bufferSize;
    }

}
