package io.github.distinctid.core;

public interface IdGeneratorFactory {

    default long nextId(String key, int shardId) {
        return getIdGenerator(key).nextId(shardId);
    }

    IdGenerator getIdGenerator(String key);

}
