package io.github.distinctid.core;

/**
 * Base type of every failure raised while allocating identifiers.
 */
public class DistinctIdException extends RuntimeException {

    public DistinctIdException(String message) {
        super(message);
    }

    public DistinctIdException(String message, Throwable cause) {
        super(message, cause);
    }

}
