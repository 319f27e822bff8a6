package io.github.distinctid.core;

public class InvalidCountException extends DistinctIdException {

    private final int count;

    public InvalidCountException(int count) {
        super("count must be positive, got " + count);
        this.count = count;
    }

    public int getCount() {
        return count;
    }
}
