package io.github.distinctid.core;

/**
 * The counter backend could not complete an increment, either because it could not be
 * reached or because it did not answer in time. Never retried by the generator.
 */
public class BackendUnavailableException extends DistinctIdException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public static BackendUnavailableException of(String key, Throwable cause) {
        return new BackendUnavailableException(
                "counter backend unavailable for key '" + key + "': " + cause.getMessage(),
                cause
        );
    }
}
