package io.github.distinctid.core;

public class ConfigurationException extends DistinctIdException {

    public ConfigurationException(String message) {
        super(message);
    }

}
