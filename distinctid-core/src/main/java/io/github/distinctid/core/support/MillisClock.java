package io.github.distinctid.core.support;

@FunctionalInterface
public interface MillisClock {

    MillisClock SYSTEM = System::currentTimeMillis;

    long now();

}
