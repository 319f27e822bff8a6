package io.github.distinctid.core.log;

import java.io.IOException;
import java.io.InputStream;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Log {

    private static final String CONFIGURATION_FILE = "logging.properties";

    static {
        init();
    }

    public static void init() {
        ClassLoader cl = Log.class.getClassLoader();
        InputStream inputStream = cl != null
                ? cl.getResourceAsStream(CONFIGURATION_FILE)
                : ClassLoader.getSystemResourceAsStream(CONFIGURATION_FILE);
        if (inputStream == null) {
            return;
        }
        try (InputStream in = inputStream) {
            LogManager.getLogManager().readConfiguration(in);
        } catch (SecurityException | IOException e) {
            get(Log.class).error("load " + CONFIGURATION_FILE + " failed", e);
        }
    }

    private final Logger logger;

    public Log(Logger logger) {
        this.logger = logger;
    }

    public void error(String message, Throwable e) {
        logger.log(Level.SEVERE, message, e);
    }

    public void warn(Supplier<String> messageSupplier) {
        logger.log(Level.WARNING, messageSupplier);
    }

    public void info(Supplier<String> messageSupplier) {
        logger.log(Level.INFO, messageSupplier);
    }

    public void debug(Supplier<String> messageSupplier) {
        logger.log(Level.FINE, messageSupplier);
    }

    public void trace(Supplier<String> messageSupplier) {
        logger.log(Level.FINER, messageSupplier);
    }

    public static Log get(Class<?> type) {
        return get(type.getName());
    }

    public static Log get(String name) {
        Logger logger = Logger.getLogger(name);
        return new Log(logger);
    }

}
