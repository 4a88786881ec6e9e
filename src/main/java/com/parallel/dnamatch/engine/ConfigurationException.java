package com.parallel.dnamatch.engine;

/**
 * Invalid search parameters, detected before any worker is started.
 */
public class ConfigurationException extends SearchEngineException {

    public ConfigurationException(String message) {
        super(message);
    }
}
