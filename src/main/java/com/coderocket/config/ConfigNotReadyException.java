package com.coderocket.config;

/**
 * Thrown when configuration is read before {@link ConfigStore#initialize()} has completed.
 */
public class ConfigNotReadyException extends IllegalStateException {

    public ConfigNotReadyException() {
        super("ConfigStore is not initialized, call initialize() first");
    }
}
