package com.initialone.jdocgap.config;

/** Bad configuration file or option. Fatal at startup. */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
