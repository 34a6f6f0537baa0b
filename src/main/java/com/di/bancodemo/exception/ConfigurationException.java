package com.di.bancodemo.exception;

/**
 * Missing configuration file, section or key, or a value the job cannot act on
 * (unsupported storage kind, unsupported file format).
 */
public class ConfigurationException extends BancoDemoException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
