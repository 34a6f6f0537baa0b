package com.di.bancodemo.exception;

/**
 * The execution-engine session could not be created. Fatal to the whole run.
 */
public class SessionInitializationException extends BancoDemoException {

    public SessionInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
