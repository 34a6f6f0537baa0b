package com.di.bancodemo.exception;

/**
 * The sink or the execution engine rejected a write.
 */
public class WriteException extends BancoDemoException {

    public WriteException(String message) {
        super(message);
    }

    public WriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
