package com.di.bancodemo.exception;

/**
 * Root of the typed failures raised while materializing or reconciling tables.
 *
 * <p>Subclasses decide the scope of a failure: startup errors abort the run,
 * per-table errors are logged by the runner and the next table is processed.
 */
public abstract class BancoDemoException extends RuntimeException {

    protected BancoDemoException(String message) {
        super(message);
    }

    protected BancoDemoException(String message, Throwable cause) {
        super(message, cause);
    }
}
