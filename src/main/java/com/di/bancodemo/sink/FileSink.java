package com.di.bancodemo.sink;

/**
 * Bare files under a storage path, no catalog registration.
 */
public interface FileSink {

    /**
     * @return number of rows written
     */
    long write(TableWrite write);
}
