package com.di.bancodemo.exception;

/**
 * The data itself breaks a contract: the generator returned the wrong number of rows,
 * the dimension table is empty, or a reconciled table lost or gained rows.
 */
public class DataException extends BancoDemoException {

    public DataException(String message) {
        super(message);
    }
}
