package com.di.bancodemo.util;

/**
 * SLF4J MDC keys printed on every log line (see the console pattern in application.yml).
 */
public final class MdcKeys {

    public static final String RUN_ID = "runId";
    public static final String TABLE = "table";

    private MdcKeys() {
    }
}
