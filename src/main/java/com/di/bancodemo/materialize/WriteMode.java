package com.di.bancodemo.materialize;

public enum WriteMode {
    /** Replace whatever the target location holds. */
    OVERWRITE,
    /** Add the new rows next to the existing ones. */
    APPEND
}
