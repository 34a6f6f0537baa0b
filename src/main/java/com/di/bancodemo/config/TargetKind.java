package com.di.bancodemo.config;

/**
 * Where materialized rows end up: a catalog-registered table or bare files under a path.
 */
public enum TargetKind {
    CATALOG,
    FLAT_FILE
}
