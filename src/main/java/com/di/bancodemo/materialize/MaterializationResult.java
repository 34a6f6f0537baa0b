package com.di.bancodemo.materialize;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class MaterializationResult {
    String tableName;
    WriteDecision decision;
    long rowCount;
    LocalDate executionDate;
    /** Directory the rows were written to. */
    String location;
}
