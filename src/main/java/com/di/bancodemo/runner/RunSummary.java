package com.di.bancodemo.runner;

import com.di.bancodemo.materialize.MaterializationResult;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one materialization run, table by table.
 */
@Getter
public class RunSummary {

    private final String runId;
    private final List<MaterializationResult> succeeded = new ArrayList<>();
    /** Table name to failure message. */
    private final Map<String, String> failed = new LinkedHashMap<>();
    private final List<String> skipped = new ArrayList<>();

    public RunSummary(String runId) {
        this.runId = runId;
    }

    void succeeded(MaterializationResult result) {
        succeeded.add(result);
    }

    void failed(String tableName, String message) {
        failed.put(tableName, message);
    }

    void skipped(String tableName) {
        skipped.add(tableName);
    }

    public int total() {
        return succeeded.size() + failed.size() + skipped.size();
    }

    @Override
    public String toString() {
        return String.format("runId=%s succeeded=%d failed=%s skipped=%s",
                runId, succeeded.size(), failed.keySet(), skipped);
    }
}
