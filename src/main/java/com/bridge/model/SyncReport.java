package com.bridge.model;

import java.util.List;

/**
 * Summary of replaying a tracking session from one environment into another.
 *
 * @param source         Environment the records were taken from.
 * @param target         Environment they were replayed against.
 * @param success        {@code true} only when every record was applied.
 * @param message        Human-readable summary.
 * @param totalChanges   Number of records considered.
 * @param appliedChanges Records the target accepted.
 * @param failedChanges  Records that failed.
 * @param outcomes       Per-record outcomes, in ordinal order.
 * @param errors         {@code "<operation>: <error>"} strings for the failed records.
 */
public record SyncReport(Environment source,
                         Environment target,
                         boolean success,
                         String message,
                         int totalChanges,
                         int appliedChanges,
                         int failedChanges,
                         List<ReplayOutcome> outcomes,
                         List<String> errors) {

    public SyncReport {
        outcomes = List.copyOf(outcomes);
        errors = List.copyOf(errors);
    }

    public static SyncReport rejected(Environment source, Environment target, String message) {
        return new SyncReport(source, target, false, message, 0, 0, 0, List.of(), List.of());
    }
}
