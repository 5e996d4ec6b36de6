package com.timeos.orchestrator.model;

import java.util.List;
import java.util.Objects;

/**
 * What a stage function reports back after one execution.
 *
 * A stage never throws to signal a business failure: it returns
 * {@link #failed(String)}. Anything that does escape is caught by the
 * job runner and turned into a failed outcome there.
 *
 * @param status         SUCCESS, PARTIAL, FAILED or SKIPPED
 * @param itemsProcessed number of records the stage handled (never negative)
 * @param error          failure description; required when status is FAILED
 * @param note           free-text detail: skip reason, staleness note, etc.
 * @param children       results of nested stages (only composite stages set this)
 */
public record StageOutcome(
        StageStatus     status,
        long            itemsProcessed,
        String          error,
        String          note,
        List<JobResult> children) {

    public StageOutcome {
        Objects.requireNonNull(status, "status");
        if (itemsProcessed < 0) {
            throw new IllegalArgumentException("itemsProcessed must be >= 0, was " + itemsProcessed);
        }
        if (status == StageStatus.FAILED && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("a FAILED outcome needs an error description");
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static StageOutcome success(long itemsProcessed) {
        return new StageOutcome(StageStatus.SUCCESS, itemsProcessed, null, null, List.of());
    }

    public static StageOutcome partial(long itemsProcessed, String note) {
        return new StageOutcome(StageStatus.PARTIAL, itemsProcessed, null, note, List.of());
    }

    public static StageOutcome failed(String error) {
        return new StageOutcome(StageStatus.FAILED, 0, error, null, List.of());
    }

    public static StageOutcome skipped(String reason) {
        return new StageOutcome(StageStatus.SKIPPED, 0, null, reason, List.of());
    }

    public StageOutcome withChildren(List<JobResult> nested) {
        return new StageOutcome(status, itemsProcessed, error, note, nested);
    }
}
