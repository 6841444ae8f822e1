package com.pearlthoughts.mailgateway.dispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bulk send outcomes partitioned into successes and failures.
 * {@code successes.size() + failures.size() == total}.
 */
public class BatchResult {

    private final int total;
    private final List<DispatchOutcome> successes;
    private final List<DispatchOutcome> failures;

    private BatchResult(int total, List<DispatchOutcome> successes, List<DispatchOutcome> failures) {
        this.total = total;
        this.successes = Collections.unmodifiableList(successes);
        this.failures = Collections.unmodifiableList(failures);
    }

    public static BatchResult of(List<DispatchOutcome> outcomes) {
        List<DispatchOutcome> successes = new ArrayList<>();
        List<DispatchOutcome> failures = new ArrayList<>();
        for (DispatchOutcome outcome : outcomes) {
            if (outcome.isSuccessful()) {
                successes.add(outcome);
            } else {
                failures.add(outcome);
            }
        }
        return new BatchResult(outcomes.size(), successes, failures);
    }

    public int getTotal() { return total; }
    public int getSuccessful() { return successes.size(); }
    public int getFailed() { return failures.size(); }
    public List<DispatchOutcome> getSuccesses() { return successes; }
    public List<DispatchOutcome> getFailures() { return failures; }

    @Override
    public String toString() {
        return String.format("BatchResult{total=%d, successful=%d, failed=%d}",
                total, getSuccessful(), getFailed());
    }
}
