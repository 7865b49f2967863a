package com.endecrelay.relay.sink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-sink results for one dispatched alert, in sink order.
 */
public final class DispatchReport {

    private final List<DeliveryResult> results;

    public DispatchReport(List<DeliveryResult> results) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    public List<DeliveryResult> getResults() {
        return results;
    }

    public List<DeliveryResult> failures() {
        return results.stream()
                .filter(r -> !r.isSuccess())
                .collect(Collectors.toList());
    }

    public boolean allSucceeded() {
        return results.stream().allMatch(DeliveryResult::isSuccess);
    }

    @Override
    public String toString() {
        return results.toString();
    }
}
