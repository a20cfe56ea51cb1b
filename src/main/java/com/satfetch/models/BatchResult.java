package com.satfetch.models;

import java.util.List;

public record BatchResult<T>(
        String batchId,
        List<T> successes,
        List<T> failures,
        boolean cancelled
) {
    public BatchResult {
        successes = List.copyOf(successes);
        failures = List.copyOf(failures);
    }

    public int total() {
        return successes.size() + failures.size();
    }
}
