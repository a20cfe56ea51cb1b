package com.satfetch.events;

public enum ProgressEventType {
    TASK_CREATED,
    TASK_DURATION,
    TASK_PROGRESS,
    TASK_COMPLETED,
    BATCH_STARTED,
    BATCH_COMPLETED;

    public boolean isBatchEvent() {
        return this == BATCH_STARTED || this == BATCH_COMPLETED;
    }
}
