package com.satfetch.events;

public record ProgressEvent(
        ProgressEventType type,
        String taskId,
        String description,
        Long duration,
        Long advance,
        Boolean success,
        Integer totalItems,
        Integer successCount,
        Integer failureCount
) {
    public ProgressEvent {
        if (type == null) {
            throw new IllegalArgumentException("Event type must be set");
        }
        if (taskId == null) {
            throw new IllegalArgumentException("Task id must be set");
        }
    }

    public static ProgressEvent taskCreated(String taskId, String description) {
        return new ProgressEvent(ProgressEventType.TASK_CREATED, taskId, description, null, null, null, null, null, null);
    }

    public static ProgressEvent taskDuration(String taskId, long duration) {
        return new ProgressEvent(ProgressEventType.TASK_DURATION, taskId, null, duration, null, null, null, null, null);
    }

    public static ProgressEvent taskProgress(String taskId, long advance) {
        return new ProgressEvent(ProgressEventType.TASK_PROGRESS, taskId, null, null, advance, null, null, null, null);
    }

    public static ProgressEvent taskCompleted(String taskId, boolean success, String description) {
        return new ProgressEvent(ProgressEventType.TASK_COMPLETED, taskId, description, null, null, success, null, null, null);
    }

    public static ProgressEvent batchStarted(String batchId, int totalItems, String description) {
        return new ProgressEvent(ProgressEventType.BATCH_STARTED, batchId, description, null, null, null, totalItems, null, null);
    }

    public static ProgressEvent batchCompleted(String batchId, int successCount, int failureCount) {
        return new ProgressEvent(ProgressEventType.BATCH_COMPLETED, batchId, null, null, null, null, null, successCount, failureCount);
    }
}
