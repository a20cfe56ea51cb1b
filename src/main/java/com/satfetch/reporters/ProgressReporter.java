package com.satfetch.reporters;

import com.satfetch.events.ProgressEvent;
import com.satfetch.events.ProgressListener;

public abstract class ProgressReporter implements ProgressListener {

    public abstract void start(int totalItems);

    public abstract void addTask(String taskId, String description);

    public abstract void setTaskDuration(String taskId, long total);

    public abstract void updateProgress(String taskId, long advance);

    public abstract void endTask(String taskId, boolean success, String description);

    public abstract void stop(int successCount, int failureCount);

    @Override
    public final void onEvent(ProgressEvent event) {
        switch (event.type()) {
            case BATCH_STARTED -> start(event.totalItems());
            case TASK_CREATED -> addTask(event.taskId(), event.description());
            case TASK_DURATION -> setTaskDuration(event.taskId(), event.duration());
            case TASK_PROGRESS -> updateProgress(event.taskId(), event.advance());
            case TASK_COMPLETED -> endTask(event.taskId(), Boolean.TRUE.equals(event.success()), event.description());
            case BATCH_COMPLETED -> stop(event.successCount(), event.failureCount());
        }
    }
}
