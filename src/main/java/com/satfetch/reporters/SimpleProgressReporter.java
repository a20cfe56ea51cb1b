package com.satfetch.reporters;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
public class SimpleProgressReporter extends ProgressReporter {

    private final AtomicInteger totalItems = new AtomicInteger();
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();

    @Override
    public void start(int total) {
        totalItems.set(total);
        completed.set(0);
        failed.set(0);
        log.info("Tracking progress for {} items", total);
    }

    @Override
    public void addTask(String taskId, String description) {
        log.info("Started {} - {}", description, taskId);
    }

    @Override
    public void setTaskDuration(String taskId, long total) {
        // not tracked
    }

    @Override
    public void updateProgress(String taskId, long advance) {
        // no byte-level progress
    }

    @Override
    public void endTask(String taskId, boolean success, String description) {
        int done = success ? completed.incrementAndGet() + failed.get() : failed.incrementAndGet() + completed.get();
        String status = (success ? "✓ " : "✗ ") + (description != null ? description : "");
        log.info("{} - {} ({}/{}, {} remaining)", status, taskId, done, totalItems.get(),
                Math.max(totalItems.get() - done, 0));
    }

    @Override
    public void stop(int successCount, int failureCount) {
        log.info("Tracking completed: {} successful, {} failed, {} total",
                successCount, failureCount, successCount + failureCount);
    }

    public int completedCount() {
        return completed.get();
    }

    public int failedCount() {
        return failed.get();
    }
}
