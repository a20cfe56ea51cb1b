package com.satfetch.models;

import java.time.Duration;
import java.time.Instant;

public record DownloadProgress(
        String taskId,
        String description,
        long totalSize,
        long bytesDownloaded,
        String status,
        Instant startedAt,
        Instant lastUpdated,
        Instant completedAt,
        String errorMessage
) {
    public static final String DOWNLOADING = "DOWNLOADING";
    public static final String COMPLETED = "COMPLETED";
    public static final String FAILED = "FAILED";

    public DownloadProgress {
        if (status == null) status = DOWNLOADING;
        if (startedAt == null) startedAt = Instant.now();
        if (lastUpdated == null) lastUpdated = Instant.now();
    }

    public DownloadProgress(String taskId, String description) {
        this(taskId, description, 0, 0, DOWNLOADING, Instant.now(), Instant.now(), null, null);
    }

    public DownloadProgress withTotalSize(long total) {
        return new DownloadProgress(taskId, description, total, bytesDownloaded, status,
                startedAt, Instant.now(), completedAt, errorMessage);
    }

    public DownloadProgress advance(long bytes) {
        return new DownloadProgress(taskId, description, totalSize, bytesDownloaded + bytes, status,
                startedAt, Instant.now(), completedAt, errorMessage);
    }

    public DownloadProgress complete(boolean success, String error) {
        return new DownloadProgress(taskId, description, totalSize, bytesDownloaded,
                success ? COMPLETED : FAILED, startedAt, lastUpdated, Instant.now(), error);
    }

    public double getProgressPercentage() {
        return totalSize > 0 ? (double) bytesDownloaded / totalSize * 100 : 0;
    }

    public long getDownloadSpeed() {
        Duration elapsed = Duration.between(startedAt, lastUpdated);
        long seconds = elapsed.getSeconds();
        return seconds > 0 ? bytesDownloaded / seconds : 0;
    }
}
