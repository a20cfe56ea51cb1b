package com.satfetch.utils;

import com.satfetch.events.ProgressEvent;
import com.satfetch.events.ProgressListener;
import com.satfetch.models.DownloadProgress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Slf4j
@EnableScheduling
public class ProgressTracker implements ProgressListener {

    private final Map<String, DownloadProgress> activeDownloads = new ConcurrentHashMap<>();

    @Override
    public void onEvent(ProgressEvent event) {
        String taskId = event.taskId();
        switch (event.type()) {
            case TASK_CREATED -> {
                activeDownloads.put(taskId, new DownloadProgress(taskId, event.description()));
                log.debug("Tracking task {} ({})", taskId, event.description());
            }
            case TASK_DURATION -> activeDownloads.computeIfPresent(taskId,
                    (id, progress) -> progress.withTotalSize(event.duration()));
            case TASK_PROGRESS -> activeDownloads.computeIfPresent(taskId,
                    (id, progress) -> progress.advance(event.advance()));
            case TASK_COMPLETED -> {
                DownloadProgress done = activeDownloads.computeIfPresent(taskId,
                        (id, progress) -> progress.complete(Boolean.TRUE.equals(event.success()), event.description()));
                if (done != null) {
                    log.debug("Task {} {}: {} bytes at {} bytes/s", taskId, done.status(),
                            done.bytesDownloaded(), done.getDownloadSpeed());
                }
            }
            case BATCH_STARTED, BATCH_COMPLETED -> {
                // batches are not tracked per task
            }
        }
    }

    public DownloadProgress getProgress(String taskId) {
        return activeDownloads.get(taskId);
    }

    public Map<String, DownloadProgress> getAllActiveDownloads() {
        return new HashMap<>(activeDownloads);
    }

    @Scheduled(fixedRate = 300000) // Clean up every 5 minutes
    public void cleanupCompletedDownloads() {
        Instant cutoff = Instant.now().minus(Duration.ofHours(24));
        cleanupCompletedBefore(cutoff);
    }

    int cleanupCompletedBefore(Instant cutoff) {
        int before = activeDownloads.size();
        activeDownloads.entrySet().removeIf(entry -> {
            DownloadProgress progress = entry.getValue();
            return progress.completedAt() != null && progress.completedAt().isBefore(cutoff);
        });
        return before - activeDownloads.size();
    }
}
