package com.satfetch.services;

import com.satfetch.config.BatchProperties;
import com.satfetch.downloaders.Downloader;
import com.satfetch.events.EventSink;
import com.satfetch.events.ProgressEvent;
import com.satfetch.models.BatchResult;
import com.satfetch.models.DownloadItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Runs one download per item on a bounded worker pool and partitions the items by outcome.
 * <p>
 * Workers only report booleans; the calling thread is the single aggregator, so the result lists
 * need no locking. A failed item never aborts the batch.
 * <p>
 * Cancelling the token, or interrupting the calling thread, stops the batch: queued items are
 * never started, running downloads are interrupted and given {@code cancelGraceSeconds} to
 * report. Items that have not reported by then are counted as failures, so the two result lists
 * always cover the input exactly. {@code batch_completed} is emitted exactly once, on every path.
 */
@Slf4j
public class BatchDownloadService {

    private final Downloader downloader;
    private final EventSink events;
    private final BatchProperties properties;

    public BatchDownloadService(Downloader downloader, EventSink events, BatchProperties properties) {
        if (downloader == null) {
            throw new IllegalArgumentException("Downloader cannot be null");
        }
        this.downloader = downloader;
        this.events = events != null ? events : EventSink.NOOP;
        this.properties = properties != null ? properties : BatchProperties.defaults();
    }

    public <T extends DownloadItem> BatchResult<T> run(T item, Path destinationDir) {
        return run(List.of(item), destinationDir, 1);
    }

    public <T extends DownloadItem> BatchResult<T> run(List<T> items, Path destinationDir, int concurrency) {
        return run(items, destinationDir, concurrency, new SingleFileItemDownloader(downloader),
                "download", CancellationToken.none());
    }

    public <T> BatchResult<T> run(List<T> items, Path destinationDir, int concurrency,
                                  ItemDownloader<? super T> itemDownloader, String description,
                                  CancellationToken cancellation) {
        try {
            Files.createDirectories(destinationDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create destination directory " + destinationDir, e);
        }
        int workers = concurrency > 0 ? concurrency : properties.concurrency();
        String batchId = UUID.randomUUID().toString();
        int total = items.size();

        List<T> success = new ArrayList<>();
        List<T> failure = new ArrayList<>();
        boolean[] resolved = new boolean[total];
        BlockingQueue<Outcome> outcomes = new LinkedBlockingQueue<>();
        List<Future<?>> futures = new ArrayList<>(total);
        boolean cancelled = false;
        Throwable fatal = null;

        log.info("Starting batch {} with {} items ({} workers)", batchId, total, workers);
        events.emit(ProgressEvent.batchStarted(batchId, total, description));

        ThreadPoolTaskExecutor executor = createExecutor(workers);
        try {
            downloader.init();
            for (int i = 0; i < total; i++) {
                int index = i;
                T item = items.get(i);
                futures.add(executor.submit(() -> outcomes.add(runItem(index, item, destinationDir, itemDownloader))));
            }

            int remaining = total;
            while (remaining > 0) {
                if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
                    cancelled = true;
                    break;
                }
                Outcome outcome;
                try {
                    outcome = outcomes.poll(properties.pollIntervalMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancelled = true;
                    break;
                }
                if (outcome == null) {
                    continue;
                }
                remaining--;
                if (outcome.error() != null) {
                    fatal = outcome.error();
                    break;
                }
                route(outcome, items, resolved, success, failure);
            }
            if (cancelled) {
                log.info("Batch {} interrupted, cleaning up...", batchId);
            }
            if (cancelled || fatal != null) {
                futures.forEach(future -> future.cancel(true));
            }
        } finally {
            shutdown(executor);
            // late reports from downloads that stopped during the grace period
            Outcome late;
            while ((late = outcomes.poll()) != null) {
                if (late.error() == null) {
                    route(late, items, resolved, success, failure);
                }
            }
            for (int i = 0; i < total; i++) {
                if (!resolved[i]) {
                    failure.add(items.get(i));
                }
            }
            log.info("Batch {} completed: {} successful, {} failed", batchId, success.size(), failure.size());
            events.emit(ProgressEvent.batchCompleted(batchId, success.size(), failure.size()));
        }

        if (fatal instanceof RuntimeException) {
            throw (RuntimeException) fatal;
        }
        if (fatal instanceof Error) {
            throw (Error) fatal;
        }
        return new BatchResult<>(batchId, success, failure, cancelled);
    }

    private <T> Outcome runItem(int index, T item, Path destinationDir, ItemDownloader<? super T> itemDownloader) {
        try {
            return new Outcome(index, itemDownloader.downloadItem(item, destinationDir), null);
        } catch (RuntimeException | Error e) {
            log.error("Unexpected error downloading {}: {}", item, e.toString());
            return new Outcome(index, false, e);
        }
    }

    private static <T> void route(Outcome outcome, List<T> items, boolean[] resolved, List<T> success, List<T> failure) {
        if (resolved[outcome.index()]) {
            return;
        }
        resolved[outcome.index()] = true;
        T item = items.get(outcome.index());
        if (outcome.success()) {
            success.add(item);
        } else {
            failure.add(item);
        }
    }

    private ThreadPoolTaskExecutor createExecutor(int workers) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix(properties.threadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(properties.cancelGraceSeconds());
        executor.initialize();
        return executor;
    }

    // Interrupts whatever still runs and waits up to the grace period, even if the caller was interrupted
    private void shutdown(ThreadPoolTaskExecutor executor) {
        boolean interrupted = Thread.interrupted();
        try {
            executor.shutdown();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private record Outcome(int index, boolean success, Throwable error) {
    }
}
