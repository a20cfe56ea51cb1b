package com.satfetch.downloaders;

import com.satfetch.auth.Authenticator;
import com.satfetch.config.DownloaderProperties;
import com.satfetch.events.EventSink;
import com.satfetch.events.ProgressEvent;
import com.satfetch.models.DownloadTask;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Retry loop shared by the transport specific downloaders.
 * <p>
 * Each call emits {@code task_created}, at most one {@code task_duration}, {@code task_progress}
 * per chunk and exactly one {@code task_completed}. Progress is reported against a high-water mark
 * kept across attempts, so the advances of a task add up to the size of the file it leaves behind.
 * Bytes go to a {@code .part} sibling which is moved over the destination once the body is complete.
 *
 * @param <A> resolved form of an object address
 */
@Slf4j
public abstract class AbstractDownloader<A> implements Downloader {

    static final String PART_SUFFIX = ".part";

    protected final Authenticator authenticator;
    protected final DownloaderProperties properties;
    protected final EventSink events;

    protected AbstractDownloader(Authenticator authenticator, DownloaderProperties properties, EventSink events) {
        if (authenticator == null) {
            throw new IllegalArgumentException("Authenticator cannot be null");
        }
        this.authenticator = authenticator;
        this.properties = properties != null ? properties : DownloaderProperties.defaults();
        this.events = events != null ? events : EventSink.NOOP;
    }

    protected abstract String description();

    protected abstract boolean isInitialized();

    // throws InvalidAddressException when the address can never be fetched by this transport
    protected abstract A resolveAddress(String uri);

    // one request for the address, body streamed to destination; returns bytes written
    protected abstract long transfer(A address, Path destination, TaskReport report) throws IOException;

    @Override
    public boolean download(String uri, Path destination, String itemId) {
        DownloadTask task = new DownloadTask(uri, destination, itemId);
        String taskId = task.taskId();

        log.debug("Downloading resource {} into: {}", uri, destination);
        events.emit(ProgressEvent.taskCreated(taskId, description()));

        if (!isInitialized()) {
            log.error("{} not initialized, call init() first", getClass().getSimpleName());
            return fail(taskId, "not initialized");
        }

        A address;
        try {
            address = resolveAddress(uri);
        } catch (InvalidAddressException e) {
            log.error("Invalid address {}: {}", uri, e.getMessage());
            return fail(taskId, "invalid address: " + e.getMessage());
        }

        TaskReport report = new TaskReport(taskId);
        String error = "";
        int maxRetries = properties.maxRetries();
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            if (Thread.currentThread().isInterrupted() || (attempt > 1 && !backoff(attempt - 1))) {
                log.debug("Download of {} interrupted before attempt {}", uri, attempt);
                error = "interrupted";
                break;
            }
            if (!authenticator.ensureAuthenticated()) {
                log.error("Authentication failed on attempt {}", attempt);
                error = "authentication failed";
                continue;
            }
            try {
                log.debug("Downloading {} (attempt {}/{})", uri, attempt, maxRetries);
                long bytes = transferWithRefresh(address, destination, report);
                log.debug("Successfully downloaded {} ({} bytes)", uri, bytes);
                events.emit(ProgressEvent.taskCompleted(taskId, true, null));
                return true;
            } catch (ObjectNotFoundException e) {
                log.error("Object not found: {} ({})", uri, e.getMessage());
                error = "not found: " + e.getMessage();
                break;
            } catch (TransferCancelledException e) {
                log.debug("Download of {} cancelled: {}", uri, e.getMessage());
                error = "interrupted";
                break;
            } catch (SocketTimeoutException e) {
                log.debug("Timeout downloading {} on attempt {}", uri, attempt);
                error = "timed out";
            } catch (IOException e) {
                log.debug("Error downloading {} on attempt {}: {}", uri, attempt, e.getMessage());
                error = e.getMessage();
            }
        }
        log.warn("Failed to download {}: {}", uri, error);
        return fail(taskId, error);
    }

    // on an authorization failure, refresh once and repeat the request within the same attempt
    private long transferWithRefresh(A address, Path destination, TaskReport report) throws IOException {
        try {
            return transfer(address, destination, report);
        } catch (AuthorizationFailedException e) {
            log.warn("Authorization failed ({}), attempting to refresh credentials", e.getMessage());
            if (!authenticator.ensureAuthenticated(true)) {
                throw new AuthorizationFailedException("credential refresh failed", e);
            }
            return transfer(address, destination, report);
        }
    }

    protected long streamToFile(InputStream body, Path destination, TaskReport report) throws IOException {
        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path partFile = destination.resolveSibling(destination.getFileName() + PART_SUFFIX);
        long written = 0;
        byte[] buffer = new byte[properties.chunkSize()];
        try (FileChannel channel = FileChannel.open(partFile,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            int read;
            while ((read = body.readNBytes(buffer, 0, buffer.length)) > 0) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new TransferCancelledException("interrupted after " + written + " bytes");
                }
                ByteBuffer chunk = ByteBuffer.wrap(buffer, 0, read);
                while (chunk.hasRemaining()) {
                    channel.write(chunk);
                }
                written += read;
                report.advanceTo(written);
            }
        } catch (IOException e) {
            Files.deleteIfExists(partFile);
            throw e;
        }
        Files.move(partFile, destination, StandardCopyOption.REPLACE_EXISTING);
        return written;
    }

    // progress bookkeeping of one task across its attempts
    protected final class TaskReport {

        private final String taskId;
        private boolean sizeReported;
        // bytes already announced through task_progress
        private long reported;

        TaskReport(String taskId) {
            this.taskId = taskId;
        }

        // task_duration is sent once, by the first attempt that learns the size
        public void reportSize(Long size) {
            if (!sizeReported && size != null && size >= 0) {
                sizeReported = true;
                events.emit(ProgressEvent.taskDuration(taskId, size));
            }
        }

        // a retried body only reports the bytes beyond what earlier attempts already announced
        void advanceTo(long written) {
            if (written > reported) {
                events.emit(ProgressEvent.taskProgress(taskId, written - reported));
                reported = written;
            }
        }
    }

    private boolean fail(String taskId, String error) {
        events.emit(ProgressEvent.taskCompleted(taskId, false, "failed: " + error));
        return false;
    }

    // Exponential backoff before the next attempt; false when interrupted while waiting
    private boolean backoff(int failedAttempts) {
        long base = properties.retryBackoffMillis();
        if (base <= 0) {
            return true;
        }
        try {
            Thread.sleep(base * (1L << Math.min(failedAttempts - 1, 6)));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
