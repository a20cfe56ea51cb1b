package com.satfetch.utils;

import com.satfetch.events.EventSink;
import com.satfetch.events.ProgressEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

@Slf4j
public class ArchiveExtractor {

    private static final int BUFFER_SIZE = 8192;

    private final EventSink events;

    public ArchiveExtractor(EventSink events) {
        this.events = events != null ? events : EventSink.NOOP;
    }

    public Path extract(Path zipPath, Path targetDir, String itemId) throws IOException {
        String taskId = "extract_" + itemId;
        Path root = targetDir.toAbsolutePath().normalize();
        events.emit(ProgressEvent.taskCreated(taskId, "extract"));
        try (ZipFile zip = new ZipFile(zipPath.toFile())) {
            List<? extends ZipEntry> entries = Collections.list(zip.entries());
            long totalSize = entries.stream()
                    .filter(entry -> !entry.isDirectory())
                    .mapToLong(ZipEntry::getSize)
                    .filter(size -> size > 0)
                    .sum();
            events.emit(ProgressEvent.taskDuration(taskId, totalSize));

            byte[] buffer = new byte[BUFFER_SIZE];
            for (ZipEntry entry : entries) {
                Path target = root.resolve(entry.getName()).normalize();
                // zip slip
                if (!target.startsWith(root)) {
                    throw new IOException("Zip entry outside target directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());
                try (InputStream in = zip.getInputStream(entry); OutputStream out = Files.newOutputStream(target)) {
                    int read;
                    while ((read = in.read(buffer)) > 0) {
                        out.write(buffer, 0, read);
                        events.emit(ProgressEvent.taskProgress(taskId, read));
                    }
                }
            }
            log.debug("Extracted {} entries from {} into {}", entries.size(), zipPath, root);
            events.emit(ProgressEvent.taskCompleted(taskId, true, null));
            return root;
        } catch (IOException e) {
            events.emit(ProgressEvent.taskCompleted(taskId, false, "failed: " + e.getMessage()));
            throw e;
        }
    }
}
