package com.satfetch.models;

import java.nio.file.Path;

// One transfer: where from, where to, and the id used to correlate progress events
public record DownloadTask(
        String uri,
        Path destination,
        String itemId
) {
    public static final String TASK_PREFIX = "download_";

    public String taskId() {
        return TASK_PREFIX + itemId;
    }
}
