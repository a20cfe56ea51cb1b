package com.satfetch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "satfetch.batch")
public record BatchProperties(
        int concurrency,
        String threadNamePrefix,
        int cancelGraceSeconds,
        long pollIntervalMillis
) {
    public BatchProperties {
        if (concurrency <= 0) concurrency = 1;
        if (threadNamePrefix == null) threadNamePrefix = "satfetch-download-";
        if (cancelGraceSeconds <= 0) cancelGraceSeconds = 30;
        if (pollIntervalMillis <= 0) pollIntervalMillis = 200;
    }

    public static BatchProperties defaults() {
        return new BatchProperties(0, null, 0, 0);
    }
}
