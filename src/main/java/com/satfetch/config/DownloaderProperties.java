package com.satfetch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "satfetch.download")
public record DownloaderProperties(
        Transport transport,
        int maxRetries,
        int chunkSize,
        int timeoutSeconds,
        int poolConnections,
        int poolMaxSize,
        String endpointUrl,
        String regionName,
        Long retryBackoffMillis
) {
    public enum Transport {
        HTTP,
        S3
    }

    public DownloaderProperties {
        if (transport == null) transport = Transport.HTTP;
        if (maxRetries <= 0) maxRetries = 3;
        if (chunkSize <= 0) chunkSize = 8192; // 8KB
        if (timeoutSeconds <= 0) timeoutSeconds = 30;
        if (poolConnections <= 0) poolConnections = 10;
        if (poolMaxSize <= 0) poolMaxSize = 2;
        if (retryBackoffMillis == null || retryBackoffMillis < 0) retryBackoffMillis = 1000L;
    }

    public static DownloaderProperties defaults() {
        return new DownloaderProperties(null, 0, 0, 0, 0, 0, null, null, null);
    }

    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public DownloaderProperties withMaxRetries(int retries) {
        return new DownloaderProperties(transport, retries, chunkSize, timeoutSeconds, poolConnections,
                poolMaxSize, endpointUrl, regionName, retryBackoffMillis);
    }

    public DownloaderProperties withRetryBackoffMillis(long backoff) {
        return new DownloaderProperties(transport, maxRetries, chunkSize, timeoutSeconds, poolConnections,
                poolMaxSize, endpointUrl, regionName, backoff);
    }
}
