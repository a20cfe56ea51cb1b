package com.satfetch.downloaders;

import java.nio.file.Path;

/**
 * Transfers one addressed object to a local file.
 */
public interface Downloader extends AutoCloseable {

    /**
     * Sets up reusable transport resources. Must be called before {@link #download}.
     */
    void init();

    /**
     * Streams {@code uri} to {@code destination}, creating parent directories as needed.
     * Progress events use the task id {@code "download_" + itemId}.
     *
     * @return false once retries are exhausted or on a permanent failure
     */
    boolean download(String uri, Path destination, String itemId);

    /**
     * Releases transport resources. Safe to call without a prior {@link #init()}.
     */
    @Override
    void close();
}
