package com.satfetch.services;

import com.satfetch.downloaders.Downloader;
import com.satfetch.models.DownloadItem;

import java.nio.file.Path;

public class SingleFileItemDownloader implements ItemDownloader<DownloadItem> {

    private final Downloader downloader;

    public SingleFileItemDownloader(Downloader downloader) {
        this.downloader = downloader;
    }

    @Override
    public boolean downloadItem(DownloadItem item, Path destinationDir) {
        return downloader.download(item.uri(), destinationDir.resolve(item.fileName()), item.itemId());
    }
}
