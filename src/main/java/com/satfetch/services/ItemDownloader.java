package com.satfetch.services;

import java.nio.file.Path;

@FunctionalInterface
public interface ItemDownloader<T> {

    boolean downloadItem(T item, Path destinationDir);
}
