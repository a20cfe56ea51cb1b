package com.satfetch.services;

import com.satfetch.downloaders.Downloader;
import com.satfetch.models.DownloadItem;
import com.satfetch.models.Granule;
import com.satfetch.models.GranuleAsset;
import com.satfetch.utils.ArchiveExtractor;
import com.satfetch.utils.GranuleMetadataWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class GranuleItemDownloader implements ItemDownloader<Granule> {

    private final Downloader downloader;
    private final GranuleMetadataWriter metadataWriter;
    private final ArchiveExtractor archiveExtractor;
    private final boolean extractArchives;

    public GranuleItemDownloader(Downloader downloader, GranuleMetadataWriter metadataWriter,
                                 ArchiveExtractor archiveExtractor, boolean extractArchives) {
        this.downloader = downloader;
        this.metadataWriter = metadataWriter;
        this.archiveExtractor = archiveExtractor;
        this.extractArchives = extractArchives;
    }

    @Override
    public boolean downloadItem(Granule granule, Path destinationDir) {
        if (granule.assets().isEmpty()) {
            log.warn("Granule {} has no assets to download", granule.granuleId());
            return false;
        }
        Path granuleDir = destinationDir.resolve(granule.granuleId());
        boolean allSuccess = true;

        for (Map.Entry<String, GranuleAsset> entry : granule.assets().entrySet()) {
            String assetName = entry.getKey();
            GranuleAsset asset = entry.getValue();
            if (asset == null || asset.href() == null) {
                log.warn("Missing asset '{}' for granule {}", assetName, granule.granuleId());
                allSuccess = false;
                continue;
            }
            String itemId = granule.granuleId() + "_" + assetName;
            Path target = granuleDir.resolve(fileName(asset.href(), assetName));
            if (!downloader.download(asset.href(), target, itemId)) {
                log.warn("Failed to download asset {} for granule {}", assetName, granule.granuleId());
                allSuccess = false;
                continue;
            }
            if (extractArchives && target.getFileName().toString().endsWith(".zip")) {
                allSuccess &= unpack(target, granuleDir, itemId);
            }
        }

        // a directory holding _granule.json is always complete
        if (!allSuccess) {
            log.warn("Failed to download all required assets for: {}", granule.granuleId());
            return false;
        }
        try {
            log.debug("Saving granule metadata to: {}", granuleDir);
            metadataWriter.write(granule, granuleDir);
            return true;
        } catch (IOException e) {
            log.error("Could not write metadata for {}: {}", granule.granuleId(), e.getMessage());
            return false;
        }
    }

    private boolean unpack(Path archive, Path targetDir, String itemId) {
        try {
            archiveExtractor.extract(archive, targetDir, itemId);
            Files.deleteIfExists(archive);
            return true;
        } catch (IOException e) {
            log.warn("Could not extract {}: {}", archive, e.getMessage());
            return false;
        }
    }

    static String fileName(String href, String fallback) {
        String path = href;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        return DownloadItem.isPlainFileName(name) ? name : fallback;
    }
}
