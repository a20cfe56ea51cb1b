package com.satfetch;

import com.satfetch.auth.Authenticator;
import com.satfetch.auth.S3Authenticator;
import com.satfetch.config.BatchProperties;
import com.satfetch.config.DownloaderProperties;
import com.satfetch.downloaders.Downloader;
import com.satfetch.downloaders.HttpDownloader;
import com.satfetch.events.EventBus;
import com.satfetch.services.BatchDownloadService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "satfetch.auth.type=s3",
        "satfetch.auth.access-key=AKIDTEST",
        "satfetch.auth.secret-key=secret",
        "satfetch.download.transport=http",
        "satfetch.download.max-retries=5",
        "satfetch.batch.concurrency=4"
})
class SatFetchApplicationTests {

    @Autowired
    private Authenticator authenticator;

    @Autowired
    private Downloader downloader;

    @Autowired
    private EventBus eventBus;

    @Autowired
    private DownloaderProperties downloaderProperties;

    @Autowired
    private BatchProperties batchProperties;

    @Autowired
    private BatchDownloadService batchDownloadService;

    @Test
    void contextLoads() {
        assertInstanceOf(S3Authenticator.class, authenticator);
        assertInstanceOf(HttpDownloader.class, downloader);
        assertNotNull(batchDownloadService);
    }

    @Test
    void reporterAndTrackerAreSubscribed() {
        assertTrue(eventBus.listenerCount() >= 2);
    }

    @Test
    void propertiesAreBoundWithDefaults() {
        assertEquals(5, downloaderProperties.maxRetries());
        assertEquals(8192, downloaderProperties.chunkSize());
        assertEquals(4, batchProperties.concurrency());
        assertEquals(30, batchProperties.cancelGraceSeconds());
    }
}
