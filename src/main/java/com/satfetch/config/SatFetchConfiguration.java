package com.satfetch.config;

import com.satfetch.auth.Authenticator;
import com.satfetch.auth.EarthdataAuthenticator;
import com.satfetch.auth.EumetsatAuthenticator;
import com.satfetch.auth.ODataAuthenticator;
import com.satfetch.auth.S3Authenticator;
import com.satfetch.downloaders.Downloader;
import com.satfetch.downloaders.HttpDownloader;
import com.satfetch.downloaders.S3Downloader;
import com.satfetch.events.EventBus;
import com.satfetch.events.ProgressListener;
import com.satfetch.reporters.SimpleProgressReporter;
import com.satfetch.services.BatchDownloadService;
import com.satfetch.utils.ArchiveExtractor;
import com.satfetch.utils.GranuleMetadataWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
@Slf4j
public class SatFetchConfiguration {

    @Bean
    public SimpleProgressReporter simpleProgressReporter() {
        return new SimpleProgressReporter();
    }

    @Bean
    public EventBus eventBus(List<ProgressListener> listeners) {
        EventBus bus = new EventBus();
        listeners.forEach(bus::subscribe);
        log.debug("Event bus created with {} listeners", listeners.size());
        return bus;
    }

    @Bean
    public Authenticator authenticator(AuthProperties properties) {
        return switch (properties.type()) {
            case ODATA -> new ODataAuthenticator(properties.tokenUrl(), properties.clientId(),
                    properties.username(), properties.password());
            case EUMETSAT -> new EumetsatAuthenticator(properties.consumerKey(), properties.consumerSecret());
            case EARTHDATA -> new EarthdataAuthenticator(properties.strategy(),
                    properties.username(), properties.password());
            case S3 -> new S3Authenticator(properties.accessKey(), properties.secretKey(),
                    properties.sessionToken(), properties.endpointUrl());
        };
    }

    @Bean(destroyMethod = "close")
    public Downloader downloader(Authenticator authenticator, DownloaderProperties properties, EventBus eventBus) {
        return switch (properties.transport()) {
            case HTTP -> new HttpDownloader(authenticator, properties, eventBus);
            case S3 -> new S3Downloader(authenticator, properties, eventBus);
        };
    }

    @Bean
    public ArchiveExtractor archiveExtractor(EventBus eventBus) {
        return new ArchiveExtractor(eventBus);
    }

    @Bean
    public GranuleMetadataWriter granuleMetadataWriter() {
        return new GranuleMetadataWriter();
    }

    @Bean
    public BatchDownloadService batchDownloadService(Downloader downloader, EventBus eventBus,
                                                     BatchProperties properties) {
        return new BatchDownloadService(downloader, eventBus, properties);
    }
}
