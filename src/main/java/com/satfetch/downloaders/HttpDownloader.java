package com.satfetch.downloaders;

import com.satfetch.auth.Authenticator;
import com.satfetch.config.DownloaderProperties;
import com.satfetch.events.EventSink;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

// poolMaxSize caps concurrent transfers per host, poolConnections caps idle pooled connections
@Slf4j
public class HttpDownloader extends AbstractDownloader<HttpUrl> {

    private volatile OkHttpClient httpClient;
    private boolean ownsClient;
    // per host:port transfer slots
    private final Map<String, Semaphore> hostSlots = new ConcurrentHashMap<>();

    public HttpDownloader(Authenticator authenticator, DownloaderProperties properties, EventSink events) {
        super(authenticator, properties, events);
    }

    @Override
    public synchronized void init() {
        if (httpClient != null) {
            log.debug("HTTP client already initialized");
            return;
        }
        httpClient = new OkHttpClient.Builder()
                .connectionPool(new ConnectionPool(properties.poolConnections(), 5, TimeUnit.MINUTES))
                .connectTimeout(properties.timeout())
                .readTimeout(properties.timeout())
                .writeTimeout(properties.timeout())
                .retryOnConnectionFailure(true)
                .build();
        ownsClient = true;
        log.debug("Initialized HTTP client (pool {} connections, {} per host, timeout {}s)",
                properties.poolConnections(), properties.poolMaxSize(), properties.timeoutSeconds());
    }

    public synchronized void init(OkHttpClient client) {
        if (client == null) {
            throw new IllegalArgumentException("HTTP client cannot be null");
        }
        httpClient = client;
        ownsClient = false;
    }

    @Override
    protected String description() {
        return "download";
    }

    @Override
    protected boolean isInitialized() {
        return httpClient != null;
    }

    @Override
    protected HttpUrl resolveAddress(String uri) {
        HttpUrl url = uri == null ? null : HttpUrl.parse(uri);
        if (url == null) {
            throw new InvalidAddressException("not an HTTP(S) URL: " + uri);
        }
        return url;
    }

    @Override
    protected long transfer(HttpUrl url, Path destination, TaskReport report) throws IOException {
        Semaphore slots = hostSlots.computeIfAbsent(url.host() + ":" + url.port(),
                host -> new Semaphore(properties.poolMaxSize(), true));
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferCancelledException("interrupted while waiting for a connection to " + url.host());
        }
        try {
            return execute(url, destination, report);
        } finally {
            slots.release();
        }
    }

    private long execute(HttpUrl url, Path destination, TaskReport report) throws IOException {
        Request.Builder request = new Request.Builder().url(url).get();
        authenticator.authHeaders().forEach(request::header);

        try (Response response = httpClient.newCall(request.build()).execute()) {
            int code = response.code();
            if (code == 401 || code == 403) {
                throw new AuthorizationFailedException("HTTP " + code);
            }
            if (code == 404 || code == 410) {
                throw new ObjectNotFoundException("HTTP " + code);
            }
            if (!response.isSuccessful()) {
                throw new TransferException("HTTP " + code);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new TransferException("empty response body");
            }
            report.reportSize(body.contentLength());
            try (InputStream in = body.byteStream()) {
                return streamToFile(in, destination, report);
            }
        }
    }

    @Override
    public synchronized void close() {
        OkHttpClient client = httpClient;
        httpClient = null;
        if (client != null && ownsClient) {
            client.dispatcher().executorService().shutdown();
            client.connectionPool().evictAll();
            log.debug("HTTP client closed");
        }
    }
}
