package com.satfetch.downloaders;

import com.satfetch.auth.CountingAuthenticator;
import com.satfetch.config.DownloaderProperties;
import com.satfetch.events.ProgressEvent;
import com.satfetch.events.ProgressEventType;
import com.satfetch.events.RecordingEventSink;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.satfetch.events.ProgressEventType.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class HttpDownloaderTest {

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private CountingAuthenticator authenticator;
    private RecordingEventSink events;
    private HttpDownloader downloader;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        authenticator = new CountingAuthenticator();
        events = new RecordingEventSink();
        downloader = new HttpDownloader(authenticator, properties(3, 5), events);
        downloader.init();
    }

    @AfterEach
    void tearDown() throws IOException {
        downloader.close();
        server.shutdown();
    }

    private static DownloaderProperties properties(int maxRetries, int timeoutSeconds) {
        return properties(maxRetries, timeoutSeconds, 2);
    }

    private static DownloaderProperties properties(int maxRetries, int timeoutSeconds, int poolMaxSize) {
        return new DownloaderProperties(DownloaderProperties.Transport.HTTP, maxRetries, 8192, timeoutSeconds,
                10, poolMaxSize, null, null, 0L);
    }

    private static MockResponse body(int size) {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) i;
        }
        return new MockResponse().setBody(new Buffer().write(data));
    }

    private String url(String path) {
        return server.url(path).toString();
    }

    @Test
    void streamsBodyInChunksAndReportsProgress() throws Exception {
        server.enqueue(body(24576));
        Path destination = tempDir.resolve("S2A_MSIL1C.zip");

        assertTrue(downloader.download(url("/products/S2A_MSIL1C.zip"), destination, "p1"));

        assertEquals(24576, Files.size(destination));
        assertFalse(Files.exists(tempDir.resolve("S2A_MSIL1C.zip.part")));
        assertEquals(List.of(TASK_CREATED, TASK_DURATION, TASK_PROGRESS, TASK_PROGRESS, TASK_PROGRESS, TASK_COMPLETED),
                events.typesFor("download_p1"));
        List<ProgressEvent> taskEvents = events.forTask("download_p1");
        assertEquals("download", taskEvents.get(0).description());
        assertEquals(24576L, taskEvents.get(1).duration());
        for (ProgressEvent progress : taskEvents.subList(2, 5)) {
            assertEquals(8192L, progress.advance());
        }
        assertTrue(taskEvents.get(5).success());
        assertEquals("Bearer token-1", server.takeRequest().getHeader("Authorization"));
    }

    @Test
    void progressAddsUpToFileSizeForUnevenBodies() throws Exception {
        server.enqueue(body(20000));
        Path destination = tempDir.resolve("granule.nc");

        assertTrue(downloader.download(url("/granule.nc"), destination, "g"));

        assertEquals(20000, Files.size(destination));
        assertEquals(20000, events.progressSum("download_g"));
    }

    @Test
    void serverErrorsAreRetriedUpToTheLimit() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(500));
        }

        assertFalse(downloader.download(url("/flaky"), tempDir.resolve("flaky.bin"), "f"));

        assertEquals(3, server.getRequestCount());
        assertEquals(1, events.count(TASK_COMPLETED));
        ProgressEvent completed = events.forTask("download_f").get(events.forTask("download_f").size() - 1);
        assertFalse(completed.success());
        assertEquals("failed: HTTP 500", completed.description());
        assertFalse(Files.exists(tempDir.resolve("flaky.bin")));
    }

    @Test
    void transientErrorThenSuccess() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(body(100));

        assertTrue(downloader.download(url("/retry"), tempDir.resolve("retry.bin"), "r"));

        assertEquals(2, server.getRequestCount());
        assertEquals(100, Files.size(tempDir.resolve("retry.bin")));
        assertEquals(1, events.count(TASK_CREATED));
    }

    @Test
    void missingObjectIsNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(body(10));

        assertFalse(downloader.download(url("/missing"), tempDir.resolve("missing.bin"), "m"));

        assertEquals(1, server.getRequestCount());
        List<ProgressEvent> taskEvents = events.forTask("download_m");
        assertEquals("failed: not found: HTTP 404", taskEvents.get(taskEvents.size() - 1).description());
    }

    @Test
    void unauthorizedResponseRefreshesCredentialsOnce() throws Exception {
        CountingAuthenticator spied = spy(new CountingAuthenticator());
        HttpDownloader refreshing = new HttpDownloader(spied, properties(3, 5), events);
        refreshing.init();
        server.enqueue(new MockResponse().setResponseCode(401));
        server.enqueue(body(64));

        try {
            assertTrue(refreshing.download(url("/protected"), tempDir.resolve("protected.bin"), "a"));
        } finally {
            refreshing.close();
        }

        verify(spied, times(1)).ensureAuthenticated(true);
        assertEquals("Bearer token-1", server.takeRequest().getHeader("Authorization"));
        assertEquals("Bearer token-2", server.takeRequest().getHeader("Authorization"));
        assertEquals(1, events.count(TASK_COMPLETED));
    }

    @Test
    void failedAuthenticationSendsNoRequest() {
        authenticator.setFailing(true);

        assertFalse(downloader.download(url("/any"), tempDir.resolve("any.bin"), "x"));

        assertEquals(0, server.getRequestCount());
        List<ProgressEvent> taskEvents = events.forTask("download_x");
        assertEquals("failed: authentication failed", taskEvents.get(taskEvents.size() - 1).description());
        assertEquals(3, authenticator.exchanges());
    }

    @Test
    void uninitializedDownloaderFailsWithoutRequest() {
        HttpDownloader fresh = new HttpDownloader(authenticator, properties(3, 5), events);

        assertFalse(fresh.download(url("/any"), tempDir.resolve("any.bin"), "u"));

        assertEquals(0, server.getRequestCount());
        assertEquals(List.of(TASK_CREATED, TASK_COMPLETED), events.typesFor("download_u"));
        assertEquals("failed: not initialized", events.forTask("download_u").get(1).description());
    }

    @Test
    void invalidUrlFailsBeforeAnyAttempt() {
        assertFalse(downloader.download("ftp://example.org/file", tempDir.resolve("file"), "bad"));

        assertEquals(0, authenticator.exchanges());
        assertTrue(events.forTask("download_bad").get(1).description().startsWith("failed: invalid address"));
    }

    @Test
    void slowServerTimesOut() {
        HttpDownloader impatient = new HttpDownloader(authenticator, properties(1, 1), events);
        impatient.init();
        server.enqueue(body(10).setHeadersDelay(3, TimeUnit.SECONDS));

        try {
            assertFalse(impatient.download(url("/slow"), tempDir.resolve("slow.bin"), "slow"));
        } finally {
            impatient.close();
        }

        List<ProgressEvent> taskEvents = events.forTask("download_slow");
        assertEquals("failed: timed out", taskEvents.get(taskEvents.size() - 1).description());
    }

    @Test
    void initTwiceKeepsWorkingClient() throws Exception {
        downloader.init();
        server.enqueue(body(1));

        assertTrue(downloader.download(url("/one"), tempDir.resolve("one.bin"), "one"));
    }

    @Test
    void eventTypesNeverRepeatCompletion() {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(404));

        downloader.download(url("/x"), tempDir.resolve("x.bin"), "twice");

        assertEquals(1, events.typesFor("download_twice").stream().filter(t -> t == ProgressEventType.TASK_COMPLETED).count());
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void droppedBodyIsRetriedWithoutOvercountingProgress() throws Exception {
        server.enqueue(body(24576)
                .throttleBody(4096, 20, TimeUnit.MILLISECONDS)
                .setSocketPolicy(SocketPolicy.DISCONNECT_DURING_RESPONSE_BODY));
        server.enqueue(body(24576));
        Path destination = tempDir.resolve("dropped.bin");

        assertTrue(downloader.download(url("/dropped.bin"), destination, "dropped"));

        assertEquals(2, server.getRequestCount());
        assertEquals(24576, Files.size(destination));
        assertEquals(24576, events.progressSum("download_dropped"));
        List<ProgressEventType> types = events.typesFor("download_dropped");
        assertEquals(1, types.stream().filter(t -> t == TASK_DURATION).count());
        assertEquals(TASK_CREATED, types.get(0));
        assertEquals(TASK_COMPLETED, types.get(types.size() - 1));
    }

    @Test
    void poolMaxSizeLimitsConcurrentTransfersPerHost() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(300);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    inFlight.decrementAndGet();
                }
                return body(512);
            }
        });
        HttpDownloader single = new HttpDownloader(authenticator, properties(1, 5, 1), events);
        single.init();
        ExecutorService workers = Executors.newFixedThreadPool(4);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                String name = "part-" + i + ".bin";
                results.add(workers.submit(() -> single.download(url("/" + name), tempDir.resolve(name), name)));
            }
            for (Future<Boolean> result : results) {
                assertTrue(result.get(30, TimeUnit.SECONDS));
            }
        } finally {
            workers.shutdownNow();
            single.close();
        }

        assertEquals(4, server.getRequestCount());
        assertEquals(1, maxInFlight.get());
    }
}
