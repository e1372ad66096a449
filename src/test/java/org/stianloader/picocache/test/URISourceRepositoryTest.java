package org.stianloader.picocache.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picocache.CacheResult;
import org.stianloader.picocache.FailureKind;
import org.stianloader.picocache.SourceCache;
import org.stianloader.picocache.repo.URISourceRepository;

import com.sun.net.httpserver.HttpServer;

public class URISourceRepositoryTest {

    private final Map<String, byte[]> resources = new ConcurrentHashMap<>();
    private final AtomicInteger requests = new AtomicInteger();
    private HttpServer server;
    private URISourceRepository repository;

    @BeforeEach
    public void startServer() throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        this.server.createContext("/", (exchange) -> {
            this.requests.incrementAndGet();
            byte[] body = this.resources.get(exchange.getRequestURI().getPath());
            if (body == null) {
                exchange.sendResponseHeaders(404, -1);
                exchange.close();
                return;
            }
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        this.server.start();
        URI base = URI.create("http://" + this.server.getAddress().getHostString() + ":" + this.server.getAddress().getPort() + "/mirror");
        this.repository = new URISourceRepository("local", base, new RecordingLoggingAdapter()).setTimeouts(5_000, 5_000);
    }

    @AfterEach
    public void stopServer() {
        this.server.stop(0);
    }

    @Test
    public void testProbe() throws Exception {
        this.resources.put("/mirror/format/P1", "<a href=\"/e-print/P1\">Download source</a>".getBytes(StandardCharsets.UTF_8));
        this.resources.put("/mirror/format/P2", "<p>PDF only</p>".getBytes(StandardCharsets.UTF_8));

        assertTrue(this.repository.isAvailable("P1", Runnable::run).get());
        assertFalse(this.repository.isAvailable("P2", Runnable::run).get());
        ExecutionException e = assertThrows(ExecutionException.class, () -> this.repository.isAvailable("P3", Runnable::run).get());
        assertTrue(e.getCause() instanceof IOException);
    }

    @Test
    public void testArxivDefaults() {
        assertEquals("arxiv", URISourceRepository.arxiv().getRepositoryId());
    }

    @Test
    public void testCustomTemplates() throws Exception {
        this.resources.put("/mirror/src/P1.tar.gz", new byte[] {1, 2, 3});
        this.resources.put("/mirror/abs/P1", "has source".getBytes(StandardCharsets.UTF_8));
        this.repository.setDownloadPath("src/{key}.tar.gz").setProbe("abs/{key}", "has source");

        assertTrue(this.repository.isAvailable("P1", Runnable::run).get());
        assertEquals(3, this.repository.getSource("P1", Runnable::run).get().length);
    }

    @Test
    public void testEnsureCachedOverHttp(@TempDir Path root) throws IOException {
        this.resources.put("/mirror/format/P1", "Download source".getBytes(StandardCharsets.UTF_8));
        this.resources.put("/mirror/e-print/P1", TestArchives.tarGz().file("main.tex", TestArchives.DOCUMENT).build());
        SourceCache cache = new SourceCache(this.repository).setLogger(new RecordingLoggingAdapter());

        assertTrue(cache.ensureCached("P1", root, true, true, Duration.ofSeconds(30)));
        assertTrue(Files.isRegularFile(root.resolve("P1").resolve("main.tex")));
        assertEquals(2, this.requests.get());

        assertTrue(cache.ensureCached("P1", root, true, true, Duration.ofSeconds(30)));
        assertEquals(2, this.requests.get());
    }

    @Test
    public void testMissingDownloadIsTransferFailure(@TempDir Path root) {
        this.resources.put("/mirror/format/P1", "Download source".getBytes(StandardCharsets.UTF_8));
        SourceCache cache = new SourceCache(this.repository).setLogger(new RecordingLoggingAdapter());

        CacheResult result = cache.ensureCachedResult("P1", root, true, true, Duration.ofSeconds(30));
        assertEquals(FailureKind.TRANSFER_FAILED, result.getFailure().getKind());
        assertFalse(Files.exists(root.resolve("P1")));
    }
}
