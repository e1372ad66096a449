package org.stianloader.picocache.repo;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLConnection;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picocache.internal.ConcurrencyUtil;
import org.stianloader.picocache.logging.LoggingAdapter;

/**
 * A {@link SourceRepository} backed by plain HTTP(S) requests against a base URI.
 *
 * <p>Download and probe locations are derived from path templates in which "{key}" is replaced by the cache key.
 * A key is considered available if the probe location answers with a 2xx status code and its body contains the
 * configured marker text. The defaults mirror the layout used by arXiv.
 */
public class URISourceRepository implements SourceRepository {

    @NotNull
    public static final URI ARXIV = URI.create("https://arxiv.org/");
    @NotNull
    public static final String DEFAULT_DOWNLOAD_PATH = "e-print/{key}";
    @NotNull
    public static final String DEFAULT_PROBE_PATH = "format/{key}";
    @NotNull
    public static final String DEFAULT_PROBE_MARKER = "Download source";

    private static final String USER_AGENT = "Mozilla/5.0 (compatible; picocache)";

    @NotNull
    private final URI base;
    @NotNull
    private final String id;
    @NotNull
    private final LoggingAdapter logger;
    @NotNull
    private String downloadPath = URISourceRepository.DEFAULT_DOWNLOAD_PATH;
    @NotNull
    private String probePath = URISourceRepository.DEFAULT_PROBE_PATH;
    @NotNull
    private String probeMarker = URISourceRepository.DEFAULT_PROBE_MARKER;
    private int connectTimeoutMillis = 5_000;
    private int readTimeoutMillis = 30_000;

    public URISourceRepository(@NotNull String id, @NotNull URI base) {
        this(id, base, LoggingAdapter.getDefaultLogger());
    }

    public URISourceRepository(@NotNull String id, @NotNull URI base, @NotNull LoggingAdapter logger) {
        if (base.getPath() == null || base.getPath().isEmpty()) {
            base = base.resolve("/");
        } else if (!base.getPath().endsWith("/")) {
            base = base.resolve(base.getPath() + "/");
        }
        this.base = base;
        this.id = Objects.requireNonNull(id, "id may not be null");
        this.logger = Objects.requireNonNull(logger, "logger may not be null");
    }

    @NotNull
    public static URISourceRepository arxiv() {
        return new URISourceRepository("arxiv", URISourceRepository.ARXIV);
    }

    @NotNull
    @Contract(pure = true)
    URI resolve(@NotNull String template, @NotNull String key) {
        return this.base.resolve(template.replace("{key}", key));
    }

    @NotNull
    private URLConnection connect(@NotNull URI location) throws IOException {
        URLConnection connection = location.toURL().openConnection();
        connection.setConnectTimeout(this.connectTimeoutMillis);
        connection.setReadTimeout(this.readTimeoutMillis);
        connection.setRequestProperty("User-Agent", URISourceRepository.USER_AGENT);
        if (connection instanceof HttpURLConnection) {
            HttpURLConnection httpUrlConn = (HttpURLConnection) connection;
            if ((httpUrlConn.getResponseCode() / 100) != 2) {
                throw new IOException("Query for " + connection.getURL() + " returned with a response code of " + httpUrlConn.getResponseCode() + " (" + httpUrlConn.getResponseMessage() + ")");
            }
        }
        return connection;
    }

    protected byte @NotNull[] getResource0(@NotNull URI location) throws IOException {
        URLConnection connection = this.connect(location);
        try (InputStream is = connection.getInputStream()) {
            return is.readAllBytes();
        }
    }

    @Override
    @NotNull
    public CompletableFuture<Boolean> isAvailable(@NotNull String key, @NotNull Executor executor) {
        URI location = this.resolve(this.probePath, key);
        return ConcurrencyUtil.schedule(() -> {
            String body = new String(this.getResource0(location), StandardCharsets.UTF_8);
            return body.contains(this.probeMarker);
        }, executor);
    }

    @Override
    @NotNull
    public CompletableFuture<byte[]> getSource(@NotNull String key, @NotNull Executor executor) {
        URI location = this.resolve(this.downloadPath, key);
        return ConcurrencyUtil.schedule(() -> {
            this.logger.info(URISourceRepository.class, "Downloading {}", location);
            return this.getResource0(location);
        }, executor);
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getRepositoryId() {
        return this.id;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public URISourceRepository setDownloadPath(@NotNull String downloadPath) {
        this.downloadPath = Objects.requireNonNull(downloadPath, "downloadPath may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null, _ -> fail; !null, !null -> this")
    public URISourceRepository setProbe(@NotNull String probePath, @NotNull String probeMarker) {
        this.probePath = Objects.requireNonNull(probePath, "probePath may not be null");
        this.probeMarker = Objects.requireNonNull(probeMarker, "probeMarker may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _ -> this")
    public URISourceRepository setTimeouts(int connectTimeoutMillis, int readTimeoutMillis) {
        if (connectTimeoutMillis < 0 || readTimeoutMillis < 0) {
            throw new IllegalArgumentException("Timeouts may not be negative");
        }
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.readTimeoutMillis = readTimeoutMillis;
        return this;
    }
}
