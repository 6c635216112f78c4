package org.xgen.generators;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File system and network access for schema input and generated output.
 */
public final class SchemaSources {

    private static final Logger logger = LoggerFactory.getLogger(SchemaSources.class);

    private static final HttpClient HTTP = HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(Duration.ofSeconds(30))
        .build();

    private SchemaSources() {}

    /**
     * Fetch a schema over HTTP. Any status other than 200 yields an empty body,
     * not an error; transport failures are thrown.
     */
    public static byte[] fetchSchema(String url) throws IOException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(new URI(url)).GET().build();
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new IOException("Invalid schema URL: " + url, e);
        }
        try {
            HttpResponse<byte[]> response = HTTP.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() != 200) {
                logger.warn("GET {} returned HTTP {}, using empty body", url, response.statusCode());
                return new byte[0];
            }
            return response.body();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while fetching " + url);
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    /**
     * True when {@code candidate} is an absolute URL with both scheme and host.
     */
    public static boolean isValidUrl(String candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return false;
        }
        try {
            URI uri = new URI(candidate);
            return uri.getScheme() != null && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * A regular file yields itself; a directory yields every regular file
     * beneath it, sorted by path.
     */
    public static List<Path> listFiles(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        if (!Files.isDirectory(path)) {
            return List.of(path);
        }
        try (Stream<Path> walk = Files.walk(path)) {
            return walk.filter(Files::isRegularFile)
                .sorted()
                .collect(Collectors.toList());
        }
    }

    /**
     * Ensure {@code dir} exists, creating parents as needed. {@code null} or an
     * empty path is a no-op.
     */
    public static void prepareOutputDir(Path dir) throws IOException {
        if (dir == null || dir.toString().isEmpty()) {
            return;
        }
        if (!Files.exists(dir)) {
            Files.createDirectories(dir);
            logger.debug("Created output directory {}", dir);
        }
    }

    public static void prepareOutputDir(String dir) throws IOException {
        if (dir == null || dir.isEmpty()) {
            return;
        }
        prepareOutputDir(Path.of(dir));
    }
}
