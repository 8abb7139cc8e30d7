package com.sqlstage.sqlstage.transfer;

import com.sqlstage.sqlstage.cache.AtomicFiles;
import com.sqlstage.sqlstage.config.SqlStageConstants;
import com.sqlstage.sqlstage.config.SqlStageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.CookieHandler;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Single HTTP(S) fetch into a local cache path with a cache short-circuit and atomic replace.
 */
@Service
public class TransferService {

    private static final Logger log = LoggerFactory.getLogger(TransferService.class);

    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public TransferService(SqlStageProperties properties) {
        this.connectTimeout = properties.getTransfer().getConnectTimeout();
        this.requestTimeout = properties.getTransfer().getRequestTimeout();
        this.httpClient = newClient(null);
    }

    /**
     * Returns {@code destination} untouched when it already exists and {@code force} is false; otherwise downloads
     * {@code url} into it.
     */
    public Path fetch(String url, Path destination, boolean force) {
        if (!force && Files.exists(destination)) {
            log.info("Using cached {}", destination);
            return destination;
        }
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException ex) {
            throw new TransferException(SqlStageConstants.MSG_HTTP_IO.formatted(url), ex);
        }
        log.info("Downloading {} -> {}", url, destination);
        HttpResponse<InputStream> response = send(httpClient, request(uri), url);
        return saveResponse(response, url, destination);
    }

    /**
     * Builds a client sharing this service's timeouts; a non-null cookie handler makes it a session.
     */
    HttpClient newClient(CookieHandler cookieHandler) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (cookieHandler != null) {
            builder.cookieHandler(cookieHandler);
        }
        return builder.build();
    }

    /**
     * The timeout bounds the wait for response headers only; streaming the body is unbounded.
     */
    HttpRequest request(URI uri) {
        return HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .GET()
                .build();
    }

    /**
     * Sends the request and fails with the status code on any non-2xx response.
     */
    HttpResponse<InputStream> send(HttpClient client, HttpRequest request, String label) {
        HttpResponse<InputStream> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException ex) {
            throw new TransferException(SqlStageConstants.MSG_HTTP_IO.formatted(label), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransferException(SqlStageConstants.MSG_HTTP_IO.formatted(label), ex);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            TransferException failure = new TransferException(
                    SqlStageConstants.MSG_HTTP_STATUS.formatted(status, label), status);
            discard(response, failure);
            throw failure;
        }
        return response;
    }

    Path saveResponse(HttpResponse<InputStream> response, String label, Path destination) {
        try (InputStream body = response.body()) {
            AtomicFiles.write(body, destination);
            log.info("Saved {} ({} bytes)", destination, Files.size(destination));
            return destination;
        } catch (IOException ex) {
            throw new TransferException(SqlStageConstants.MSG_HTTP_IO.formatted(label), ex);
        }
    }

    static void discard(HttpResponse<InputStream> response, RuntimeException failure) {
        try {
            response.body().close();
        } catch (IOException ex) {
            failure.addSuppressed(ex);
        }
    }
}
