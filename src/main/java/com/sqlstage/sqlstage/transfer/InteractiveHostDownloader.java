package com.sqlstage.sqlstage.transfer;

import com.sqlstage.sqlstage.config.SqlStageConstants;
import com.sqlstage.sqlstage.config.SqlStageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Downloads from file hosts that answer large-file requests with an HTML "confirm download" page.
 * <p>
 * The first request goes to the canonical download endpoint. An HTML answer is treated as the confirmation page:
 * the token is read from it and the request is repeated on the same cookie session with {@code confirm=<token>}.
 */
@Component
public class InteractiveHostDownloader {

    private static final Logger log = LoggerFactory.getLogger(InteractiveHostDownloader.class);

    private static final Pattern FILE_PATH_ID = Pattern.compile("/file/d/([A-Za-z0-9_-]+)");
    private static final Pattern CHARSET = Pattern.compile("charset=\"?([^;\"]+)\"?", Pattern.CASE_INSENSITIVE);

    private final TransferService transferService;
    private final String endpoint;

    public InteractiveHostDownloader(TransferService transferService, SqlStageProperties properties) {
        this.transferService = transferService;
        this.endpoint = properties.getTransfer().getInteractiveEndpoint();
    }

    public Path download(String url, Path destination, boolean force) {
        if (!force && Files.exists(destination)) {
            log.info("Using cached {}", destination);
            return destination;
        }

        String fileId = extractFileId(url);
        log.info("Downloading from interactive host: id={} -> {}", fileId, destination);

        CookieManager cookies = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        HttpClient session = transferService.newClient(cookies);

        HttpResponse<InputStream> first = transferService.send(session, transferService.request(downloadUri(fileId, null)), url);
        if (!isHtml(first)) {
            return transferService.saveResponse(first, url, destination);
        }

        String page = readPage(first, url);
        Optional<String> token = ConfirmationTokenExtractor.extract(
                first.headers(), page, cookies.getCookieStore().getCookies());
        if (token.isEmpty()) {
            throw new ConfirmationTokenMissingException(SqlStageConstants.MSG_NO_CONFIRM_TOKEN.formatted(fileId));
        }
        log.debug("Confirmation page for id={}, repeating request with token", fileId);

        HttpResponse<InputStream> second = transferService.send(
                session, transferService.request(downloadUri(fileId, token.get())), url);
        if (isHtml(second)) {
            PermissionDeniedException denied =
                    new PermissionDeniedException(SqlStageConstants.MSG_PERMISSION_DENIED.formatted(fileId));
            TransferService.discard(second, denied);
            throw denied;
        }
        return transferService.saveResponse(second, url, destination);
    }

    /**
     * Reads the file id from the {@code id} query parameter or a {@code /file/d/<id>} path segment.
     */
    public static String extractFileId(String url) {
        if (url == null || url.isBlank()) {
            throw new IdentifierException(SqlStageConstants.MSG_NO_FILE_ID.formatted(url));
        }
        String fromQuery;
        try {
            fromQuery = UriComponentsBuilder.fromUriString(url).build()
                    .getQueryParams().getFirst(SqlStageConstants.ID_PARAM);
        } catch (IllegalArgumentException ex) {
            throw new IdentifierException(SqlStageConstants.MSG_NO_FILE_ID.formatted(url), ex);
        }
        if (fromQuery != null && !fromQuery.isBlank()) {
            return fromQuery;
        }
        Matcher matcher = FILE_PATH_ID.matcher(url);
        if (matcher.find()) {
            return matcher.group(1);
        }
        throw new IdentifierException(SqlStageConstants.MSG_NO_FILE_ID.formatted(url));
    }

    private URI downloadUri(String fileId, String confirmToken) {
        return UriComponentsBuilder.fromUriString(endpoint)
                .queryParam("export", "download")
                .queryParam(SqlStageConstants.ID_PARAM, fileId)
                .queryParamIfPresent(SqlStageConstants.CONFIRM_PARAM, Optional.ofNullable(confirmToken))
                .encode()
                .build()
                .toUri();
    }

    private static boolean isHtml(HttpResponse<?> response) {
        return contentType(response).toLowerCase(Locale.ROOT).contains(SqlStageConstants.CONTENT_TYPE_HTML);
    }

    private static String contentType(HttpResponse<?> response) {
        return response.headers().firstValue("Content-Type").orElse("");
    }

    private static String readPage(HttpResponse<InputStream> response, String label) {
        try (InputStream body = response.body()) {
            return new String(body.readAllBytes(), charsetOf(contentType(response)));
        } catch (IOException ex) {
            throw new TransferException(SqlStageConstants.MSG_HTTP_IO.formatted(label), ex);
        }
    }

    private static Charset charsetOf(String contentType) {
        Matcher matcher = CHARSET.matcher(contentType);
        if (!matcher.find()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(matcher.group(1).trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
            return StandardCharsets.UTF_8;
        }
    }
}
