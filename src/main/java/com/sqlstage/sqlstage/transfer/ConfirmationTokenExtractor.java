package com.sqlstage.sqlstage.transfer;

import com.sqlstage.sqlstage.config.SqlStageConstants;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.HttpCookie;
import java.net.http.HttpHeaders;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the download confirmation token on an interstitial page. Performs no I/O.
 * <p>
 * Lookup order: a {@code confirm=} parameter in the page's links, a form field named {@code confirm},
 * then a non-empty {@code download_warning*} cookie.
 */
public final class ConfirmationTokenExtractor {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationTokenExtractor.class);

    private static final Pattern CONFIRM_IN_URL = Pattern.compile("(?:[?&]|&amp;)confirm=([0-9A-Za-z_-]+)");

    private ConfirmationTokenExtractor() {
    }

    public static Optional<String> extract(HttpHeaders headers, String page, List<HttpCookie> cookieJar) {
        Optional<String> token = fromLinks(page);
        if (token.isEmpty()) {
            token = fromFormField(page);
        }
        if (token.isEmpty()) {
            token = fromCookies(headers, cookieJar);
        }
        return token;
    }

    static Optional<String> fromLinks(String page) {
        if (page == null || page.isEmpty()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(page);
        for (Element element : document.select("[href], [action]")) {
            String target = element.hasAttr("href") ? element.attr("href") : element.attr("action");
            Optional<String> token = confirmParam(target);
            if (token.isPresent()) {
                return token;
            }
        }
        // links built by scripts never show up as attributes
        return confirmParam(page);
    }

    static Optional<String> fromFormField(String page) {
        if (page == null || page.isEmpty()) {
            return Optional.empty();
        }
        for (Element input : Jsoup.parse(page).select("input[name=" + SqlStageConstants.CONFIRM_PARAM + "]")) {
            String value = input.attr("value").trim();
            if (!value.isEmpty()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    static Optional<String> fromCookies(HttpHeaders headers, List<HttpCookie> cookieJar) {
        List<HttpCookie> candidates = new ArrayList<>();
        if (cookieJar != null) {
            candidates.addAll(cookieJar);
        }
        if (headers != null) {
            for (String header : headers.allValues("Set-Cookie")) {
                try {
                    candidates.addAll(HttpCookie.parse(header));
                } catch (IllegalArgumentException ex) {
                    log.debug("Ignoring malformed Set-Cookie header: {}", ex.getMessage());
                }
            }
        }
        for (HttpCookie cookie : candidates) {
            String value = cookie.getValue();
            if (cookie.getName().startsWith(SqlStageConstants.DOWNLOAD_WARNING_COOKIE_PREFIX)
                    && value != null && !value.isEmpty()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> confirmParam(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = CONFIRM_IN_URL.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
