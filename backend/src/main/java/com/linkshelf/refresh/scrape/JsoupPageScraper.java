package com.linkshelf.refresh.scrape;

import com.linkshelf.config.RefreshProperties;
import com.linkshelf.refresh.model.PageMetadata;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

@Service
public class JsoupPageScraper implements PageScraper {
    private static final Logger log = LoggerFactory.getLogger(JsoupPageScraper.class);

    private static final List<String> FAVICON_RELS = List.of(
        "icon",
        "shortcut icon",
        "apple-touch-icon",
        "apple-touch-icon-precomposed"
    );

    private final RefreshProperties properties;

    public JsoupPageScraper(RefreshProperties properties) {
        this.properties = properties;
    }

    @Override
    public PageMetadata fetchPage(String url, Duration timeout) throws ScrapeException {
        URI base = parseHttpUri(url);
        Connection.Response response;
        try {
            response = Jsoup.connect(base.toString())
                .userAgent(properties.getUserAgent())
                .timeout((int) Math.min(Integer.MAX_VALUE, Math.max(1L, timeout.toMillis())))
                .maxBodySize(properties.getScraper().getMaxBodyBytes())
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.8")
                .execute();
        } catch (SocketTimeoutException e) {
            throw new ScrapeException(ScrapeErrorKind.TIMEOUT, 0, "timeout: " + e.getMessage(), e);
        } catch (UnknownHostException e) {
            throw new ScrapeException(ScrapeErrorKind.OTHER, 0, "dns_failure: " + e.getMessage(), e);
        } catch (ConnectException e) {
            throw new ScrapeException(ScrapeErrorKind.OTHER, 0, "connection_failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ScrapeException(ScrapeErrorKind.OTHER, 0, "io_error: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status == 404 || status == 410) {
            throw new ScrapeException(ScrapeErrorKind.NOT_FOUND, status, "http_" + status);
        }
        if (status == 408) {
            throw new ScrapeException(ScrapeErrorKind.TIMEOUT, status, "http_408");
        }
        if (status == 429 || status >= 500) {
            throw new ScrapeException(ScrapeErrorKind.SERVER_ERROR, status, "http_" + status);
        }
        if (status < 200 || status >= 400) {
            throw new ScrapeException(ScrapeErrorKind.OTHER, status, "http_" + status);
        }

        String contentType = response.contentType();
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).contains("html")) {
            log.debug("Non-HTML response for {} (content-type={})", url, contentType);
            return PageMetadata.empty();
        }

        Document document;
        try {
            document = response.parse();
        } catch (IOException e) {
            throw new ScrapeException(ScrapeErrorKind.OTHER, status, "parse_error: " + e.getMessage(), e);
        }
        return new PageMetadata(
            extractTitle(document),
            extractDescription(document),
            extractFavicon(document, base)
        );
    }

    private URI parseHttpUri(String url) throws ScrapeException {
        if (url == null || url.isBlank()) {
            throw new ScrapeException(ScrapeErrorKind.OTHER, "invalid_url: blank");
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null
                || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
                throw new ScrapeException(ScrapeErrorKind.OTHER, "invalid_url: " + url);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ScrapeException(ScrapeErrorKind.OTHER, 0, "invalid_url: " + e.getMessage(), e);
        }
    }

    private String extractTitle(Document document) {
        String ogTitle = metaContent(document, "meta[property=og:title]");
        if (ogTitle != null) {
            return ogTitle;
        }
        return clean(document.title());
    }

    private String extractDescription(Document document) {
        String ogDescription = metaContent(document, "meta[property=og:description]");
        if (ogDescription != null) {
            return ogDescription;
        }
        return metaContent(document, "meta[name=description]");
    }

    private String extractFavicon(Document document, URI base) {
        for (String rel : FAVICON_RELS) {
            String selector = "link[rel='" + rel + "']";
            Element link = document.selectFirst(selector);
            if (link != null) {
                String href = clean(link.attr("abs:href"));
                if (href != null) {
                    return href;
                }
            }
        }
        return base.getScheme() + "://" + base.getRawAuthority() + "/favicon.ico";
    }

    private String metaContent(Document document, String cssQuery) {
        Element element = document.selectFirst(cssQuery);
        return element == null ? null : clean(element.attr("content"));
    }

    private String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
