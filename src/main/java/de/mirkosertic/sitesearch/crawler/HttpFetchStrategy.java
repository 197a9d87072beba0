package de.mirkosertic.sitesearch.crawler;

import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.UnsupportedMimeTypeException;

import java.io.IOException;

/**
 * Plain HTTP GET with a browser-like header profile. No JavaScript is executed.
 * Response bodies are read up to {@code maxBodyBytes}, the rest is dropped.
 */
public class HttpFetchStrategy implements FetchStrategy {

    private final String userAgent;
    private final String acceptLanguage;
    private final int timeoutMs;
    private final int maxBodyBytes;

    public HttpFetchStrategy(final String userAgent, final String acceptLanguage, final int timeoutMs,
                             final int maxBodyBytes) {
        if (maxBodyBytes <= 0) {
            throw new IllegalArgumentException("maxBodyBytes must be positive: " + maxBodyBytes);
        }
        this.userAgent = userAgent;
        this.acceptLanguage = acceptLanguage;
        this.timeoutMs = timeoutMs;
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    public String fetch(final String url) throws FetchException {
        try {
            final Connection.Response response = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", acceptLanguage)
                    .header("Accept-Encoding", "gzip, deflate")
                    .timeout(timeoutMs)
                    .followRedirects(true)
                    .maxBodySize(maxBodyBytes)
                    .execute();
            return response.body();
        } catch (final HttpStatusException e) {
            throw new FetchException("HTTP " + e.getStatusCode() + " for " + url, e);
        } catch (final UnsupportedMimeTypeException e) {
            throw new FetchException("Not an HTML page (" + e.getMimeType() + "): " + url, e);
        } catch (final IOException e) {
            throw new FetchException("HTTP request failed for " + url + ": " + e.getMessage(), e);
        } catch (final IllegalArgumentException e) {
            throw new FetchException("Invalid URL: " + url, e);
        }
    }
}
