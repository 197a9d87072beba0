package de.mirkosertic.sitesearch.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import de.mirkosertic.sitesearch.IndexNotPopulatedException;
import de.mirkosertic.sitesearch.IndexingException;
import de.mirkosertic.sitesearch.InvalidQueryException;
import de.mirkosertic.sitesearch.SearchHit;
import de.mirkosertic.sitesearch.SiteSearchService;
import de.mirkosertic.sitesearch.crawler.CrawlInProgressException;
import de.mirkosertic.sitesearch.crawler.CrawlSummary;
import de.mirkosertic.sitesearch.crawler.NoUrlsToCrawlException;
import de.mirkosertic.sitesearch.crawler.SiteCrawlerService;
import de.mirkosertic.sitesearch.store.StoreUnavailableException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP interface with two routes.
 * <ul>
 *   <li>{@code POST /api/crawl} runs one crawl invocation and returns its summary</li>
 *   <li>{@code GET /api/search?q=...} returns ranked hits as a JSON array</li>
 * </ul>
 * Errors are reported as {@code {"error": ..., "details": ...}} with status 400 for a bad
 * request, 404 when the index has no documents yet, 409 when a crawl is already running
 * and 500 for everything else.
 */
public class SiteSearchHttpServer {

    private static final Logger logger = LoggerFactory.getLogger(SiteSearchHttpServer.class);

    static final String CRAWL_PATH = "/api/crawl";
    static final String SEARCH_PATH = "/api/search";

    private final SiteCrawlerService crawlerService;
    private final SiteSearchService searchService;
    private final ObjectMapper objectMapper;
    private final int port;

    private @Nullable HttpServer server;
    private @Nullable ExecutorService requestExecutor;

    public SiteSearchHttpServer(final SiteCrawlerService crawlerService, final SiteSearchService searchService,
                                final ObjectMapper objectMapper, final int port) {
        this.crawlerService = crawlerService;
        this.searchService = searchService;
        this.objectMapper = objectMapper;
        this.port = port;
    }

    public void start() throws IOException {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        requestExecutor = Executors.newFixedThreadPool(4, r -> {
            final Thread thread = new Thread(r, "http-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });

        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/", this::handle);
        server.setExecutor(requestExecutor);
        server.start();
        logger.info("HTTP server listening on port {}", getPort());
    }

    /**
     * The bound port, useful when started with port 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    public void stop() {
        if (server != null) {
            logger.info("Stopping HTTP server");
            server.stop(1);
            server = null;
        }
        if (requestExecutor != null) {
            requestExecutor.shutdownNow();
            requestExecutor = null;
        }
    }

    void handle(final HttpExchange exchange) throws IOException {
        try {
            final String path = exchange.getRequestURI().getPath();
            final String method = exchange.getRequestMethod();
            if (CRAWL_PATH.equals(path)) {
                if (!"POST".equals(method)) {
                    methodNotAllowed(exchange, "POST");
                    return;
                }
                handleCrawl(exchange);
            } else if (SEARCH_PATH.equals(path)) {
                if (!"GET".equals(method)) {
                    methodNotAllowed(exchange, "GET");
                    return;
                }
                handleSearch(exchange);
            } else {
                sendError(exchange, 404, "Not found", path);
            }
        } catch (final Exception e) {
            logger.error("Error handling request {}", exchange.getRequestURI(), e);
            if (exchange.getResponseCode() == -1) {
                sendError(exchange, 500, "Internal server error", e.getMessage());
            }
        } finally {
            exchange.close();
        }
    }

    private void handleCrawl(final HttpExchange exchange) throws IOException {
        try {
            final CrawlSummary summary = crawlerService.crawl();
            sendJson(exchange, 200, summary);
        } catch (final NoUrlsToCrawlException e) {
            sendError(exchange, 400, "No URLs to crawl", e.getMessage());
        } catch (final CrawlInProgressException e) {
            sendError(exchange, 409, "Crawl in progress", e.getMessage());
        } catch (final StoreUnavailableException e) {
            logger.error("Crawl aborted, key-value store unavailable", e);
            sendError(exchange, 500, "Store unavailable", e.getMessage());
        } catch (final IndexingException e) {
            logger.error("Crawl finished but indexing failed", e);
            sendError(exchange, 500, "Indexing failed", e.getMessage());
        }
    }

    private void handleSearch(final HttpExchange exchange) throws IOException {
        final Map<String, String> parameters = queryParameters(exchange.getRequestURI().getRawQuery());
        final String query = parameters.containsKey("q") ? parameters.get("q") : parameters.get("query");
        try {
            final List<SearchHit> hits = searchService.search(query);
            sendJson(exchange, 200, hits);
        } catch (final InvalidQueryException e) {
            sendError(exchange, 400, "Invalid query", e.getMessage());
        } catch (final IndexNotPopulatedException e) {
            sendError(exchange, 404, "Index not populated", e.getMessage());
        }
    }

    static Map<String, String> queryParameters(@Nullable final String rawQuery) {
        final Map<String, String> parameters = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return parameters;
        }
        for (final String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            final int equals = pair.indexOf('=');
            final String name = decode(equals >= 0 ? pair.substring(0, equals) : pair);
            final String value = equals >= 0 ? decode(pair.substring(equals + 1)) : "";
            parameters.putIfAbsent(name, value);
        }
        return parameters;
    }

    private static String decode(final String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    private void methodNotAllowed(final HttpExchange exchange, final String allowed) throws IOException {
        exchange.getResponseHeaders().set("Allow", allowed);
        sendError(exchange, 405, "Method not allowed", exchange.getRequestMethod());
    }

    private void sendError(final HttpExchange exchange, final int status, final String error,
                           @Nullable final String details) throws IOException {
        final Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("details", details != null ? details : "");
        sendJson(exchange, status, body);
    }

    private void sendJson(final HttpExchange exchange, final int status, final Object body) throws IOException {
        final byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        exchange.getResponseBody().write(bytes);
    }
}
