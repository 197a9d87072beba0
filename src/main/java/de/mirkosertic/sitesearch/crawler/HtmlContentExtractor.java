package de.mirkosertic.sitesearch.crawler;

import de.mirkosertic.sitesearch.util.TextCleaner;
import de.mirkosertic.sitesearch.util.Urls;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns fetched HTML into the fields that get indexed: title, meta description, headings
 * plus body text, and the page's same-origin links.
 */
public class HtmlContentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(HtmlContentExtractor.class);

    private static final Set<String> ASSET_EXTENSIONS = Set.of(
            "pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx",
            "jpg", "jpeg", "png", "gif", "svg", "webp", "ico", "bmp", "tif", "tiff",
            "zip", "gz", "tgz", "tar", "rar", "7z", "bz2",
            "mp3", "mp4", "wav", "ogg", "avi", "mov", "webm", "mkv",
            "woff", "woff2", "ttf", "otf", "eot",
            "css", "js", "json", "xml", "rss", "exe", "dmg", "apk");

    private final int maxContentLength;
    private final Parser fallbackParser;

    public HtmlContentExtractor(final int maxContentLength) {
        this.maxContentLength = maxContentLength;
        this.fallbackParser = new AutoDetectParser();
    }

    public ExtractedPage extract(final String url, final String html) {
        final Document document = Jsoup.parse(html, url);

        String title = TextCleaner.clean(document.title());
        if (title.isEmpty()) {
            title = url;
        }

        final Element descriptionMeta = document.selectFirst("meta[name=description]");
        final String description = descriptionMeta != null
                ? TextCleaner.clean(descriptionMeta.attr("content"))
                : "";

        final String headings = TextCleaner.clean(document.select("h1, h2, h3, h4, h5").stream()
                .map(Element::text)
                .collect(Collectors.joining(" ")));

        // link targets are read before scripts are stripped, body text after
        final Map<String, String> links = extractLinks(document, url);

        document.select("script, style, noscript, template").remove();
        final String body = document.body() != null ? TextCleaner.clean(document.body().text()) : "";

        String content = TextCleaner.truncate((headings + " " + TextCleaner.truncate(body, maxContentLength)).trim(),
                maxContentLength);
        if (content.isEmpty()) {
            content = TextCleaner.truncate(TextCleaner.clean(fallbackText(url, html)), maxContentLength);
        }

        final String serializedLinks = links.entrySet().stream()
                .map(entry -> entry.getValue() + " (" + entry.getKey() + ")")
                .collect(Collectors.joining(", "));

        logger.debug("Extracted {} characters and {} links from {}", content.length(), links.size(), url);
        return new ExtractedPage(url, title, description, content, new ArrayList<>(links.keySet()), serializedLinks);
    }

    /**
     * Canonical same-origin page links mapped to their anchor text, first occurrence wins.
     */
    Map<String, String> extractLinks(final Document document, final String pageUrl) {
        final String origin = Urls.origin(pageUrl);
        final Map<String, String> links = new LinkedHashMap<>();
        for (final Element anchor : document.select("a[href]")) {
            final String absolute = anchor.absUrl("href");
            if (absolute.isEmpty() || Urls.hasFragment(absolute)) {
                continue;
            }
            final Optional<String> canonical = Urls.canonicalize(absolute);
            if (canonical.isEmpty() || !Urls.sameOrigin(canonical.get(), origin) || isAsset(canonical.get())) {
                continue;
            }
            links.putIfAbsent(canonical.get(), TextCleaner.clean(anchor.text()));
        }
        return links;
    }

    static boolean isAsset(final String url) {
        final String path = Urls.path(url);
        final int slash = path.lastIndexOf('/');
        final int dot = path.lastIndexOf('.');
        if (dot < 0 || dot < slash) {
            return false;
        }
        return ASSET_EXTENSIONS.contains(path.substring(dot + 1));
    }

    private String fallbackText(final String url, final String html) {
        final Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, "page.html");
        metadata.set(Metadata.CONTENT_TYPE, "text/html");

        final BodyContentHandler handler = new BodyContentHandler(-1);
        final ParseContext context = new ParseContext();
        context.set(Parser.class, fallbackParser);

        try (final InputStream stream = new ByteArrayInputStream(html.getBytes(StandardCharsets.UTF_8))) {
            fallbackParser.parse(stream, handler, metadata, context);
            return handler.toString();
        } catch (final IOException | SAXException | TikaException e) {
            logger.warn("Fallback text extraction failed for {}: {}", url, e.getMessage());
            return "";
        }
    }
}
