package de.mirkosertic.sitesearch;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * A crawled page as it is stored and indexed.
 *
 * @param id          stable identity derived from the canonical URL, see {@link #idFor(String)}
 * @param title       page title, never null
 * @param description meta description, empty when the page has none
 * @param content     headings followed by body text, bounded in length
 * @param url         canonical absolute URL
 * @param links       outgoing same-origin links serialized as {@code "text (href)"} pairs
 * @param lastCrawled epoch millis of the crawl that produced this document
 */
public record PageDocument(
        String id,
        String title,
        String description,
        String content,
        String url,
        String links,
        long lastCrawled
) {

    /**
     * Document identity for a canonical URL: the hex encoded SHA-256 of the URL.
     * Re-crawling a page therefore replaces its index entry instead of adding a second one.
     */
    public static String idFor(final String url) {
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            final byte[] hash = digest.digest(url.getBytes(StandardCharsets.UTF_8));
            final StringBuilder hexString = new StringBuilder();
            for (final byte b : hash) {
                final String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
