package de.mirkosertic.sitesearch.util;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Utility class for cleaning extracted page text by removing invalid, broken, or problematic characters.
 *
 * <p>This helps ensure clean search results by filtering out:</p>
 * <ul>
 *   <li>Unicode replacement characters from failed decoding</li>
 *   <li>Control characters that aren't whitespace</li>
 *   <li>Zero-width characters and byte order marks</li>
 * </ul>
 */
public final class TextCleaner {

    /**
     * Pattern matching characters to remove:
     * <ul>
     *   <li>U+0000-U+0008, U+000B-U+000C, U+000E-U+001F, U+007F-U+009F: control characters</li>
     *   <li>U+200B-U+200D: zero-width space, non-joiner, joiner</li>
     *   <li>U+FEFF: byte order mark</li>
     *   <li>U+FFFD: replacement character</li>
     * </ul>
     */
    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\u0000-\u0008" +
        "\u000B-\u000C" +
        "\u000E-\u001F" +
        "\u007F-\u009F" +
        "\u200B-\u200D" +
        "\uFEFF" +
        "\uFFFD" +
        "]"
    );

    /**
     * Unicode whitespace variants that are replaced with a regular ASCII space:
     * no-break space, ogham space mark, en quad through hair space, narrow no-break space,
     * medium mathematical space and ideographic space.
     */
    private static final Pattern UNICODE_WHITESPACE = Pattern.compile("[\u00A0\u1680\u2000-\u200A\u202F\u205F\u3000]");

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextCleaner() {
        // Utility class, no instances
    }

    /**
     * Normalize text to a single line: NFKC normalization, invalid character removal,
     * Unicode whitespace folding, and whitespace collapsed to single spaces.
     *
     * @param text the text to clean (may be null)
     * @return cleaned text, empty string if input was null
     */
    public static String clean(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        // NFKC expands ligatures, full-width characters etc.
        String cleaned = Normalizer.normalize(text, Normalizer.Form.NFKC);

        cleaned = INVALID_CHARS.matcher(cleaned).replaceAll("");
        cleaned = UNICODE_WHITESPACE.matcher(cleaned).replaceAll(" ");
        cleaned = WHITESPACE_RUN.matcher(cleaned).replaceAll(" ");

        return cleaned.trim();
    }

    /**
     * Cut text to at most {@code maxLength} characters without splitting a surrogate pair.
     */
    public static String truncate(final String text, final int maxLength) {
        if (text == null) {
            return "";
        }
        if (maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        int end = maxLength;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
