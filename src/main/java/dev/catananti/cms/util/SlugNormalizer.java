package dev.catananti.cms.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns free text into the base form of a slug: lower-case, hyphen-delimited, at most 100 characters.
 * Accented Latin letters fold to their base letter; letters and digits of other scripts are kept.
 */
public final class SlugNormalizer {

    public static final int MAX_LENGTH = 100;
    public static final String FALLBACK = "untitled";

    private static final Pattern DIACRITICALS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_SLUG_CHARS = Pattern.compile("[^\\p{L}\\p{N}\\s-]",
            Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SEPARATOR_RUNS = Pattern.compile("[\\s-]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");

    private SlugNormalizer() {
    }

    /**
     * "Hello, World!" becomes "hello-world". Input without a single usable character becomes {@value #FALLBACK}.
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return FALLBACK;
        }
        String folded = DIACRITICALS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD)).replaceAll("");
        String cleaned = NON_SLUG_CHARS.matcher(folded.toLowerCase(Locale.ROOT)).replaceAll("");
        String slug = truncate(trimHyphens(SEPARATOR_RUNS.matcher(cleaned).replaceAll("-")), MAX_LENGTH);
        return slug.isEmpty() ? FALLBACK : slug;
    }

    /**
     * Appends {@code -suffix}, shortening the base when needed so the result stays within {@link #MAX_LENGTH}.
     */
    public static String withSuffix(String base, String suffix) {
        String tail = "-" + suffix;
        if (base.length() + tail.length() <= MAX_LENGTH) {
            return base + tail;
        }
        return truncate(base, MAX_LENGTH - tail.length()) + tail;
    }

    private static String truncate(String slug, int maxLength) {
        if (slug.length() <= maxLength) {
            return slug;
        }
        return trimHyphens(slug.substring(0, maxLength));
    }

    private static String trimHyphens(String value) {
        return EDGE_HYPHENS.matcher(value).replaceAll("");
    }
}
