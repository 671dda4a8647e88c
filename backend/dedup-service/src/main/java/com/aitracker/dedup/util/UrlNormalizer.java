package com.aitracker.dedup.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * URL identity keys used for duplicate detection.
 *
 * <p>{@link #normalize(String)} removes tracking noise so that the same article shared
 * through different campaigns maps to one key. {@link #canonicalKey(String)} is the stricter
 * system-wide key that drops the whole query string.</p>
 *
 * <ul>
 *   <li>https://www.Example.com/News/?utm_source=x&amp;id=7 → https://example.com/news?id=7</li>
 *   <li>canonicalKey: https://Example.com/News?id=7#top → https://example.com/news</li>
 * </ul>
 */
public final class UrlNormalizer {

    private static final Pattern LEADING_WWW = Pattern.compile("://(?:www\\.)+");
    private static final List<String> TRACKING_KEYS = List.of("fbclid", "gclid", "ref");

    private UrlNormalizer() {}

    /**
     * Normalise a URL: tracking parameters (utm_*, fbclid, gclid, ref) and fragments removed,
     * lower-cased, leading www. and trailing slashes stripped. Pure and idempotent.
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String value = url.trim().toLowerCase(Locale.ROOT);

        int hash = value.indexOf('#');
        if (hash >= 0) {
            value = value.substring(0, hash);
        }

        String base = value;
        List<String> kept = new ArrayList<>();
        int question = value.indexOf('?');
        if (question >= 0) {
            base = value.substring(0, question);
            for (String param : value.substring(question + 1).split("&")) {
                if (!param.isEmpty() && !isTrackingParam(param)) {
                    kept.add(param);
                }
            }
        }

        base = LEADING_WWW.matcher(base).replaceAll("://");
        base = stripTrailingSlashes(base);

        return kept.isEmpty() ? base : base + "?" + String.join("&", kept);
    }

    /**
     * Strict canonical key: lower-cased scheme, host and path only.
     * Query string and fragment are dropped entirely.
     */
    public static String canonicalKey(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String value = url.trim().toLowerCase(Locale.ROOT);
        int cut = value.length();
        int question = value.indexOf('?');
        int hash = value.indexOf('#');
        if (question >= 0) cut = Math.min(cut, question);
        if (hash >= 0) cut = Math.min(cut, hash);
        return stripTrailingSlashes(value.substring(0, cut));
    }

    /**
     * Two URLs point at the same article when their canonical keys match.
     */
    public static boolean sameArticle(String url1, String url2) {
        String key1 = canonicalKey(url1);
        return !key1.isEmpty() && key1.equals(canonicalKey(url2));
    }

    private static boolean isTrackingParam(String param) {
        int eq = param.indexOf('=');
        String key = eq >= 0 ? param.substring(0, eq) : param;
        return key.startsWith("utm_") || TRACKING_KEYS.contains(key);
    }

    private static String stripTrailingSlashes(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }
}
