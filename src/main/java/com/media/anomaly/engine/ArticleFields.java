package com.media.anomaly.engine;

/**
 * Presence checks for optional article fields. Zero numbers and blank strings count as missing,
 * matching how the ingestion pipeline fills in unknown metrics.
 */
public final class ArticleFields {

    private ArticleFields() {}

    public static boolean isPresent(Object value) {
        if (value == null) return false;
        if (value instanceof Number number) return number.doubleValue() != 0.0;
        if (value instanceof CharSequence text) return !text.toString().isBlank();
        return true;
    }

    public static boolean allPresent(Object... values) {
        for (Object value : values) {
            if (!isPresent(value)) return false;
        }
        return true;
    }
}
