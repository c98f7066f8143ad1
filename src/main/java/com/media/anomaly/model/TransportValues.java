package com.media.anomaly.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * String rendering shared by the alert transport form.
 */
public final class TransportValues {

    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    // Downstream consumers were written against this literal for missing values
    public static final String NONE = "None";

    private TransportValues() {}

    public static String render(Object value) {
        if (value == null) {
            return NONE;
        }
        if (value instanceof LocalDateTime dateTime) {
            return DATE_FORMAT.format(dateTime);
        }
        return String.valueOf(value);
    }
}
