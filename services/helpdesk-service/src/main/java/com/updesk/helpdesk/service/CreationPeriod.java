package com.updesk.helpdesk.service;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Creation-date buckets offered by the triage listing.
 */
public enum CreationPeriod {
    ANY,
    TODAY,
    LAST_7_DAYS,
    LAST_30_DAYS;

    /**
     * Earliest creation time included in this bucket, or empty for {@link #ANY}.
     */
    public Optional<LocalDateTime> lowerBound(LocalDateTime now) {
        return switch (this) {
            case ANY -> Optional.empty();
            case TODAY -> Optional.of(now.toLocalDate().atStartOfDay());
            case LAST_7_DAYS -> Optional.of(now.minusDays(7));
            case LAST_30_DAYS -> Optional.of(now.minusDays(30));
        };
    }

    public static CreationPeriod parse(String value) {
        if (value == null || value.isBlank() || "ALL".equalsIgnoreCase(value.trim())) {
            return ANY;
        }
        try {
            return valueOf(value.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException unknown) {
            throw new IllegalArgumentException("Unknown creation period '%s'".formatted(value), unknown);
        }
    }
}
