package com.questrail.keycode.observability;

import java.time.Instant;

/**
 * Record representing a numeric keycode serialized through the hex fallback.
 */
public record UnrepresentableValueEvent(
    Instant timestamp,
    int value,
    String fallback
) {
}
