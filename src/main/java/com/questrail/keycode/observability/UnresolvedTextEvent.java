package com.questrail.keycode.observability;

import java.time.Instant;

/**
 * Record representing keycode text that did not resolve to a value.
 */
public record UnresolvedTextEvent(
    Instant timestamp,
    String text,
    Throwable cause
) {
}
