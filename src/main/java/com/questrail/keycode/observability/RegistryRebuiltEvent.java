package com.questrail.keycode.observability;

import com.questrail.keycode.api.ProtocolVersion;

import java.time.Instant;

/**
 * Record describing a completed registry rebuild.
 */
public record RegistryRebuiltEvent(
    Instant timestamp,
    ProtocolVersion protocol,
    long revision,
    int keycodeCount,
    int hiddenCount
) {
}
