package com.questrail.keycode.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of KeycodeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jKeycodeObservabilitySink implements KeycodeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jKeycodeObservabilitySink.class);

    @Override
    public void onRegistryRebuilt(RegistryRebuiltEvent event) {
        log.info("Keycode registry rebuilt: protocol={} revision={} keycodes={} hidden={}",
            event.protocol(),
            event.revision(),
            event.keycodeCount(),
            event.hiddenCount());
    }

    @Override
    public void onUnresolvedText(UnresolvedTextEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Unresolved keycode text '{}': {}", event.text(),
                event.cause() != null ? event.cause().getMessage() : "unknown");
        }
    }

    @Override
    public void onUnrepresentableValue(UnrepresentableValueEvent event) {
        log.debug("No name for keycode value {}, using {}", event.value(), event.fallback());
    }
}
