package com.questrail.keycode.observability;

/**
 * Receives keycode registry and codec observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface KeycodeObservabilitySink {
    /**
     * Called after a registry snapshot has been built and installed.
     * @param event rebuild details
     */
    void onRegistryRebuilt(RegistryRebuiltEvent event);

    /**
     * Called when text could not be converted to a keycode and the codec
     * fell back to {@code KC_NO}.
     * @param event the rejected text and the reason
     */
    void onUnresolvedText(UnresolvedTextEvent event);

    /**
     * Called when a numeric keycode had no textual form and was rendered
     * as a hexadecimal literal.
     * @param event the value and its fallback text
     */
    void onUnrepresentableValue(UnrepresentableValueEvent event);
}
