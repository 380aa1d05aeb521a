package com.questrail.keycode.observability;

/**
 * No-op implementation of KeycodeObservabilitySink.
 */
public final class NullKeycodeObservabilitySink implements KeycodeObservabilitySink {
    public static final NullKeycodeObservabilitySink INSTANCE = new NullKeycodeObservabilitySink();

    private NullKeycodeObservabilitySink() {}

    @Override
    public void onRegistryRebuilt(RegistryRebuiltEvent event) {}

    @Override
    public void onUnresolvedText(UnresolvedTextEvent event) {}

    @Override
    public void onUnrepresentableValue(UnrepresentableValueEvent event) {}
}
