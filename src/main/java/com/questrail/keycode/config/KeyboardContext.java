package com.questrail.keycode.config;

import com.questrail.keycode.api.ProtocolVersion;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * KeyboardContext
 * =============================================================================
 * Capabilities of the connected device, as far as they shape the keycode
 * registry.
 *
 * <h2>Bounds</h2>
 * <ul>
 *   <li>{@code layers}: 0 to {@value #MAX_LAYERS}</li>
 *   <li>{@code macroCount}, {@code tapDanceCount}: 0 to {@value #MAX_INDEXED}</li>
 *   <li>{@code customKeycodes}: at most {@value #MAX_CUSTOM_KEYCODES} entries</li>
 * </ul>
 *
 * <p>Values outside these bounds are rejected at construction with
 * {@link IllegalArgumentException}; the registry never has to clamp.</p>
 */
public record KeyboardContext(
        ProtocolVersion protocol,
        int layers,
        int macroCount,
        int tapDanceCount,
        List<CustomKeycodeDefinition> customKeycodes,
        MidiLevel midi,
        Set<String> supportedFeatures
) {
    public static final int MAX_LAYERS = 32;
    public static final int MAX_INDEXED = 256;
    public static final int MAX_CUSTOM_KEYCODES = 64;

    public static final int DEFAULT_LAYERS = 4;
    public static final int DEFAULT_MACRO_COUNT = 16;

    public KeyboardContext {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(customKeycodes, "customKeycodes");
        Objects.requireNonNull(midi, "midi");
        Objects.requireNonNull(supportedFeatures, "supportedFeatures");
        requireRange("layers", layers, MAX_LAYERS);
        requireRange("macroCount", macroCount, MAX_INDEXED);
        requireRange("tapDanceCount", tapDanceCount, MAX_INDEXED);
        if (customKeycodes.size() > MAX_CUSTOM_KEYCODES) {
            throw new IllegalArgumentException(
                    "customKeycodes must have at most " + MAX_CUSTOM_KEYCODES + " entries, got " + customKeycodes.size());
        }
        customKeycodes = List.copyOf(customKeycodes);
        supportedFeatures = Set.copyOf(supportedFeatures);
    }

    private static void requireRange(String name, int value, int max) {
        if (value < 0 || value > max) {
            throw new IllegalArgumentException(name + " must be in [0, " + max + "], got " + value);
        }
    }

    /**
     * Context used when no device description is available: four layers,
     * sixteen macros, no tap dance, no custom keycodes, no MIDI and no
     * optional features.
     */
    public static KeyboardContext defaults(ProtocolVersion protocol) {
        return builder().withProtocol(protocol).build();
    }

    public boolean supports(String feature) {
        return supportedFeatures.contains(feature);
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.protocol = protocol;
        b.layers = layers;
        b.macroCount = macroCount;
        b.tapDanceCount = tapDanceCount;
        b.customKeycodes.addAll(customKeycodes);
        b.midi = midi;
        b.supportedFeatures.addAll(supportedFeatures);
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ProtocolVersion protocol = ProtocolVersion.V6;
        private int layers = DEFAULT_LAYERS;
        private int macroCount = DEFAULT_MACRO_COUNT;
        private int tapDanceCount = 0;
        private final List<CustomKeycodeDefinition> customKeycodes = new ArrayList<>();
        private MidiLevel midi = MidiLevel.NONE;
        private final Set<String> supportedFeatures = new LinkedHashSet<>();

        public Builder withProtocol(ProtocolVersion protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder withLayers(int layers) {
            this.layers = layers;
            return this;
        }

        public Builder withMacroCount(int macroCount) {
            this.macroCount = macroCount;
            return this;
        }

        public Builder withTapDanceCount(int tapDanceCount) {
            this.tapDanceCount = tapDanceCount;
            return this;
        }

        public Builder withCustomKeycodes(List<CustomKeycodeDefinition> customKeycodes) {
            this.customKeycodes.clear();
            this.customKeycodes.addAll(Objects.requireNonNull(customKeycodes, "customKeycodes"));
            return this;
        }

        public Builder addCustomKeycode(CustomKeycodeDefinition definition) {
            this.customKeycodes.add(Objects.requireNonNull(definition, "definition"));
            return this;
        }

        public Builder withMidi(MidiLevel midi) {
            this.midi = midi;
            return this;
        }

        public Builder withSupportedFeatures(Set<String> features) {
            this.supportedFeatures.clear();
            this.supportedFeatures.addAll(Objects.requireNonNull(features, "features"));
            return this;
        }

        public Builder addSupportedFeature(String feature) {
            this.supportedFeatures.add(Objects.requireNonNull(feature, "feature"));
            return this;
        }

        public KeyboardContext build() {
            return new KeyboardContext(
                    protocol, layers, macroCount, tapDanceCount, customKeycodes, midi, supportedFeatures);
        }
    }
}
