package com.questrail.keycode.config;

import com.questrail.keycode.api.ProtocolVersion;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class KeyboardContextTest
{
    @Test
    void defaultsDescribeAMinimalDevice() {
        KeyboardContext context = KeyboardContext.defaults(ProtocolVersion.V5);

        assertEquals(ProtocolVersion.V5, context.protocol());
        assertEquals(4, context.layers());
        assertEquals(16, context.macroCount());
        assertEquals(0, context.tapDanceCount());
        assertTrue(context.customKeycodes().isEmpty());
        assertEquals(MidiLevel.NONE, context.midi());
        assertTrue(context.supportedFeatures().isEmpty());
    }

    @Test
    void boundsAreEnforced() {
        assertThrows(IllegalArgumentException.class, () -> KeyboardContext.builder().withLayers(33).build());
        assertThrows(IllegalArgumentException.class, () -> KeyboardContext.builder().withLayers(-1).build());
        assertThrows(IllegalArgumentException.class, () -> KeyboardContext.builder().withMacroCount(257).build());
        assertThrows(IllegalArgumentException.class, () -> KeyboardContext.builder().withTapDanceCount(-1).build());

        KeyboardContext.Builder tooMany = KeyboardContext.builder();
        for (int i = 0; i <= KeyboardContext.MAX_CUSTOM_KEYCODES; i++) {
            tooMany.addCustomKeycode(CustomKeycodeDefinition.named("K" + i));
        }
        assertThrows(IllegalArgumentException.class, tooMany::build);
    }

    @Test
    void nullsAreRejected() {
        assertThrows(NullPointerException.class, () -> KeyboardContext.builder().withProtocol(null).build());
        assertThrows(NullPointerException.class, () -> KeyboardContext.builder().withMidi(null).build());
    }

    @Test
    void collectionsAreCopied() {
        KeyboardContext context = KeyboardContext.builder()
                .withCustomKeycodes(List.of(CustomKeycodeDefinition.named("A")))
                .withSupportedFeatures(Set.of("caps_word"))
                .build();

        assertThrows(UnsupportedOperationException.class, () -> context.supportedFeatures().add("x"));
        assertThrows(UnsupportedOperationException.class,
                () -> context.customKeycodes().add(CustomKeycodeDefinition.empty()));
        assertTrue(context.supports("caps_word"));
        assertFalse(context.supports("repeat_key"));
    }

    @Test
    void toBuilderPreservesEverything() {
        KeyboardContext context = KeyboardContext.builder()
                .withProtocol(ProtocolVersion.V5)
                .withLayers(8)
                .withMacroCount(32)
                .withTapDanceCount(4)
                .addCustomKeycode(CustomKeycodeDefinition.of("X", "Ex", "x"))
                .withMidi(MidiLevel.BASIC)
                .addSupportedFeature("layer_lock")
                .build();

        assertEquals(context, context.toBuilder().build());
        assertEquals(ProtocolVersion.V6, context.toBuilder().withProtocol(ProtocolVersion.V6).build().protocol());
    }

    @Test
    void midiSettingParsesLeniently() {
        assertEquals(MidiLevel.BASIC, MidiLevel.fromSetting("basic"));
        assertEquals(MidiLevel.ADVANCED, MidiLevel.fromSetting(" Advanced "));
        assertEquals(MidiLevel.NONE, MidiLevel.fromSetting("full"));
        assertEquals(MidiLevel.NONE, MidiLevel.fromSetting(null));
        assertTrue(MidiLevel.ADVANCED.includesBasic());
        assertFalse(MidiLevel.BASIC.includesAdvanced());
    }

    @Test
    void customDefinitionsMayOmitFields() {
        CustomKeycodeDefinition empty = CustomKeycodeDefinition.empty();
        assertTrue(empty.name().isEmpty());
        assertTrue(empty.title().isEmpty());
        assertTrue(empty.shortName().isEmpty());

        assertEquals(CustomKeycodeDefinition.of("A", "B", "C"), CustomKeycodeDefinition.of("A", "B", "C"));
        assertEquals("A", CustomKeycodeDefinition.named("A").name().orElseThrow());
    }

    @Test
    void protocolMajorMapping() {
        assertEquals(ProtocolVersion.V6, ProtocolVersion.fromMajor(6));
        assertEquals(ProtocolVersion.V5, ProtocolVersion.fromMajor(5));
        assertEquals(ProtocolVersion.V5, ProtocolVersion.fromMajor(0));
        assertEquals(6, ProtocolVersion.V6.major());
    }
}
