package com.questrail.keycode.codec.impl;

import com.questrail.keycode.api.Keycode;
import com.questrail.keycode.api.KeycodeCodec;
import com.questrail.keycode.api.ProtocolVersion;
import com.questrail.keycode.config.KeyboardContext;
import com.questrail.keycode.config.MidiLevel;
import com.questrail.keycode.observability.NullKeycodeObservabilitySink;
import com.questrail.keycode.observability.RecordingKeycodeObservabilitySink;
import com.questrail.keycode.observability.UnrepresentableValueEvent;
import com.questrail.keycode.observability.UnresolvedTextEvent;
import com.questrail.keycode.registry.KeycodeRegistry;
import com.questrail.keycode.registry.KeycodeRegistryBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultKeycodeCodecTest
 * -----------------------------------------------------------------------------
 * Behavioral tests for the registry-bound codec.
 *
 * <h2>Covered</h2>
 * <ul>
 *   <li>Known text and value pairs for both protocol revisions</li>
 *   <li>Masked composition and layer-mod rendering</li>
 *   <li>Round trip of every 16-bit value and every registered descriptor</li>
 *   <li>Fallbacks and the events they report</li>
 * </ul>
 */
final class DefaultKeycodeCodecTest
{
    private static DefaultKeycodeCodec codecFor(ProtocolVersion version)
    {
        return new DefaultKeycodeCodec(
                KeycodeRegistryBuilder.build(KeyboardContext.defaults(version), 1),
                NullKeycodeObservabilitySink.INSTANCE);
    }

    private final DefaultKeycodeCodec v5 = codecFor(ProtocolVersion.V5);
    private final DefaultKeycodeCodec v6 = codecFor(ProtocolVersion.V6);

    @Test
    void basicKeysSerializeToTheirIds()
    {
        assertEquals("KC_NO", v6.serialize(0x00));
        assertEquals("KC_TRNS", v6.serialize(0x01));
        assertEquals("KC_A", v6.serialize(0x04));
        assertEquals("KC_1", v6.serialize(0x1E));
        assertEquals("KC_ENTER", v5.serialize(0x28));
    }

    @Test
    void exactIdsAndAliasesDeserialize()
    {
        assertEquals(0x04, v6.deserialize("KC_A"));
        assertEquals(0x28, v6.deserialize("KC_ENTER"));
        assertEquals(0x28, v6.deserialize("KC_ENT"));
        assertEquals(0x29, v6.deserialize("KC_ESC"));
        assertEquals(0x7C00, v6.deserialize("RESET"));
        assertEquals(0x5C00, v5.deserialize("QK_BOOT"));
    }

    @Test
    void shiftedSymbolsSerializeAsModifierMask()
    {
        assertEquals(0x021E, v6.deserialize("KC_EXLM"));
        assertEquals("LSFT(KC_1)", v6.serialize(0x021E));
        assertEquals("LSFT(KC_1)", v6.normalize("KC_EXLM"));
    }

    @Test
    void maskedValuesComposeWrapperAndInnerKey()
    {
        assertEquals("LT2(KC_A)", v6.serialize(0x4204));
        assertEquals(0x4204, v6.deserialize("LT(2, KC_A)"));

        assertEquals("LCTL_T(KC_A)", v6.serialize(0x2104));
        assertEquals("LCTL_T(KC_A)", v5.serialize(0x6104));
        assertEquals(0x2104, v6.deserialize("LCTL_T(KC_A)"));
        assertEquals(0x6104, v5.deserialize("LCTL_T(KC_A)"));

        assertEquals("C_S(KC_A)", v6.serialize(0x0304));
        assertEquals("LSFT(KC_NO)", v6.serialize(0x0200));
    }

    @Test
    void layerFamiliesFollowRevision()
    {
        assertEquals("MO(1)", v6.serialize(0x5221));
        assertEquals("MO(1)", v5.serialize(0x5101));
        assertEquals("TO(1)", v6.serialize(0x5201));
        assertEquals("TO(1)", v5.serialize(0x5011));
        assertEquals(0x5221, v6.deserialize("MO(1)"));
        assertEquals(0x5101, v5.deserialize("MO(1)"));
    }

    @Test
    void tapDanceAndMacros()
    {
        assertEquals("TD(3)", v6.serialize(0x5703));
        assertEquals(0x5703, v5.deserialize("TD(3)"));
        assertEquals("M5", v6.serialize(0x7705));
        assertEquals("M5", v5.serialize(0x5F17));
        assertEquals(0x7705, v6.deserialize("M5"));
    }

    @Test
    void layerModRendersModifierName()
    {
        assertEquals(0x5021, v6.deserialize("LM(1, MOD_LCTL)"));
        assertEquals(0x5911, v5.deserialize("LM(1, MOD_LCTL)"));
        assertEquals("LM1(MOD_LCTL)", v6.serialize(0x5021));
        assertEquals("LM1(MOD_LCTL)", v5.serialize(0x5911));

        assertEquals("LM1(MOD_RSFT)", v6.serialize(0x5032));
        assertEquals("LM1(MOD_MEH)", v6.normalize("LM1(MOD_LCTL|MOD_LSFT|MOD_LALT)"));
    }

    @Test
    void legacyLayerModLosesRightHandBit()
    {
        assertEquals(0x5912, v5.deserialize("LM1(MOD_RSFT)"));
        assertEquals("LM1(MOD_LSFT)", v5.serialize(0x5912));
    }

    @Test
    void unnamedLayerModBitsRenderInHex()
    {
        assertEquals("LM1(0x3)", v6.serialize(0x5023));
        assertEquals("LM0(0x0)", v6.serialize(0x5000));
        assertEquals(0x5023, v6.deserialize("LM1(0x3)"));
        assertEquals(0x5000, v6.deserialize("LM0(0x0)"));
    }

    @Test
    void expressionsDeserialize()
    {
        assertEquals(0xF3, v6.deserialize("0x03 | 0xFF & 0xF0"));
        assertEquals(5, v6.deserialize("1 + 1 << 2"));
        assertEquals(0x0306, v6.deserialize("LCTL(LSFT(KC_C))"));
    }

    @Test
    void numericInputPassesThrough()
    {
        KeycodeCodec codec = v6;
        assertEquals(0x1234, codec.deserialize(0x1234));
    }

    @Test
    void unnamedValuesFallBackToPaddedHexAndReport()
    {
        RecordingKeycodeObservabilitySink sink = new RecordingKeycodeObservabilitySink();
        DefaultKeycodeCodec codec = new DefaultKeycodeCodec(v6.registry(), sink);

        assertEquals("0xffff", codec.serialize(0xFFFF));
        assertEquals("0x00ff", codec.serialize(0x00FF));
        assertEquals(0xFFFF, codec.deserialize("0xffff"));

        List<UnrepresentableValueEvent> events = sink.eventsOfType(UnrepresentableValueEvent.class);
        assertEquals(2, events.size());
        assertEquals(0xFFFF, events.get(0).value());
        assertEquals("0xffff", events.get(0).fallback());
    }

    @Test
    void unresolvableTextYieldsNoKeycodeAndReports()
    {
        RecordingKeycodeObservabilitySink sink = new RecordingKeycodeObservabilitySink();
        DefaultKeycodeCodec codec = new DefaultKeycodeCodec(v6.registry(), sink);

        assertEquals(KeycodeCodec.NO_KEYCODE, codec.deserialize("KC_NOPE"));
        assertEquals(KeycodeCodec.NO_KEYCODE, codec.deserialize("LT(1)"));
        assertEquals(KeycodeCodec.NO_KEYCODE, codec.deserialize("KC_A *"));
        assertEquals(KeycodeCodec.NO_KEYCODE, codec.deserialize(null));

        List<UnresolvedTextEvent> events = sink.eventsOfType(UnresolvedTextEvent.class);
        assertEquals(4, events.size());
        assertEquals("KC_NOPE", events.get(0).text());
        assertNotNull(events.get(0).cause());
        assertNull(events.get(3).text());
    }

    @Test
    void deeplyNestedTextYieldsNoKeycodeAndReports()
    {
        RecordingKeycodeObservabilitySink sink = new RecordingKeycodeObservabilitySink();
        DefaultKeycodeCodec codec = new DefaultKeycodeCodec(v6.registry(), sink);

        assertEquals(KeycodeCodec.NO_KEYCODE, codec.deserialize("(".repeat(5000) + "1" + ")".repeat(5000)));
        assertEquals(KeycodeCodec.NO_KEYCODE, codec.deserialize("-".repeat(50000) + "1"));
        assertEquals(2, sink.eventsOfType(UnresolvedTextEvent.class).size());
    }

    @Test
    void everySixteenBitValueRoundTrips()
    {
        for (DefaultKeycodeCodec codec : List.of(v5, v6)) {
            for (int value = 0; value <= 0xFFFF; value++) {
                String text = codec.serialize(value);
                assertEquals(value, codec.deserialize(text),
                        () -> codec.registry().protocol() + ": " + text);
            }
        }
    }

    @Test
    void everyRegisteredDescriptorRoundTrips()
    {
        for (ProtocolVersion version : ProtocolVersion.values()) {
            KeyboardContext context = KeyboardContext.builder()
                    .withProtocol(version)
                    .withLayers(32)
                    .withMacroCount(256)
                    .withTapDanceCount(32)
                    .withMidi(MidiLevel.ADVANCED)
                    .build();
            KeycodeRegistry registry = KeycodeRegistryBuilder.build(context, 1);
            DefaultKeycodeCodec codec = new DefaultKeycodeCodec(registry, NullKeycodeObservabilitySink.INSTANCE);

            for (Keycode keycode : registry.keycodes()) {
                int value = registry.valueOf(keycode).getAsInt();
                assertEquals(value, codec.deserialize(codec.serialize(value)), () -> version + ": " + keycode.id());
                assertEquals(value, codec.deserialize(keycode.id()), () -> version + ": " + keycode.id());
            }
        }
    }

    @Test
    void normalizeIsIdempotent()
    {
        for (String text : List.of("KC_ENT", "KC_EXLM", "LT(2, KC_A)", "CTL_T(KC_ESC)", "MO(1)",
                "LM(1, MOD_LCTL|MOD_LSFT)", "0xffff", "garbage", "RESET", "S(KC_1)")) {
            String once = v6.normalize(text);
            assertEquals(once, v6.normalize(once), text);
        }
        assertEquals("KC_ENTER", v6.normalize("KC_ENT"));
        assertEquals("QK_BOOT", v6.normalize("RESET"));
        assertEquals("KC_NO", v6.normalize("garbage"));
        assertEquals("LCTL_T(KC_ESCAPE)", v6.normalize("CTL_T(KC_ESC)"));
    }
}
