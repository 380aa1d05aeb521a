package com.questrail.keycode.codec;

import com.questrail.keycode.api.Keycode;
import com.questrail.keycode.api.ProtocolVersion;
import com.questrail.keycode.codec.impl.DefaultKeycodeCodec;
import com.questrail.keycode.config.KeyboardContext;
import com.questrail.keycode.observability.NullKeycodeObservabilitySink;
import com.questrail.keycode.observability.RecordingKeycodeObservabilitySink;
import com.questrail.keycode.registry.KeycodeRegistry;
import com.questrail.keycode.registry.KeycodeRegistryBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

final class KeycodeQueriesTest
{
    private static KeycodeQueries queriesFor(ProtocolVersion version) {
        KeycodeRegistry registry = KeycodeRegistryBuilder.build(KeyboardContext.defaults(version), 1);
        return new KeycodeQueries(registry, new DefaultKeycodeCodec(registry, NullKeycodeObservabilitySink.INSTANCE));
    }

    private final KeycodeQueries v5 = queriesFor(ProtocolVersion.V5);
    private final KeycodeQueries v6 = queriesFor(ProtocolVersion.V6);

    @Test
    void maskDetection() {
        assertTrue(v6.isMask("LSFT(KC_A)"));
        assertTrue(v6.isMask("LT2(KC_A)"));
        assertTrue(v6.isMask("SH_T(KC_A)"));
        assertFalse(v6.isMask("MO(1)"));
        assertFalse(v6.isMask("KC_A"));
        assertFalse(v6.isMask(null));
    }

    @Test
    void basicDetection() {
        assertTrue(v6.isBasic("KC_A"));
        assertTrue(v6.isBasic("KC_ENT"));
        assertFalse(v6.isBasic("LSFT(KC_A)"));
        assertFalse(v6.isBasic("MO(1)"));
    }

    @Test
    void outerAndInnerLookups() {
        assertEquals("KC_NO", v6.findKeycode("kc").orElseThrow().id());
        assertEquals("LSFT(kc)", v6.findKeycode("LSFT(kc)").orElseThrow().id());
        assertEquals("LT2(kc)", v6.findOuterKeycode("LT2(KC_A)").orElseThrow().id());
        assertEquals("KC_A", v6.findInnerKeycode("LT2(KC_A)").orElseThrow().id());
        assertEquals("KC_A", v6.findOuterKeycode("KC_A").orElseThrow().id());
        assertEquals("MO(1)", v6.findOuterKeycode("MO(1)").orElseThrow().id());
        assertTrue(v6.findKeycode(null).isEmpty());
    }

    @Test
    void recorderAliasLookup() {
        assertEquals("KC_A", v6.findByRecorderAlias("a").orElseThrow().id());
        assertEquals("KC_LCTRL", v6.findByRecorderAlias("ctrl").orElseThrow().id());
        assertTrue(v6.findByRecorderAlias("KC_A").isEmpty());
    }

    @Test
    void labelsAndTooltips() {
        assertEquals("A", v6.keycodeLabel("KC_A"));
        assertEquals("LSft\n(kc)", v6.keycodeLabel("LSFT(KC_A)"));
        assertEquals("NOT_A_KEY", v6.keycodeLabel("NOT_A_KEY"));

        assertEquals("LCTL_T(kc): Left Control when held, kc when tapped",
                v6.keycodeTooltip("LCTL_T(KC_A)").orElseThrow());
        assertEquals("KC_A", v6.keycodeTooltip("KC_A").orElseThrow());
        assertTrue(v6.keycodeTooltip("NOT_A_KEY").isEmpty());
    }

    @Test
    void codeToLabelFlattensText() {
        assertEquals("A", v6.codeToLabel(0x04));
        assertEquals("! 1", v6.codeToLabel(0x1E));
        assertEquals("LT2(A)", v6.codeToLabel(0x4204));
        assertEquals("LSFT(1)", v6.codeToLabel(0x021E));
    }

    @Test
    void exportUsesHexForExtendedKeycodes() {
        assertEquals("0x5021", v6.serializeForExport(0x5021));
        assertEquals("0x1f04", v6.serializeForExport(0x1F04));
        assertEquals("0x5604", v6.serializeForExport(0x5604));
        assertEquals("LSFT(KC_A)", v6.serializeForExport(0x0204));
        assertEquals("LCTL_T(KC_A)", v6.serializeForExport(0x2104));
        assertEquals("KC_A", v6.serializeForExport(0x04));
        assertEquals("MO(1)", v6.serializeForExport(0x5221));
    }

    @Test
    void modifierMaskHelpers() {
        assertTrue(v6.isModMaskKeycode(0x0204));
        assertFalse(v6.isModMaskKeycode(0x04));
        assertTrue(v6.isModifiableKeycode(0x04));
        assertFalse(v6.isModifiableKeycode(0x2104));

        assertEquals(0x12, v6.extractModMask(0x1204));
        assertEquals(0x04, v6.extractBasicKey(0x1204));
        assertEquals(0x0204, v6.buildModMaskKeycode(0x02, 0x04));
        assertEquals(0x04, v6.buildModMaskKeycode(0, 0x104));
    }

    @Test
    void tapHelpers() {
        assertEquals(0x2104, v6.buildModTapKeycode(0x01, 0x04));
        assertEquals(0x6104, v5.buildModTapKeycode(0x01, 0x04));
        assertEquals(0x04, v6.buildModTapKeycode(0, 0x04));
        assertTrue(v6.isModTapKeycode(0x2104));
        assertFalse(v5.isModTapKeycode(0x2104));

        assertEquals(0x4204, v6.buildLayerTapKeycode(2, 0x04));
        assertTrue(v6.isLayerTapKeycode(0x4204));
        assertEquals(2, v6.extractLayerTapLayer(0x4204));

        assertEquals(0x5604, v6.buildSwapHandsTapKeycode(0x04));
        assertTrue(v6.isSwapHandsTapKeycode(0x5604));
        assertFalse(v6.isSwapHandsTapKeycode(0x56F0));
    }

    @Test
    void layerModHelpers() {
        assertEquals(0x5021, v6.buildLayerModKeycode(1, 0x01));
        assertEquals(0x5911, v5.buildLayerModKeycode(1, 0x01));
        assertTrue(v6.isLayerModKeycode(0x5021));
        assertFalse(v6.isLayerModKeycode(0x5221));
        assertEquals(3, v6.extractLayerModLayer(0x5072));
        assertEquals(0x12, v6.extractLayerModModifiers(0x5072));
    }

    @Test
    void legacyLayerModOffersLeftHandModifiersOnly() {
        List<String> current = v6.availableLayerModifiers().stream().map(Keycode::id).toList();
        List<String> legacy = v5.availableLayerModifiers().stream().map(Keycode::id).toList();

        assertEquals(10, current.size());
        assertEquals(List.of("MOD_LCTL", "MOD_LSFT", "MOD_LALT", "MOD_LGUI", "MOD_MEH", "MOD_HYPR"), legacy);
    }

    @Test
    void tapDanceMacroAndReset() {
        assertTrue(v6.isTapDanceKeycode(0x5703));
        assertEquals(3, v6.tapDanceIndex(0x5703));
        assertFalse(v6.isTapDanceKeycode(0x5221));

        assertTrue(v6.isMacroKeycode(0x7705));
        assertEquals(OptionalInt.of(5), v6.macroIndex(0x7705));
        assertEquals(OptionalInt.of(5), v5.macroIndex(0x5F17));
        assertFalse(v6.isMacroKeycode(0x04));
        assertEquals(OptionalInt.empty(), v6.macroIndex(0x04));

        assertTrue(v6.isResetKeycode(0x7C00));
        assertTrue(v5.isResetKeycode(0x5C00));
        assertFalse(v6.isResetKeycode(0x5C00));
    }

    @Test
    void predicatesOnUnnamedValuesReportNothing() {
        RecordingKeycodeObservabilitySink sink = new RecordingKeycodeObservabilitySink();
        KeycodeRegistry registry = KeycodeRegistryBuilder.build(KeyboardContext.defaults(ProtocolVersion.V6), 1);
        KeycodeQueries queries = new KeycodeQueries(registry, new DefaultKeycodeCodec(registry, sink));

        assertFalse(queries.isMacroKeycode(0xFFFF));
        assertEquals(OptionalInt.empty(), queries.macroIndex(0xFFFF));
        assertFalse(queries.isResetKeycode(0xFFFF));
        assertTrue(queries.isMacroKeycode(0x7705));
        assertTrue(queries.isResetKeycode(0x7C00));

        assertTrue(sink.getAllEvents().isEmpty());
    }
}
