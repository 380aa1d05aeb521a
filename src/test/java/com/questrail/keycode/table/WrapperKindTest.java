package com.questrail.keycode.table;

import com.questrail.keycode.api.ProtocolVersion;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class WrapperKindTest
{
    private final ProtocolLayout v5 = KeycodeTables.forVersion(ProtocolVersion.V5).layout();
    private final ProtocolLayout v6 = KeycodeTables.forVersion(ProtocolVersion.V6).layout();

    @Test
    void packAndUnpackAgree() {
        int lt = WrapperKind.LAYER_TAP.pack(v6, 2, 0x04);
        assertEquals(0x4204, lt);
        assertArrayEquals(new int[] { 2, 0x04 }, WrapperKind.LAYER_TAP.unpack(v6, lt));

        int lm = WrapperKind.LAYER_MOD.pack(v6, 3, ModifierCombo.Mods.RSFT);
        assertEquals(0x5072, lm);
        assertArrayEquals(new int[] { 3, ModifierCombo.Mods.RSFT }, WrapperKind.LAYER_MOD.unpack(v6, lm));

        int to = WrapperKind.TO_LAYER.pack(v5, 4);
        assertEquals(0x5014, to);
        assertArrayEquals(new int[] { 4 }, WrapperKind.TO_LAYER.unpack(v5, to));
    }

    @Test
    void legacyLayerModDropsRightHandBit() {
        int lm = WrapperKind.LAYER_MOD.pack(v5, 1, ModifierCombo.Mods.RSFT);
        assertEquals(0x5912, lm);
        assertEquals(ModifierCombo.Mods.LSFT, WrapperKind.LAYER_MOD.unpack(v5, lm)[1]);
    }

    @Test
    void modifierMaskKeepsFiveBits() {
        assertEquals(0x1204, WrapperKind.MODIFIER.pack(v6, ModifierCombo.Mods.RSFT, 0x04));
        assertEquals(0x2F04, WrapperKind.MOD_TAP.pack(v6, ModifierCombo.HYPR.modifiers(), 0x04));
    }

    @Test
    void containsMatchesFamilyRanges() {
        assertTrue(WrapperKind.MOD_TAP.contains(v6, 0x2000));
        assertTrue(WrapperKind.MOD_TAP.contains(v6, 0x3FFF));
        assertFalse(WrapperKind.MOD_TAP.contains(v6, 0x4000));

        assertTrue(WrapperKind.LAYER_TAP.contains(v6, 0x4FFF));
        assertFalse(WrapperKind.LAYER_TAP.contains(v6, 0x5000));

        assertTrue(WrapperKind.LAYER_MOD.contains(v5, 0x59FF));
        assertFalse(WrapperKind.LAYER_MOD.contains(v5, 0x5A00));

        assertTrue(WrapperKind.SWAP_HANDS_TAP.contains(v6, 0x56EF));
        assertFalse(WrapperKind.SWAP_HANDS_TAP.contains(v6, 0x56F0));

        assertTrue(WrapperKind.MODIFIER.contains(v6, 0x0100));
        assertFalse(WrapperKind.MODIFIER.contains(v6, 0x00FF));
    }

    @Test
    void packRejectsWrongArity() {
        assertThrows(KeycodeTableException.class, () -> WrapperKind.LAYER_TAP.pack(v6, 1));
        assertThrows(KeycodeTableException.class, () -> WrapperKind.MOMENTARY.pack(v6, 1, 2));
    }
}
