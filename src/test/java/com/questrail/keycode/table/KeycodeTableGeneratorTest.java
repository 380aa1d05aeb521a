package com.questrail.keycode.table;

import com.questrail.keycode.api.ProtocolVersion;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KeycodeTableGeneratorTest
 * -----------------------------------------------------------------------------
 * Anchor values for both protocol revisions and the structural guarantees of
 * table generation.
 */
final class KeycodeTableGeneratorTest
{
    private final KeycodeTable v5 = KeycodeTableGenerator.generate(ProtocolVersion.V5);
    private final KeycodeTable v6 = KeycodeTableGenerator.generate(ProtocolVersion.V6);

    @Test
    void basicAndModifierValuesAreSharedAcrossRevisions()
    {
        for (String name : List.of("KC_NO", "KC_TRNS", "KC_A", "KC_Z", "KC_1", "KC_0", "KC_ENTER",
                "KC_F1", "KC_F12", "KC_F24", "KC_LCTRL", "KC_RGUI", "QK_LSFT", "QK_RGUI",
                "MOD_LCTL", "MOD_RSFT", "MOD_MEH", "MOD_HYPR", "KC_EXLM", "LSFT(kc)", "RHYPR(kc)")) {
            assertEquals(v5.resolve(name), v6.resolve(name), name);
        }
        assertEquals(0x04, v6.resolve("KC_A"));
        assertEquals(0x3A, v6.resolve("KC_F1"));
        assertEquals(0x45, v6.resolve("KC_F12"));
        assertEquals(0x0F, v6.resolve("MOD_HYPR"));
    }

    @Test
    void shiftedSymbolsAreLeftShiftOverTheirBaseKey()
    {
        assertEquals(0x021E, v6.resolve("KC_EXLM"));
        for (ShiftedSymbol symbol : ShiftedSymbol.values()) {
            assertEquals(0x0200 | v6.resolve(symbol.baseId()), v6.resolve(symbol.id()), symbol.id());
        }
    }

    @Test
    void layerFamiliesFollowEachRevisionsLayout()
    {
        assertEquals(0x5101, v5.resolve("MO(1)"));
        assertEquals(0x5221, v6.resolve("MO(1)"));

        // v5 sets the on-press bit, v6 does not
        assertEquals(0x5011, v5.resolve("TO(1)"));
        assertEquals(0x5201, v6.resolve("TO(1)"));

        assertEquals(0x5703, v5.resolve("TD(3)"));
        assertEquals(0x5703, v6.resolve("TD(3)"));

        assertEquals(0x5F17, v5.resolve("M5"));
        assertEquals(0x7705, v6.resolve("M5"));

        assertEquals(0x7E00, v6.resolve("USER00"));
        assertEquals(0x7E3F, v6.resolve("USER63"));
    }

    @Test
    void familySizesCoverTheirFullRange()
    {
        assertTrue(v6.contains("MO(31)"));
        assertFalse(v6.contains("MO(32)"));
        assertTrue(v6.contains("TD(255)"));
        assertFalse(v6.contains("TD(256)"));
        assertTrue(v6.contains("M255"));
        assertTrue(v6.contains("LT15(kc)"));
        assertFalse(v6.contains("LT16(kc)"));
        assertTrue(v6.contains("LM15(kc)"));
    }

    @Test
    void layerModLayoutDiffersByRevision()
    {
        assertEquals(4, v5.layout().layerModShift());
        assertEquals(0x0F, v5.layout().layerModMask());
        assertEquals(5, v6.layout().layerModShift());
        assertEquals(0x1F, v6.layout().layerModMask());

        assertEquals(0x5910, v5.resolve("LM1(kc)"));
        assertEquals(0x5020, v6.resolve("LM1(kc)"));
        assertEquals(0x59FF, v5.layout().layerModMaxCode());
        assertEquals(0x51FF, v6.layout().layerModMaxCode());
    }

    @Test
    void maskedWrappersAreRecorded()
    {
        for (String wrapper : List.of("LSFT", "C_S", "RHYPR", "LCTL_T", "ALL_T", "RALL_T", "SH_T", "LT0", "LT15", "LM0")) {
            assertTrue(v6.isMaskedWrapper(wrapper), wrapper);
        }
        assertFalse(v6.isMaskedWrapper("MO"));
        assertFalse(v6.isMaskedWrapper("KC_A"));

        assertEquals("LSFT", v6.maskedWrapperAt(0x0200).orElseThrow());
        assertEquals("LCTL_T", v6.maskedWrapperAt(0x2100).orElseThrow());
        assertEquals("LT2", v6.maskedWrapperAt(0x4200).orElseThrow());
        assertTrue(v6.isMaskedValue(0x0200));
        assertFalse(v6.isMaskedValue(0x0204));
    }

    @Test
    void oneShotModifiersCombineModBits()
    {
        assertEquals(0x52A2, v6.resolve("OSM(MOD_LSFT)"));
        assertEquals(0x52A3, v6.resolve("OSM(MOD_LCTL|MOD_LSFT)"));
        assertEquals(0x551F, v5.resolve("OSM(MOD_RCTL|MOD_RSFT|MOD_RALT|MOD_RGUI)"));
    }

    @Test
    void legacyRevisionParksMissingFeaturesAboveSixteenBits()
    {
        assertTrue(v5.resolve("SH_T(kc)") > 0xFFFF);
        assertTrue(v5.resolve("PDF(0)") > 0xFFFF);
        assertEquals(0x5600, v6.resolve("SH_T(kc)"));
        assertEquals(0x52E0, v6.resolve("PDF(0)"));
    }

    @Test
    void resolveUnknownNameThrows()
    {
        KeycodeTableException e = assertThrows(KeycodeTableException.class, () -> v6.resolve("KC_NOPE"));
        assertTrue(e.getMessage().contains("KC_NOPE"));
        assertTrue(v6.find("KC_NOPE").isEmpty());
    }

    @Test
    void generationIsDeterministicAndFresh()
    {
        KeycodeTable again = KeycodeTableGenerator.generate(ProtocolVersion.V6);
        assertNotSame(v6, again);
        assertEquals(v6.values(), again.values());
        assertEquals(v6.maskedWrappers(), again.maskedWrappers());
    }

    @Test
    void sharedTablesAreCachedPerRevision()
    {
        assertSame(KeycodeTables.forVersion(ProtocolVersion.V6), KeycodeTables.forVersion(ProtocolVersion.V6));
        assertEquals(ProtocolVersion.V5, KeycodeTables.forVersion(ProtocolVersion.V5).version());
    }

    @Test
    void builderRejectsDuplicateDefinitions()
    {
        KeycodeTable.Builder builder = KeycodeTable.builder(ProtocolVersion.V6);
        builder.define("KC_X", 1);
        assertThrows(KeycodeTableException.class, () -> builder.define("KC_X", 2));
    }
}
