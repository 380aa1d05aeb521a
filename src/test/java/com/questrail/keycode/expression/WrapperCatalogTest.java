package com.questrail.keycode.expression;

import com.questrail.keycode.table.ModifierCombo;
import com.questrail.keycode.table.WrapperKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class WrapperCatalogTest
{
    private final WrapperCatalog catalog = WrapperCatalog.standard();

    @Test
    void everyModifierComboHasMaskAndTapWrappers() {
        for (ModifierCombo combo : ModifierCombo.values()) {
            Wrapper mask = catalog.find(combo.maskName()).orElseThrow();
            assertEquals(WrapperKind.MODIFIER, mask.kind());
            assertEquals(combo.modifiers(), mask.fixedArgument().getAsInt());
            assertEquals(1, mask.arity());

            Wrapper tap = catalog.find(combo.tapName()).orElseThrow();
            assertEquals(WrapperKind.MOD_TAP, tap.kind());
            assertEquals(1, tap.arity());
        }
    }

    @Test
    void aliasesShareTheirTargetsPackingRule() {
        Wrapper alias = catalog.find("LWIN").orElseThrow();
        assertEquals("LWIN", alias.name());
        assertEquals(catalog.find("LGUI").orElseThrow().fixedArgument(), alias.fixedArgument());
    }

    @Test
    void numberedLayerWrappersFixTheLayer() {
        Wrapper lt15 = catalog.find("LT15").orElseThrow();
        assertEquals(WrapperKind.LAYER_TAP, lt15.kind());
        assertEquals(15, lt15.fixedArgument().getAsInt());
        assertTrue(catalog.find("LT16").isEmpty());
        assertTrue(catalog.find("LM0").isPresent());
    }

    @Test
    void genericWrappersTakeFullArity() {
        assertEquals(2, catalog.find("MT").orElseThrow().arity());
        assertEquals(2, catalog.find("LM").orElseThrow().arity());
        assertEquals(1, catalog.find("PDF").orElseThrow().arity());
        assertTrue(catalog.find("M").isEmpty());
    }

    @Test
    void singleArgumentKindsCannotBeFixed() {
        assertThrows(IllegalArgumentException.class, () -> Wrapper.fixed("MO1", WrapperKind.MOMENTARY, 1));
    }

    @Test
    void namesAreUnmodifiable() {
        assertThrows(UnsupportedOperationException.class, () -> catalog.names().add("X"));
    }
}
