package com.questrail.keycode.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class MaskedIdTest
{
    @Test
    void parseSplitsAtFirstParenthesis() {
        MaskedId id = MaskedId.parse("LCTL(LSFT(KC_A))").orElseThrow();
        assertEquals("LCTL", id.wrapper());
        assertEquals("LSFT(KC_A)", id.inner());
        assertEquals("LCTL(LSFT(KC_A))", id.render());
    }

    @Test
    void parseRejectsUnwrappedText() {
        assertTrue(MaskedId.parse("KC_A").isEmpty());
        assertTrue(MaskedId.parse("LT(1").isEmpty());
        assertTrue(MaskedId.parse(null).isEmpty());
    }

    @Test
    void templates() {
        MaskedId template = MaskedId.parse("LT3(kc)").orElseThrow();
        assertTrue(template.isTemplate());
        assertEquals("LT3(kc)", template.template());
        assertFalse(MaskedId.of("LT3", "KC_A").isTemplate());
        assertEquals("LT3(kc)", MaskedId.of("LT3", "KC_A").template());
    }

    @Test
    void lookupKeyDropsOnlyTheTemplateSuffix() {
        assertEquals("LSFT", MaskedId.lookupKey("LSFT(kc)"));
        assertEquals("MO(1)", MaskedId.lookupKey("MO(1)"));
        assertEquals("KC_A", MaskedId.lookupKey("KC_A"));
    }
}
