package com.questrail.keycode.table;

import com.questrail.keycode.api.ProtocolVersion;

import java.util.List;
import java.util.Objects;

/**
 * KeycodeTableGenerator
 * =============================================================================
 * Builds the complete {@link KeycodeTable} for a protocol revision.
 *
 * <h2>Construction order</h2>
 * <ol>
 *   <li>Shared HID values, modifier masks and {@code MOD_*} bits</li>
 *   <li>Revision-specific values and structural constants</li>
 *   <li>Shifted symbols, as {@code LSFT} over their base key</li>
 *   <li>Modifier mask and mod-tap templates for every {@link ModifierCombo}</li>
 *   <li>One-shot modifiers, swap-hands tap</li>
 *   <li>Indexed families ({@code MO(n)}, {@code TD(n)}, {@code M<n>}, {@code LT<n>(kc)} ...)</li>
 * </ol>
 *
 * <p>Steps 3 to 6 are the same code for both revisions; they only see the
 * revision through the {@link ProtocolLayout} read after step 2.</p>
 *
 * <p>Each call returns a fresh table. Callers that need the shared instance
 * use {@link KeycodeTables}.</p>
 */
public final class KeycodeTableGenerator
{
    public static final int LAYER_FAMILY_SIZE = 32;
    public static final int LAYER_WRAPPER_COUNT = 16;
    public static final int TAP_DANCE_COUNT = 256;
    public static final int MACRO_COUNT = 256;
    public static final int USER_COUNT = 64;

    static final List<KeycodeFamily> FAMILIES = List.of(
            KeycodeFamily.of("MO(%d)", WrapperKind.MOMENTARY, LAYER_FAMILY_SIZE),
            KeycodeFamily.of("DF(%d)", WrapperKind.DEFAULT_LAYER, LAYER_FAMILY_SIZE),
            KeycodeFamily.of("PDF(%d)", WrapperKind.PERSISTENT_DEFAULT_LAYER, LAYER_FAMILY_SIZE),
            KeycodeFamily.of("TG(%d)", WrapperKind.TOGGLE_LAYER, LAYER_FAMILY_SIZE),
            KeycodeFamily.of("TT(%d)", WrapperKind.LAYER_TAP_TOGGLE, LAYER_FAMILY_SIZE),
            KeycodeFamily.of("OSL(%d)", WrapperKind.ONE_SHOT_LAYER, LAYER_FAMILY_SIZE),
            KeycodeFamily.of("TO(%d)", WrapperKind.TO_LAYER, LAYER_FAMILY_SIZE),
            KeycodeFamily.of("TD(%d)", WrapperKind.TAP_DANCE, TAP_DANCE_COUNT),
            KeycodeFamily.of("M%d", WrapperKind.MACRO, MACRO_COUNT),
            KeycodeFamily.of("USER%02d", WrapperKind.USER, USER_COUNT),
            KeycodeFamily.masked("LT%d(kc)", WrapperKind.LAYER_TAP, LAYER_WRAPPER_COUNT),
            KeycodeFamily.masked("LM%d(kc)", WrapperKind.LAYER_MOD, LAYER_WRAPPER_COUNT)
    );

    static final List<String> ONE_SHOT_MODIFIERS = List.of(
            "MOD_LSFT", "MOD_LCTL", "MOD_LALT", "MOD_LGUI",
            "MOD_LCTL|MOD_LSFT", "MOD_LCTL|MOD_LALT", "MOD_LCTL|MOD_LGUI",
            "MOD_LSFT|MOD_LALT", "MOD_LALT|MOD_LGUI", "MOD_LSFT|MOD_LGUI",
            "MOD_MEH", "MOD_LCTL|MOD_LSFT|MOD_LGUI", "MOD_LCTL|MOD_LALT|MOD_LGUI",
            "MOD_LSFT|MOD_LALT|MOD_LGUI", "MOD_HYPR",
            "MOD_RSFT", "MOD_RCTL", "MOD_RALT", "MOD_RGUI",
            "MOD_RCTL|MOD_RSFT", "MOD_RCTL|MOD_RALT", "MOD_RCTL|MOD_RGUI",
            "MOD_RSFT|MOD_RALT", "MOD_RALT|MOD_RGUI", "MOD_RSFT|MOD_RGUI",
            "MOD_RCTL|MOD_RSFT|MOD_RALT", "MOD_RCTL|MOD_RSFT|MOD_RGUI",
            "MOD_RCTL|MOD_RALT|MOD_RGUI", "MOD_RSFT|MOD_RALT|MOD_RGUI",
            "MOD_RCTL|MOD_RSFT|MOD_RALT|MOD_RGUI"
    );

    private KeycodeTableGenerator() {
    }

    public static KeycodeTable generate(ProtocolVersion version) {
        Objects.requireNonNull(version, "version");
        KeycodeTable.Builder table = KeycodeTable.builder(version);

        SharedKeycodeValues.define(table);
        switch (version) {
            case V5 -> LegacyKeycodeValues.define(table);
            case V6 -> CurrentKeycodeValues.define(table);
        }

        ProtocolLayout layout = table.layout();

        for (ShiftedSymbol symbol : ShiftedSymbol.values()) {
            table.define(symbol.id(), WrapperKind.MODIFIER.pack(
                    layout, ModifierCombo.LSFT.modifiers(), table.resolve(symbol.baseId())));
        }

        for (ModifierCombo combo : ModifierCombo.values()) {
            table.masked(combo.maskTemplate(), WrapperKind.MODIFIER.pack(layout, combo.modifiers(), 0));
        }
        for (ModifierCombo combo : ModifierCombo.values()) {
            table.masked(combo.tapTemplate(), WrapperKind.MOD_TAP.pack(layout, combo.modifiers(), 0));
        }

        for (String operand : ONE_SHOT_MODIFIERS) {
            int mods = 0;
            for (String mod : operand.split("\\|")) {
                mods |= table.resolve(mod);
            }
            table.define("OSM(" + operand + ")", WrapperKind.ONE_SHOT_MOD.pack(layout, mods));
        }

        table.masked("SH_T(kc)", WrapperKind.SWAP_HANDS_TAP.pack(layout, 0));

        for (KeycodeFamily family : FAMILIES) {
            family.expandInto(table, layout);
        }

        return table.build();
    }
}
