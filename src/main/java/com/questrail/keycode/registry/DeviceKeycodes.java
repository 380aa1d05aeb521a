package com.questrail.keycode.registry;

import com.questrail.keycode.api.Keycode;
import com.questrail.keycode.api.KeycodeCategory;
import com.questrail.keycode.config.CustomKeycodeDefinition;
import com.questrail.keycode.config.KeyboardContext;
import com.questrail.keycode.registry.catalog.MacroKeycodes;
import com.questrail.keycode.registry.catalog.MidiKeycodes;

import java.util.ArrayList;
import java.util.List;

/**
 * Descriptor families whose size or text depends on the connected device.
 */
final class DeviceKeycodes
{
    static final String LAYER_LOCK_FEATURE = "layer_lock";
    static final String PERSISTENT_DEFAULT_LAYER_FEATURE = "persistent_default_layer";

    private static final int DEFAULT_USER_KEYCODES = 16;
    private static final int MAX_LAYER_WRAPPERS = 16;
    private static final int HIDDEN_TAP_DANCE = 256;

    private enum LayerFamily {
        MO("Momentarily turn on layer when pressed (requires KC_TRNS on destination layer)", null),
        DF("Set the base (default) layer", null),
        PDF("Persistently set the base (default) layer", PERSISTENT_DEFAULT_LAYER_FEATURE),
        TG("Toggle layer on or off", null),
        TT("Normally acts like MO unless it's tapped multiple times, which toggles layer on", null),
        OSL("Momentarily activates layer until a key is pressed", null),
        TO("Turns on layer and turns off all other layers, except the default layer", null);

        private final String tooltip;
        private final String feature;

        LayerFamily(String tooltip, String feature) {
            this.tooltip = tooltip;
            this.feature = feature;
        }
    }

    private DeviceKeycodes() {
    }

    static List<Keycode> layers(KeyboardContext context) {
        int layers = context.layers();
        List<Keycode> keys = new ArrayList<>();

        keys.add(layer("QK_LAYER_LOCK", "Layer\nLock")
                .withTooltip("Locks the current layer")
                .withAliases("QK_LLCK")
                .withRequiresFeature(LAYER_LOCK_FEATURE)
                .build());
        if (layers >= 4) {
            keys.add(layer("FN_MO13", "Fn1\n(Fn3)").build());
            keys.add(layer("FN_MO23", "Fn2\n(Fn3)").build());
        }

        for (LayerFamily family : LayerFamily.values()) {
            for (int n = 0; n < layers; n++) {
                String id = family.name() + "(" + n + ")";
                keys.add(layer(id, id)
                        .withTooltip(family.tooltip)
                        .withRequiresFeature(family.feature)
                        .build());
            }
        }

        int wrappers = Math.min(layers, MAX_LAYER_WRAPPERS);
        for (int x = 0; x < wrappers; x++) {
            keys.add(layer("LT" + x + "(kc)", "LT " + x + "\n(kc)")
                    .withTooltip("kc on tap, switch to layer " + x + " while held")
                    .masked()
                    .build());
        }
        for (int x = 0; x < wrappers; x++) {
            keys.add(layer("LM" + x + "(kc)", "LM " + x + "\n(kc)")
                    .withTooltip("Momentarily activates layer " + x + " with modifier")
                    .masked()
                    .build());
        }
        return keys;
    }

    static List<Keycode> tapDance(KeyboardContext context) {
        List<Keycode> keys = new ArrayList<>(context.tapDanceCount());
        for (int x = 0; x < context.tapDanceCount(); x++) {
            String id = "TD(" + x + ")";
            keys.add(Keycode.builder(id, id)
                    .withCategory(KeycodeCategory.TAP_DANCE)
                    .withTooltip("Tap dance keycode")
                    .build());
        }
        return keys;
    }

    static List<Keycode> macros(KeyboardContext context) {
        List<Keycode> keys = new ArrayList<>(context.macroCount() + MacroKeycodes.DYNAMIC.size());
        for (int x = 0; x < context.macroCount(); x++) {
            String id = "M" + x;
            keys.add(Keycode.builder(id, id).withCategory(KeycodeCategory.MACRO).build());
        }
        keys.addAll(MacroKeycodes.DYNAMIC);
        return keys;
    }

    /**
     * Custom keycodes when the device declares any, otherwise sixteen generic
     * {@code USER00..USER15} entries.
     */
    static List<Keycode> user(KeyboardContext context) {
        List<CustomKeycodeDefinition> custom = context.customKeycodes();
        List<Keycode> keys = new ArrayList<>();
        if (custom.isEmpty()) {
            for (int x = 0; x < DEFAULT_USER_KEYCODES; x++) {
                keys.add(Keycode.builder(userId(x), "User " + x)
                        .withCategory(KeycodeCategory.USER)
                        .withTooltip("User keycode " + x)
                        .build());
            }
            return keys;
        }
        for (int x = 0; x < custom.size(); x++) {
            CustomKeycodeDefinition c = custom.get(x);
            String id = userId(x);
            keys.add(Keycode.builder(id, c.shortName().orElse(id))
                    .withCategory(KeycodeCategory.USER)
                    .withTooltip(c.title().orElse(id))
                    .withAliases(c.name().orElse(id))
                    .build());
        }
        return keys;
    }

    static List<Keycode> hidden() {
        List<Keycode> keys = new ArrayList<>(HIDDEN_TAP_DANCE);
        for (int x = 0; x < HIDDEN_TAP_DANCE; x++) {
            String id = "TD(" + x + ")";
            keys.add(Keycode.builder(id, id).withCategory(KeycodeCategory.HIDDEN).build());
        }
        return keys;
    }

    static List<Keycode> midi(KeyboardContext context) {
        List<Keycode> keys = new ArrayList<>();
        if (context.midi().includesBasic()) {
            keys.addAll(MidiKeycodes.BASIC);
        }
        if (context.midi().includesAdvanced()) {
            keys.addAll(MidiKeycodes.ADVANCED);
        }
        return keys;
    }

    static String userId(int index) {
        return String.format("USER%02d", index);
    }

    private static Keycode.Builder layer(String id, String label) {
        return Keycode.builder(id, label).withCategory(KeycodeCategory.LAYERS);
    }
}
