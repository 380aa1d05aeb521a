package com.questrail.keycode.registry.catalog;

import com.questrail.keycode.api.Keycode;
import com.questrail.keycode.api.KeycodeCategory;

import java.util.List;

/** Dynamic macro keys. Numbered {@code M<n>} macros depend on the device and are built by the registry. */
public final class MacroKeycodes
{
    public static final List<Keycode> DYNAMIC = List.of(
            macro("DYN_REC_START1", "DM1\nRec").withTooltip("Dynamic Macro 1 Rec Start").withAliases("DM_REC1").build(),
            macro("DYN_REC_START2", "DM2\nRec").withTooltip("Dynamic Macro 2 Rec Start").withAliases("DM_REC2").build(),
            macro("DYN_REC_STOP", "DM Rec\nStop").withTooltip("Dynamic Macro Rec Stop").withAliases("DM_RSTP").build(),
            macro("DYN_MACRO_PLAY1", "DM1\nPlay").withTooltip("Dynamic Macro 1 Play").withAliases("DM_PLY1").build(),
            macro("DYN_MACRO_PLAY2", "DM2\nPlay").withTooltip("Dynamic Macro 2 Play").withAliases("DM_PLY2").build()
    );

    private MacroKeycodes() {
    }

    private static Keycode.Builder macro(String id, String label) {
        return Keycode.builder(id, label).withCategory(KeycodeCategory.MACRO);
    }
}
