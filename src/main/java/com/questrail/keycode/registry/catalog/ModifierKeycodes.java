package com.questrail.keycode.registry.catalog;

import com.questrail.keycode.api.Keycode;
import com.questrail.keycode.api.KeycodeCategory;

import java.util.List;

/**
 * One-shot modifiers, modifier masks, mod-taps and the space-cadet keys.
 */
public final class ModifierKeycodes
{
    public static final List<Keycode> OSM_LEFT = List.of(
            modifier("OSM(MOD_LSFT)", "OSM\nLSft").withTooltip("Enable Left Shift for one keypress").build(),
            modifier("OSM(MOD_LCTL)", "OSM\nLCtl").withTooltip("Enable Left Control for one keypress").build(),
            modifier("OSM(MOD_LALT)", "OSM\nLAlt").withTooltip("Enable Left Alt for one keypress").build(),
            modifier("OSM(MOD_LGUI)", "OSM\nLGUI").withTooltip("Enable Left GUI for one keypress").build(),
            modifier("OSM(MOD_LCTL|MOD_LSFT)", "OSM\nLCS").withTooltip("Enable Left Control and Shift for one keypress").build(),
            modifier("OSM(MOD_LCTL|MOD_LALT)", "OSM\nLCA").withTooltip("Enable Left Control and Alt for one keypress").build(),
            modifier("OSM(MOD_LCTL|MOD_LGUI)", "OSM\nLCG").withTooltip("Enable Left Control and GUI for one keypress").build(),
            modifier("OSM(MOD_LSFT|MOD_LALT)", "OSM\nLSA").withTooltip("Enable Left Shift and Alt for one keypress").build(),
            modifier("OSM(MOD_LALT|MOD_LGUI)", "OSM\nLAG").withTooltip("Enable Left Alt and GUI for one keypress").build(),
            modifier("OSM(MOD_LSFT|MOD_LGUI)", "OSM\nLSG").withTooltip("Enable Left Shift and GUI for one keypress").build(),
            modifier("OSM(MOD_MEH)", "OSM\nMeh").withTooltip("Enable Left Control, Shift, and Alt for one keypress").build(),
            modifier("OSM(MOD_LCTL|MOD_LSFT|MOD_LGUI)", "OSM\nLCSG").withTooltip("Enable Left Control, Shift, and GUI for one keypress").build(),
            modifier("OSM(MOD_LCTL|MOD_LALT|MOD_LGUI)", "OSM\nLCAG").withTooltip("Enable Left Control, Alt, and GUI for one keypress").build(),
            modifier("OSM(MOD_LSFT|MOD_LALT|MOD_LGUI)", "OSM\nLSAG").withTooltip("Enable Left Shift, Alt, and GUI for one keypress").build(),
            modifier("OSM(MOD_HYPR)", "OSM\nHyper").withTooltip("Enable Left Control, Shift, Alt, and GUI for one keypress").build()
    );

    public static final List<Keycode> OSM_RIGHT = List.of(
            modifier("OSM(MOD_RSFT)", "OSM\nRSft").withTooltip("Enable Right Shift for one keypress").build(),
            modifier("OSM(MOD_RCTL)", "OSM\nRCtl").withTooltip("Enable Right Control for one keypress").build(),
            modifier("OSM(MOD_RALT)", "OSM\nRAlt").withTooltip("Enable Right Alt for one keypress").build(),
            modifier("OSM(MOD_RGUI)", "OSM\nRGUI").withTooltip("Enable Right GUI for one keypress").build(),
            modifier("OSM(MOD_RCTL|MOD_RSFT)", "OSM\nRCS").withTooltip("Enable Right Control and Shift for one keypress").build(),
            modifier("OSM(MOD_RCTL|MOD_RALT)", "OSM\nRCA").withTooltip("Enable Right Control and Alt for one keypress").build(),
            modifier("OSM(MOD_RCTL|MOD_RGUI)", "OSM\nRCG").withTooltip("Enable Right Control and GUI for one keypress").build(),
            modifier("OSM(MOD_RSFT|MOD_RALT)", "OSM\nRSA").withTooltip("Enable Right Shift and Alt for one keypress").build(),
            modifier("OSM(MOD_RALT|MOD_RGUI)", "OSM\nRAG").withTooltip("Enable Right Alt and GUI for one keypress").build(),
            modifier("OSM(MOD_RSFT|MOD_RGUI)", "OSM\nRSG").withTooltip("Enable Right Shift and GUI for one keypress").build(),
            modifier("OSM(MOD_RCTL|MOD_RSFT|MOD_RALT)", "OSM\nRMeh").withTooltip("Enable Right Control, Shift, and Alt for one keypress").build(),
            modifier("OSM(MOD_RCTL|MOD_RSFT|MOD_RGUI)", "OSM\nRCSG").withTooltip("Enable Right Control, Shift, and GUI for one keypress").build(),
            modifier("OSM(MOD_RCTL|MOD_RALT|MOD_RGUI)", "OSM\nRCAG").withTooltip("Enable Right Control, Alt, and GUI for one keypress").build(),
            modifier("OSM(MOD_RSFT|MOD_RALT|MOD_RGUI)", "OSM\nRSAG").withTooltip("Enable Right Shift, Alt, and GUI for one keypress").build(),
            modifier("OSM(MOD_RCTL|MOD_RSFT|MOD_RALT|MOD_RGUI)", "OSM\nRHyper").withTooltip("Enable Right Control, Shift, Alt, and GUI for one keypress").build()
    );

    public static final List<Keycode> MASK_LEFT = List.of(
            modifier("LSFT(kc)", "LSft\n(kc)").masked().build(),
            modifier("LCTL(kc)", "LCtl\n(kc)").masked().build(),
            modifier("LALT(kc)", "LAlt\n(kc)").masked().build(),
            modifier("LGUI(kc)", "LGui\n(kc)").masked().build(),
            modifier("C_S(kc)", "LCS\n(kc)").withTooltip("LCTL + LSFT").masked().withAliases("LCS(kc)").build(),
            modifier("LCA(kc)", "LCA\n(kc)").withTooltip("LCTL + LALT").masked().build(),
            modifier("LCG(kc)", "LCG\n(kc)").withTooltip("LCTL + LGUI").masked().build(),
            modifier("LSA(kc)", "LSA\n(kc)").withTooltip("LSFT + LALT").masked().build(),
            modifier("LAG(kc)", "LAG\n(kc)").withTooltip("LALT + LGUI").masked().build(),
            modifier("SGUI(kc)", "LSG\n(kc)").withTooltip("LGUI + LSFT").masked().withAliases("LSG(kc)").build(),
            modifier("MEH(kc)", "Meh\n(kc)").withTooltip("LCTL + LSFT + LALT").masked().build(),
            modifier("LCSG(kc)", "LCSG\n(kc)").withTooltip("LCTL + LSFT + LGUI").masked().build(),
            modifier("LCAG(kc)", "LCAG\n(kc)").withTooltip("LCTL + LALT + LGUI").masked().build(),
            modifier("LSAG(kc)", "LSAG\n(kc)").withTooltip("LSFT + LALT + LGUI").masked().build(),
            modifier("HYPR(kc)", "Hyper\n(kc)").withTooltip("LCTL + LSFT + LALT + LGUI").masked().build()
    );

    public static final List<Keycode> MASK_RIGHT = List.of(
            modifier("RSFT(kc)", "RSft\n(kc)").masked().build(),
            modifier("RCTL(kc)", "RCtl\n(kc)").masked().build(),
            modifier("RALT(kc)", "RAlt\n(kc)").masked().build(),
            modifier("RGUI(kc)", "RGui\n(kc)").masked().build(),
            modifier("RCS(kc)", "RCS\n(kc)").withTooltip("RCTL + RSFT").masked().build(),
            modifier("RCA(kc)", "RCA\n(kc)").withTooltip("RCTL + RALT").masked().build(),
            modifier("RSA(kc)", "RSA\n(kc)").withTooltip("RSFT + RALT").masked().build(),
            modifier("RCG(kc)", "RCG\n(kc)").withTooltip("RCTL + RGUI").masked().build(),
            modifier("RSG(kc)", "RSG\n(kc)").withTooltip("RSFT + RGUI").masked().build(),
            modifier("RAG(kc)", "RAG\n(kc)").withTooltip("RALT + RGUI").masked().build(),
            modifier("RMEH(kc)", "RMeh\n(kc)").withTooltip("RCTL + RSFT + RALT").masked().build(),
            modifier("RCSG(kc)", "RCSG\n(kc)").withTooltip("RCTL + RSFT + RGUI").masked().build(),
            modifier("RCAG(kc)", "RCAG\n(kc)").withTooltip("RCTL + RALT + RGUI").masked().build(),
            modifier("RSAG(kc)", "RSAG\n(kc)").withTooltip("RSFT + RALT + RGUI").masked().build(),
            modifier("RHYPR(kc)", "RHyper\n(kc)").withTooltip("RCTL + RSFT + RALT + RGUI").masked().build()
    );

    public static final List<Keycode> TAP_LEFT = List.of(
            modifier("LSFT_T(kc)", "LSft_T\n(kc)").withTooltip("Left Shift when held, kc when tapped").masked().build(),
            modifier("LCTL_T(kc)", "LCtl_T\n(kc)").withTooltip("Left Control when held, kc when tapped").masked().build(),
            modifier("LALT_T(kc)", "LAlt_T\n(kc)").withTooltip("Left Alt when held, kc when tapped").masked().build(),
            modifier("LGUI_T(kc)", "LGui_T\n(kc)").withTooltip("Left GUI when held, kc when tapped").masked().build(),
            modifier("C_S_T(kc)", "LCS_T\n(kc)").withTooltip("Left Control + Left Shift when held, kc when tapped").masked().withAliases("LCS_T(kc)").build(),
            modifier("LCA_T(kc)", "LCA_T\n(kc)").withTooltip("LCTL + LALT when held, kc when tapped").masked().build(),
            modifier("LCG_T(kc)", "LCG_T\n(kc)").withTooltip("LCTL + LGUI when held, kc when tapped").masked().build(),
            modifier("LSA_T(kc)", "LSA_T\n(kc)").withTooltip("LSFT + LALT when held, kc when tapped").masked().build(),
            modifier("LAG_T(kc)", "LAG_T\n(kc)").withTooltip("LALT + LGUI when held, kc when tapped").masked().build(),
            modifier("SGUI_T(kc)", "LSG_T\n(kc)").withTooltip("LGUI + LSFT when held, kc when tapped").masked().withAliases("LSG_T(kc)").build(),
            modifier("MEH_T(kc)", "Meh_T\n(kc)").withTooltip("LCTL + LSFT + LALT when held, kc when tapped").masked().build(),
            modifier("LCSG_T(kc)", "LCSG_T\n(kc)").withTooltip("LCTL + LSFT + LGUI when held, kc when tapped").masked().build(),
            modifier("LCAG_T(kc)", "LCAG_T\n(kc)").withTooltip("LCTL + LALT + LGUI when held, kc when tapped").masked().build(),
            modifier("LSAG_T(kc)", "LSAG_T\n(kc)").withTooltip("LSFT + LALT + LGUI when held, kc when tapped").masked().build(),
            modifier("ALL_T(kc)", "ALL_T\n(kc)").withTooltip("LCTL + LSFT + LALT + LGUI when held, kc when tapped").masked().withAliases("HYPR_T(kc)").build()
    );

    public static final List<Keycode> TAP_RIGHT = List.of(
            modifier("RSFT_T(kc)", "RSft_T\n(kc)").withTooltip("Right Shift when held, kc when tapped").masked().build(),
            modifier("RCTL_T(kc)", "RCtl_T\n(kc)").withTooltip("Right Control when held, kc when tapped").masked().build(),
            modifier("RALT_T(kc)", "RAlt_T\n(kc)").withTooltip("Right Alt when held, kc when tapped").masked().build(),
            modifier("RGUI_T(kc)", "RGui_T\n(kc)").withTooltip("Right GUI when held, kc when tapped").masked().build(),
            modifier("RCS_T(kc)", "RCS_T\n(kc)").withTooltip("RCTL + RSFT when held, kc when tapped").masked().build(),
            modifier("RCA_T(kc)", "RCA_T\n(kc)").withTooltip("RCTL + RALT when held, kc when tapped").masked().build(),
            modifier("RCG_T(kc)", "RCG_T\n(kc)").withTooltip("RCTL + RGUI when held, kc when tapped").masked().build(),
            modifier("RSA_T(kc)", "RSA_T\n(kc)").withTooltip("RSFT + RALT when held, kc when tapped").masked().build(),
            modifier("RAG_T(kc)", "RAG_T\n(kc)").withTooltip("RALT + RGUI when held, kc when tapped").masked().build(),
            modifier("RSG_T(kc)", "RSG_T\n(kc)").withTooltip("RSFT + RGUI when held, kc when tapped").masked().build(),
            modifier("RCSG_T(kc)", "RCSG_T\n(kc)").withTooltip("RCTL + RSFT + RGUI when held, kc when tapped").masked().build(),
            modifier("RCAG_T(kc)", "RCAG_T\n(kc)").withTooltip("RCTL + RALT + RGUI when held, kc when tapped").masked().build(),
            modifier("RSAG_T(kc)", "RSAG_T\n(kc)").withTooltip("RSFT + RALT + RGUI when held, kc when tapped").masked().build(),
            modifier("RMEH_T(kc)", "RMeh_T\n(kc)").withTooltip("RCTL + RSFT + RALT when held, kc when tapped").masked().build(),
            modifier("RALL_T(kc)", "RALL_T\n(kc)").withTooltip("RCTL + RSFT + RALT + RGUI when held, kc when tapped").masked().build()
    );

    public static final List<Keycode> SPECIAL = List.of(
            modifier("KC_GESC", "~\nEsc").withTooltip("Esc normally, but ~ when Shift or GUI is pressed").build(),
            modifier("KC_LSPO", "LS\n(").withTooltip("Left Shift when held, ( when tapped").build(),
            modifier("KC_RSPC", "RS\n)").withTooltip("Right Shift when held, ) when tapped").build(),
            modifier("KC_LCPO", "LC\n(").withTooltip("Left Control when held, ( when tapped").build(),
            modifier("KC_RCPC", "RC\n)").withTooltip("Right Control when held, ) when tapped").build(),
            modifier("KC_LAPO", "LA\n(").withTooltip("Left Alt when held, ( when tapped").build(),
            modifier("KC_RAPC", "RA\n)").withTooltip("Right Alt when held, ) when tapped").build(),
            modifier("KC_SFTENT", "RS\nEnter").withTooltip("Right Shift when held, Enter when tapped").build()
    );

    public static final List<Keycode> OSM = Catalogs.concat(OSM_LEFT, OSM_RIGHT);

    public static final List<Keycode> MASK = Catalogs.concat(MASK_LEFT, MASK_RIGHT);

    public static final List<Keycode> TAP = Catalogs.concat(TAP_LEFT, TAP_RIGHT);

    public static final List<Keycode> ALL = Catalogs.concat(OSM, MASK, TAP, SPECIAL);

    /**
     * {@code MOD_*} operands of layer-mod keycodes. Their values collide with
     * basic keycodes, so they are reachable by id only and never take part in
     * value lookups.
     */
    public static final List<Keycode> LAYER_MOD_MODIFIERS = List.of(
            layerMod("MOD_LCTL", "LCtl").withTooltip("Left Control").build(),
            layerMod("MOD_LSFT", "LSft").withTooltip("Left Shift").build(),
            layerMod("MOD_LALT", "LAlt").withTooltip("Left Alt").build(),
            layerMod("MOD_LGUI", "LGui").withTooltip("Left GUI").build(),
            layerMod("MOD_RCTL", "RCtl").withTooltip("Right Control").build(),
            layerMod("MOD_RSFT", "RSft").withTooltip("Right Shift").build(),
            layerMod("MOD_RALT", "RAlt").withTooltip("Right Alt").build(),
            layerMod("MOD_RGUI", "RGui").withTooltip("Right GUI").build(),
            layerMod("MOD_MEH", "Meh").withTooltip("Meh (LCTL+LSFT+LALT)").build(),
            layerMod("MOD_HYPR", "Hypr").withTooltip("Hyper (LCTL+LSFT+LALT+LGUI)").build()
    );

    private ModifierKeycodes() {
    }

    private static Keycode.Builder modifier(String id, String label) {
        return Keycode.builder(id, label).withCategory(KeycodeCategory.MODIFIERS);
    }

    private static Keycode.Builder layerMod(String id, String label) {
        return Keycode.builder(id, label).withCategory(KeycodeCategory.LAYER_MOD_MODIFIER);
    }
}
