package com.questrail.keycode.table;

import java.util.List;

/**
 * Modifier combinations that have both a mask wrapper ({@code LSFT(kc)}) and a
 * mod-tap wrapper ({@code LSFT_T(kc)}).
 *
 * <p>The alias lists hold alternative wrapper spellings accepted by the
 * expression evaluator only. They never appear in serialized output.</p>
 */
public enum ModifierCombo
{
    LSFT("LSFT", "LSFT_T", Mods.LSFT, List.of("S"), List.of("SFT_T")),
    LCTL("LCTL", "LCTL_T", Mods.LCTL, List.of("C"), List.of("CTL_T")),
    LALT("LALT", "LALT_T", Mods.LALT, List.of("LOPT", "A"), List.of("LOPT_T", "ALT_T", "OPT_T")),
    LGUI("LGUI", "LGUI_T", Mods.LGUI, List.of("LCMD", "LWIN", "G"),
            List.of("LCMD_T", "LWIN_T", "GUI_T", "CMD_T", "WIN_T")),
    C_S("C_S", "C_S_T", Mods.LCTL | Mods.LSFT, List.of("LCS"), List.of("LCS_T")),
    LCA("LCA", "LCA_T", Mods.LCTL | Mods.LALT, List.of(), List.of()),
    LCG("LCG", "LCG_T", Mods.LCTL | Mods.LGUI, List.of(), List.of()),
    LSA("LSA", "LSA_T", Mods.LSFT | Mods.LALT, List.of(), List.of()),
    LAG("LAG", "LAG_T", Mods.LALT | Mods.LGUI, List.of(), List.of()),
    SGUI("SGUI", "SGUI_T", Mods.LGUI | Mods.LSFT, List.of("SCMD", "SWIN", "LSG"),
            List.of("SCMD_T", "SWIN_T", "LSG_T")),
    MEH("MEH", "MEH_T", Mods.LCTL | Mods.LSFT | Mods.LALT, List.of(), List.of()),
    LCSG("LCSG", "LCSG_T", Mods.LCTL | Mods.LSFT | Mods.LGUI, List.of(), List.of()),
    LCAG("LCAG", "LCAG_T", Mods.LCTL | Mods.LALT | Mods.LGUI, List.of(), List.of()),
    LSAG("LSAG", "LSAG_T", Mods.LSFT | Mods.LALT | Mods.LGUI, List.of(), List.of()),
    HYPR("HYPR", "ALL_T", Mods.LCTL | Mods.LSFT | Mods.LALT | Mods.LGUI, List.of(), List.of("HYPR_T")),

    RSFT("RSFT", "RSFT_T", Mods.RSFT, List.of(), List.of()),
    RCTL("RCTL", "RCTL_T", Mods.RCTL, List.of(), List.of()),
    RALT("RALT", "RALT_T", Mods.RALT, List.of("ALGR", "ROPT"), List.of("ROPT_T", "ALGR_T")),
    RGUI("RGUI", "RGUI_T", Mods.RGUI, List.of("RCMD", "RWIN"), List.of("RCMD_T", "RWIN_T")),
    RCS("RCS", "RCS_T", Mods.RCTL | Mods.RSFT, List.of(), List.of()),
    RCA("RCA", "RCA_T", Mods.RCTL | Mods.RALT, List.of(), List.of()),
    RSA("RSA", "RSA_T", Mods.RSFT | Mods.RALT, List.of("SAGR"), List.of("SAGR_T")),
    RCG("RCG", "RCG_T", Mods.RCTL | Mods.RGUI, List.of(), List.of()),
    RSG("RSG", "RSG_T", Mods.RSFT | Mods.RGUI, List.of(), List.of()),
    RAG("RAG", "RAG_T", Mods.RALT | Mods.RGUI, List.of(), List.of()),
    RMEH("RMEH", "RMEH_T", Mods.RCTL | Mods.RSFT | Mods.RALT, List.of(), List.of()),
    RCSG("RCSG", "RCSG_T", Mods.RCTL | Mods.RSFT | Mods.RGUI, List.of(), List.of()),
    RCAG("RCAG", "RCAG_T", Mods.RCTL | Mods.RALT | Mods.RGUI, List.of(), List.of()),
    RSAG("RSAG", "RSAG_T", Mods.RSFT | Mods.RALT | Mods.RGUI, List.of(), List.of()),
    RHYPR("RHYPR", "RALL_T", Mods.RCTL | Mods.RSFT | Mods.RALT | Mods.RGUI, List.of(), List.of());

    private final String maskName;
    private final String tapName;
    private final int modifiers;
    private final List<String> maskAliases;
    private final List<String> tapAliases;

    ModifierCombo(String maskName, String tapName, int modifiers,
                  List<String> maskAliases, List<String> tapAliases) {
        this.maskName = maskName;
        this.tapName = tapName;
        this.modifiers = modifiers;
        this.maskAliases = maskAliases;
        this.tapAliases = tapAliases;
    }

    public String maskName() {
        return maskName;
    }

    public String tapName() {
        return tapName;
    }

    /** Five-bit modifier set; bit 4 selects the right-hand modifiers. */
    public int modifiers() {
        return modifiers;
    }

    public List<String> maskAliases() {
        return maskAliases;
    }

    public List<String> tapAliases() {
        return tapAliases;
    }

    public String maskTemplate() {
        return maskName + "(kc)";
    }

    public String tapTemplate() {
        return tapName + "(kc)";
    }

    public boolean rightHanded() {
        return (modifiers & Mods.RIGHT) != 0;
    }

    /** Five-bit modifier constants, identical in every protocol revision. */
    public static final class Mods
    {
        public static final int LCTL = 0x01;
        public static final int LSFT = 0x02;
        public static final int LALT = 0x04;
        public static final int LGUI = 0x08;
        public static final int RIGHT = 0x10;
        public static final int RCTL = RIGHT | LCTL;
        public static final int RSFT = RIGHT | LSFT;
        public static final int RALT = RIGHT | LALT;
        public static final int RGUI = RIGHT | LGUI;

        private Mods() {
        }
    }
}
