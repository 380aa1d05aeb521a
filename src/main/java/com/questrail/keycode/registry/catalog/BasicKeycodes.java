package com.questrail.keycode.registry.catalog;

import com.questrail.keycode.api.Keycode;
import com.questrail.keycode.api.KeycodeCategory;

import java.util.List;

/**
 * Special, basic, shifted and ISO/JIS keycodes. These are the same in every
 * protocol revision.
 */
public final class BasicKeycodes
{
    public static final List<Keycode> SPECIAL = List.of(
            special("KC_NO", "").build(),
            special("KC_TRNS", "\u25BD").withAliases("KC_TRANSPARENT").build()
    );

    public static final List<Keycode> LETTERS = List.of(
            basic("KC_A", "A").withPrintable("a").withRecorderAliases("a").build(),
            basic("KC_B", "B").withPrintable("b").withRecorderAliases("b").build(),
            basic("KC_C", "C").withPrintable("c").withRecorderAliases("c").build(),
            basic("KC_D", "D").withPrintable("d").withRecorderAliases("d").build(),
            basic("KC_E", "E").withPrintable("e").withRecorderAliases("e").build(),
            basic("KC_F", "F").withPrintable("f").withRecorderAliases("f").build(),
            basic("KC_G", "G").withPrintable("g").withRecorderAliases("g").build(),
            basic("KC_H", "H").withPrintable("h").withRecorderAliases("h").build(),
            basic("KC_I", "I").withPrintable("i").withRecorderAliases("i").build(),
            basic("KC_J", "J").withPrintable("j").withRecorderAliases("j").build(),
            basic("KC_K", "K").withPrintable("k").withRecorderAliases("k").build(),
            basic("KC_L", "L").withPrintable("l").withRecorderAliases("l").build(),
            basic("KC_M", "M").withPrintable("m").withRecorderAliases("m").build(),
            basic("KC_N", "N").withPrintable("n").withRecorderAliases("n").build(),
            basic("KC_O", "O").withPrintable("o").withRecorderAliases("o").build(),
            basic("KC_P", "P").withPrintable("p").withRecorderAliases("p").build(),
            basic("KC_Q", "Q").withPrintable("q").withRecorderAliases("q").build(),
            basic("KC_R", "R").withPrintable("r").withRecorderAliases("r").build(),
            basic("KC_S", "S").withPrintable("s").withRecorderAliases("s").build(),
            basic("KC_T", "T").withPrintable("t").withRecorderAliases("t").build(),
            basic("KC_U", "U").withPrintable("u").withRecorderAliases("u").build(),
            basic("KC_V", "V").withPrintable("v").withRecorderAliases("v").build(),
            basic("KC_W", "W").withPrintable("w").withRecorderAliases("w").build(),
            basic("KC_X", "X").withPrintable("x").withRecorderAliases("x").build(),
            basic("KC_Y", "Y").withPrintable("y").withRecorderAliases("y").build(),
            basic("KC_Z", "Z").withPrintable("z").withRecorderAliases("z").build()
    );

    public static final List<Keycode> NUMBERS = List.of(
            basic("KC_1", "!\n1").withPrintable("1").withRecorderAliases("1").build(),
            basic("KC_2", "@\n2").withPrintable("2").withRecorderAliases("2").build(),
            basic("KC_3", "#\n3").withPrintable("3").withRecorderAliases("3").build(),
            basic("KC_4", "$\n4").withPrintable("4").withRecorderAliases("4").build(),
            basic("KC_5", "%\n5").withPrintable("5").withRecorderAliases("5").build(),
            basic("KC_6", "^\n6").withPrintable("6").withRecorderAliases("6").build(),
            basic("KC_7", "&\n7").withPrintable("7").withRecorderAliases("7").build(),
            basic("KC_8", "*\n8").withPrintable("8").withRecorderAliases("8").build(),
            basic("KC_9", "(\n9").withPrintable("9").withRecorderAliases("9").build(),
            basic("KC_0", ")\n0").withPrintable("0").withRecorderAliases("0").build()
    );

    public static final List<Keycode> SYMBOLS = List.of(
            basic("KC_MINUS", "_\n-").withPrintable("-").withAliases("KC_MINS").withRecorderAliases("-").build(),
            basic("KC_EQUAL", "+\n=").withPrintable("=").withAliases("KC_EQL").withRecorderAliases("=").build(),
            basic("KC_LBRACKET", "{\n[").withPrintable("[").withAliases("KC_LBRC").withRecorderAliases("[").build(),
            basic("KC_RBRACKET", "}\n]").withPrintable("]").withAliases("KC_RBRC").withRecorderAliases("]").build(),
            basic("KC_BSLASH", "|\n\\").withPrintable("\\").withAliases("KC_BSLS").withRecorderAliases("\\").build(),
            basic("KC_SCOLON", ":\n;").withPrintable(";").withAliases("KC_SCLN").withRecorderAliases(";").build(),
            basic("KC_QUOTE", "\"\n'").withPrintable("'").withAliases("KC_QUOT").withRecorderAliases("'").build(),
            basic("KC_GRAVE", "~\n`").withPrintable("`").withAliases("KC_GRV", "KC_ZKHK").withRecorderAliases("`").build(),
            basic("KC_COMMA", "<\n,").withPrintable(",").withAliases("KC_COMM").withRecorderAliases(",").build(),
            basic("KC_DOT", ">\n.").withPrintable(".").withRecorderAliases(".").build(),
            basic("KC_SLASH", "?\n/").withPrintable("/").withAliases("KC_SLSH").withRecorderAliases("/").build()
    );

    public static final List<Keycode> EDITING = List.of(
            basic("KC_ENTER", "Enter").withAliases("KC_ENT").withRecorderAliases("enter").build(),
            basic("KC_SPACE", "Space").withAliases("KC_SPC").withRecorderAliases("space").build(),
            basic("KC_TAB", "Tab").withRecorderAliases("tab").build(),
            basic("KC_BSPACE", "Bksp").withAliases("KC_BSPC").withRecorderAliases("backspace").build(),
            basic("KC_ESCAPE", "Esc").withAliases("KC_ESC").withRecorderAliases("esc").build()
    );

    public static final List<Keycode> MODS = List.of(
            basic("KC_LSHIFT", "LShift").withAliases("KC_LSFT").withRecorderAliases("left shift", "shift").build(),
            basic("KC_RSHIFT", "RShift").withAliases("KC_RSFT").withRecorderAliases("right shift").build(),
            basic("KC_LCTRL", "LCtrl").withAliases("KC_LCTL").withRecorderAliases("left ctrl", "ctrl").build(),
            basic("KC_RCTRL", "RCtrl").withAliases("KC_RCTL").withRecorderAliases("right ctrl").build(),
            basic("KC_LALT", "LAlt").withAliases("KC_LOPT").withRecorderAliases("alt").build(),
            basic("KC_RALT", "RAlt").withAliases("KC_ALGR", "KC_ROPT").build(),
            basic("KC_LGUI", "LGui").withAliases("KC_LCMD", "KC_LWIN").withRecorderAliases("left windows", "windows").build(),
            basic("KC_RGUI", "RGui").withAliases("KC_RCMD", "KC_RWIN").withRecorderAliases("right windows").build(),
            basic("KC_APPLICATION", "Menu").withAliases("KC_APP").withRecorderAliases("menu", "left menu", "right menu").build()
    );

    public static final List<Keycode> NAV = List.of(
            basic("KC_UP", "Up").withRecorderAliases("up").build(),
            basic("KC_DOWN", "Down").withRecorderAliases("down").build(),
            basic("KC_LEFT", "Left").withRecorderAliases("left").build(),
            basic("KC_RIGHT", "Right").withAliases("KC_RGHT").withRecorderAliases("right").build(),
            basic("KC_HOME", "Home").withRecorderAliases("home").build(),
            basic("KC_END", "End").withRecorderAliases("end").build(),
            basic("KC_PGUP", "Page\nUp").withRecorderAliases("page up").build(),
            basic("KC_PGDOWN", "Page\nDown").withAliases("KC_PGDN").withRecorderAliases("page down").build(),
            basic("KC_INSERT", "Insert").withAliases("KC_INS").withRecorderAliases("insert").build(),
            basic("KC_DELETE", "Del").withAliases("KC_DEL").withRecorderAliases("delete").build()
    );

    public static final List<Keycode> FUNCTION = List.of(
            basic("KC_F1", "F1").withRecorderAliases("f1").build(),
            basic("KC_F2", "F2").withRecorderAliases("f2").build(),
            basic("KC_F3", "F3").withRecorderAliases("f3").build(),
            basic("KC_F4", "F4").withRecorderAliases("f4").build(),
            basic("KC_F5", "F5").withRecorderAliases("f5").build(),
            basic("KC_F6", "F6").withRecorderAliases("f6").build(),
            basic("KC_F7", "F7").withRecorderAliases("f7").build(),
            basic("KC_F8", "F8").withRecorderAliases("f8").build(),
            basic("KC_F9", "F9").withRecorderAliases("f9").build(),
            basic("KC_F10", "F10").withRecorderAliases("f10").build(),
            basic("KC_F11", "F11").withRecorderAliases("f11").build(),
            basic("KC_F12", "F12").withRecorderAliases("f12").build()
    );

    public static final List<Keycode> LOCK = List.of(
            basic("KC_CAPSLOCK", "Caps\nLock").withAliases("KC_CLCK", "KC_CAPS").withRecorderAliases("caps lock").build(),
            basic("KC_NUMLOCK", "Num\nLock").withAliases("KC_NLCK").withRecorderAliases("num lock").build(),
            basic("KC_SCROLLLOCK", "Scroll\nLock").withAliases("KC_SLCK", "KC_BRMD").withRecorderAliases("scroll lock").build()
    );

    public static final List<Keycode> NUMPAD = List.of(
            basic("KC_KP_1", "1").withAliases("KC_P1").build(),
            basic("KC_KP_2", "2").withAliases("KC_P2").build(),
            basic("KC_KP_3", "3").withAliases("KC_P3").build(),
            basic("KC_KP_4", "4").withAliases("KC_P4").build(),
            basic("KC_KP_5", "5").withAliases("KC_P5").build(),
            basic("KC_KP_6", "6").withAliases("KC_P6").build(),
            basic("KC_KP_7", "7").withAliases("KC_P7").build(),
            basic("KC_KP_8", "8").withAliases("KC_P8").build(),
            basic("KC_KP_9", "9").withAliases("KC_P9").build(),
            basic("KC_KP_0", "0").withAliases("KC_P0").build(),
            basic("KC_KP_DOT", ".").withAliases("KC_PDOT").build(),
            basic("KC_KP_PLUS", "+").withAliases("KC_PPLS").build(),
            basic("KC_KP_MINUS", "-").withAliases("KC_PMNS").build(),
            basic("KC_KP_ASTERISK", "*").withAliases("KC_PAST").build(),
            basic("KC_KP_SLASH", "/").withAliases("KC_PSLS").build(),
            basic("KC_KP_EQUAL", "=").withAliases("KC_PEQL").build(),
            basic("KC_KP_COMMA", ",").withAliases("KC_PCMM").build(),
            basic("KC_KP_ENTER", "Num\nEnter").withAliases("KC_PENT").build()
    );

    public static final List<Keycode> SYSTEM = List.of(
            basic("KC_PSCREEN", "Print\nScreen").withAliases("KC_PSCR").build(),
            basic("KC_PAUSE", "Pause").withAliases("KC_PAUS", "KC_BRK", "KC_BRMU").withRecorderAliases("pause", "break").build()
    );

    public static final List<Keycode> SHIFTED = List.of(
            shifted("KC_TILD", "~").build(),
            shifted("KC_EXLM", "!").build(),
            shifted("KC_AT", "@").build(),
            shifted("KC_HASH", "#").build(),
            shifted("KC_DLR", "$").build(),
            shifted("KC_PERC", "%").build(),
            shifted("KC_CIRC", "^").build(),
            shifted("KC_AMPR", "&").build(),
            shifted("KC_ASTR", "*").build(),
            shifted("KC_LPRN", "(").build(),
            shifted("KC_RPRN", ")").build(),
            shifted("KC_UNDS", "_").build(),
            shifted("KC_PLUS", "+").build(),
            shifted("KC_LCBR", "{").build(),
            shifted("KC_RCBR", "}").build(),
            shifted("KC_LT", "<").build(),
            shifted("KC_GT", ">").build(),
            shifted("KC_COLN", ":").build(),
            shifted("KC_PIPE", "|").build(),
            shifted("KC_QUES", "?").build(),
            shifted("KC_DQUO", "\"").build()
    );

    public static final List<Keycode> BASIC = Catalogs.concat(LETTERS, NUMBERS, SYMBOLS, EDITING, MODS, NAV, FUNCTION, LOCK, NUMPAD, SYSTEM);

    public static final List<Keycode> ISO = List.of(
            iso("KC_NONUS_HASH", "~\n#").withTooltip("Non-US # and ~").withAliases("KC_NUHS").build(),
            iso("KC_NONUS_BSLASH", "|\n\\").withTooltip("Non-US \\ and |").withAliases("KC_NUBS").build(),
            iso("KC_RO", "_\n\\").withTooltip("JIS \\ and _").withAliases("KC_INT1").build(),
            iso("KC_KANA", "\u30AB\u30BF\u30AB\u30CA\n\u3072\u3089\u304C\u306A").withTooltip("JIS Katakana/Hiragana").withAliases("KC_INT2").build(),
            iso("KC_JYEN", "|\n\u00A5").withAliases("KC_INT3").build(),
            iso("KC_HENK", "\u5909\u63DB").withTooltip("JIS Henkan").withAliases("KC_INT4").build(),
            iso("KC_MHEN", "\u7121\u5909\u63DB").withTooltip("JIS Muhenkan").withAliases("KC_INT5").build(),
            iso("KC_LANG1", "\uD55C\uC601\n\u304B\u306A").withTooltip("Korean Han/Yeong / JP Mac Kana").withAliases("KC_HAEN").build(),
            iso("KC_LANG2", "\u6F22\u5B57\n\u82F1\u6570").withTooltip("Korean Hanja / JP Mac Eisu").withAliases("KC_HANJ").build()
    );

    private BasicKeycodes() {
    }

    private static Keycode.Builder special(String id, String label) {
        return Keycode.builder(id, label).withCategory(KeycodeCategory.SPECIAL);
    }

    private static Keycode.Builder basic(String id, String label) {
        return Keycode.builder(id, label).withCategory(KeycodeCategory.BASIC);
    }

    private static Keycode.Builder shifted(String id, String label) {
        return Keycode.builder(id, label).withCategory(KeycodeCategory.SHIFTED);
    }

    private static Keycode.Builder iso(String id, String label) {
        return Keycode.builder(id, label).withCategory(KeycodeCategory.ISO);
    }
}
