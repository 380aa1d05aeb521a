package com.questrail.keycode.table;

/**
 * US-layout shifted symbols. Each is {@code LSFT} applied to a base key, and
 * serializes as that decomposition.
 */
public enum ShiftedSymbol
{
    TILDE("KC_TILD", "KC_GRAVE"),
    EXCLAMATION("KC_EXLM", "KC_1"),
    AT("KC_AT", "KC_2"),
    HASH("KC_HASH", "KC_3"),
    DOLLAR("KC_DLR", "KC_4"),
    PERCENT("KC_PERC", "KC_5"),
    CIRCUMFLEX("KC_CIRC", "KC_6"),
    AMPERSAND("KC_AMPR", "KC_7"),
    ASTERISK("KC_ASTR", "KC_8"),
    LEFT_PAREN("KC_LPRN", "KC_9"),
    RIGHT_PAREN("KC_RPRN", "KC_0"),
    UNDERSCORE("KC_UNDS", "KC_MINUS"),
    PLUS("KC_PLUS", "KC_EQUAL"),
    LEFT_CURLY("KC_LCBR", "KC_LBRACKET"),
    RIGHT_CURLY("KC_RCBR", "KC_RBRACKET"),
    LESS_THAN("KC_LT", "KC_COMMA"),
    GREATER_THAN("KC_GT", "KC_DOT"),
    COLON("KC_COLN", "KC_SCOLON"),
    PIPE("KC_PIPE", "KC_BSLASH"),
    QUESTION("KC_QUES", "KC_SLASH"),
    DOUBLE_QUOTE("KC_DQUO", "KC_QUOTE");

    private final String id;
    private final String baseId;

    ShiftedSymbol(String id, String baseId) {
        this.id = id;
        this.baseId = baseId;
    }

    public String id() {
        return id;
    }

    public String baseId() {
        return baseId;
    }

    /** Preferred serialized form, e.g. {@code LSFT(KC_1)}. */
    public String preferredText() {
        return ModifierCombo.LSFT.maskName() + "(" + baseId + ")";
    }
}
