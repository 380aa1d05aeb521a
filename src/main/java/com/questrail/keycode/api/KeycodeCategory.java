package com.questrail.keycode.api;

/**
 * Grouping tag carried by every {@link Keycode}, used by consumers to lay
 * keycodes out in pickers. Declaration order is registry order.
 */
public enum KeycodeCategory
{
    SPECIAL,
    BASIC,
    SHIFTED,
    ISO,
    LAYERS,
    BOOT,
    MODIFIERS,
    QUANTUM,
    LIGHTING,
    MEDIA,
    TAP_DANCE,
    MACRO,
    USER,
    HIDDEN,
    MIDI,

    /** {@code MOD_*} modifier operands, only shown inside a layer-mod keycode. */
    LAYER_MOD_MODIFIER
}
