package com.questrail.keycode.api;

/**
 * KeycodeCodec
 * -----------------------------------------------------------------------------
 * Bidirectional conversion between packed numeric keycodes and their textual
 * form, bound to one registry snapshot.
 *
 * <p>Neither direction fails:</p>
 * <ul>
 *   <li>{@link #deserialize(String)} returns {@link #NO_KEYCODE} for text it
 *       cannot understand</li>
 *   <li>{@link #serialize(int)} falls back to a hexadecimal literal for values
 *       with no name</li>
 * </ul>
 */
public interface KeycodeCodec
{
    /** Numeric value of {@code KC_NO}; also the result for unparsable text. */
    int NO_KEYCODE = 0;

    /** Largest value a keymap slot can hold. */
    int MAX_STORED_KEYCODE = 0xFFFF;

    /**
     * Converts a numeric keycode to its canonical text.
     */
    String serialize(int value);

    /**
     * Converts keycode text or an expression such as {@code LT(2, KC_A)} to
     * its numeric value, or {@link #NO_KEYCODE} when the text is not a valid
     * keycode.
     */
    int deserialize(String text);

    /**
     * Like {@link #deserialize(String)}, but a result that does not fit a
     * 16-bit keymap slot, such as a negative expression or a name with no
     * address in this protocol, becomes {@link #NO_KEYCODE}.
     */
    default int deserializeStored(String text) {
        int value = deserialize(text);
        return value >= 0 && value <= MAX_STORED_KEYCODE ? value : NO_KEYCODE;
    }

    /**
     * Numeric input passes through unchanged.
     */
    default int deserialize(int value) {
        return value;
    }

    /**
     * Rewrites arbitrary keycode text into the form {@link #serialize(int)}
     * produces.
     */
    default String normalize(String text) {
        return serialize(deserialize(text));
    }
}
