package com.questrail.keycode.table;

/**
 * WrapperKind
 * =============================================================================
 * Closed set of composite keycode shapes. Each kind knows how to pack its
 * arguments into a 16-bit keycode and how to take a packed value apart again.
 *
 * <h2>Protocol independence</h2>
 * <p>A kind never branches on the protocol revision. Everything that differs
 * between v5 and v6 (base addresses, the {@code TO} on-press flag, the
 * layer-mod shift and modifier mask) is read from the {@link ProtocolLayout}
 * passed in. Table generation and expression evaluation both pack through
 * here, so a wrapper typed by a user and the same wrapper generated into the
 * table always agree bit for bit.</p>
 *
 * <h2>Argument order</h2>
 * <ul>
 *   <li>{@link #MODIFIER}, {@link #MOD_TAP}: modifier bits, inner keycode</li>
 *   <li>{@link #LAYER_TAP}: layer, inner keycode</li>
 *   <li>{@link #LAYER_MOD}: layer, modifier bits</li>
 *   <li>all others: a single index or operand</li>
 * </ul>
 */
public enum WrapperKind
{
    /** {@code LSFT(kc)}, {@code C_S(kc)}: modifier bits in the high byte. */
    MODIFIER(2, null),
    MOD_TAP(2, "QK_MOD_TAP"),
    LAYER_TAP(2, "QK_LAYER_TAP"),
    LAYER_MOD(2, "QK_LAYER_MOD"),
    TO_LAYER(1, "QK_TO"),
    MOMENTARY(1, "QK_MOMENTARY"),
    DEFAULT_LAYER(1, "QK_DEF_LAYER"),
    PERSISTENT_DEFAULT_LAYER(1, "QK_PERSISTENT_DEF_LAYER"),
    TOGGLE_LAYER(1, "QK_TOGGLE_LAYER"),
    ONE_SHOT_LAYER(1, "QK_ONE_SHOT_LAYER"),
    LAYER_TAP_TOGGLE(1, "QK_LAYER_TAP_TOGGLE"),
    ONE_SHOT_MOD(1, "QK_ONE_SHOT_MOD"),
    TAP_DANCE(1, "QK_TAP_DANCE"),
    SWAP_HANDS_TAP(1, "QK_SWAP_HANDS"),
    MACRO(1, "QK_MACRO"),
    USER(1, "QK_USER");

    private final int arity;
    private final String baseConstant;

    WrapperKind(int arity, String baseConstant) {
        this.arity = arity;
        this.baseConstant = baseConstant;
    }

    public int arity() {
        return arity;
    }

    /**
     * @return table constant holding this kind's base address, or {@code null}
     *         for {@link #MODIFIER}, which has none
     */
    public String baseConstant() {
        return baseConstant;
    }

    public boolean hasBase() {
        return baseConstant != null;
    }

    /**
     * Packs the arguments into a keycode.
     *
     * @throws KeycodeTableException if the argument count does not match {@link #arity()}
     */
    public int pack(ProtocolLayout layout, int... args) {
        if (args.length != arity) {
            throw new KeycodeTableException(
                    name() + " takes " + arity + " argument(s), got " + args.length);
        }
        return switch (this) {
            case MODIFIER -> ((args[0] & 0x1F) << 8) | args[1];
            case MOD_TAP -> layout.base(this) | ((args[0] & 0x1F) << 8) | (args[1] & 0xFF);
            case LAYER_TAP -> layout.base(this) | ((args[0] & 0x0F) << 8) | (args[1] & 0xFF);
            case LAYER_MOD -> layout.base(this)
                    | ((args[0] & 0x0F) << layout.layerModShift())
                    | (args[1] & layout.layerModMask());
            case TO_LAYER -> layout.base(this) | (layout.toOnPress() << 4) | (args[0] & 0xFF);
            case MOMENTARY, DEFAULT_LAYER, PERSISTENT_DEFAULT_LAYER, TOGGLE_LAYER,
                 ONE_SHOT_LAYER, LAYER_TAP_TOGGLE, ONE_SHOT_MOD, TAP_DANCE, SWAP_HANDS_TAP ->
                    layout.base(this) | (args[0] & 0xFF);
            case MACRO, USER -> layout.base(this) + args[0];
        };
    }

    /**
     * Splits a packed keycode back into the arguments {@link #pack} consumed.
     * The value is not range-checked; see {@link #contains}.
     */
    public int[] unpack(ProtocolLayout layout, int value) {
        return switch (this) {
            case MODIFIER, MOD_TAP -> new int[] { (value >> 8) & 0x1F, value & 0xFF };
            case LAYER_TAP -> new int[] { (value >> 8) & 0x0F, value & 0xFF };
            case LAYER_MOD -> new int[] {
                    (value >> layout.layerModShift()) & 0x0F,
                    value & layout.layerModMask()
            };
            case TO_LAYER -> new int[] { (value & 0xFF) & ~(layout.toOnPress() << 4) };
            case SWAP_HANDS_TAP -> new int[] { value & 0xFF };
            case MOMENTARY, DEFAULT_LAYER, PERSISTENT_DEFAULT_LAYER, TOGGLE_LAYER,
                 ONE_SHOT_LAYER, LAYER_TAP_TOGGLE, ONE_SHOT_MOD, TAP_DANCE, MACRO, USER ->
                    new int[] { value - layout.base(this) };
        };
    }

    /**
     * @return {@code true} when {@code value} lies in the numeric range this
     *         kind occupies under the given layout
     */
    public boolean contains(ProtocolLayout layout, int value) {
        if (this == MODIFIER) {
            return value >= 0x0100 && value <= 0x1FFF;
        }
        int base = layout.base(this);
        int last = switch (this) {
            case MOD_TAP -> base + 0x1FFF;
            case LAYER_TAP -> base + 0x0FFF;
            case LAYER_MOD -> layout.layerModMaxCode();
            case SWAP_HANDS_TAP -> base + 0xEF;
            case TAP_DANCE, MACRO -> base + 0xFF;
            case USER -> base + 0x3F;
            case ONE_SHOT_MOD -> base + 0x1F;
            case TO_LAYER -> pack(layout, 0x1F);
            default -> base + 0x1F;
        };
        return value >= base && value <= last;
    }
}
