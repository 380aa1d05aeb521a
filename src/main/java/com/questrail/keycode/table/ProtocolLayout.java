package com.questrail.keycode.table;

import com.questrail.keycode.api.ProtocolVersion;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Bit-layout parameters of one protocol revision.
 *
 * <p>Derived from table constants rather than declared separately, so the
 * layout can never disagree with the table it was read from.</p>
 */
public record ProtocolLayout(
        ProtocolVersion version,
        Map<WrapperKind, Integer> bases,
        int toOnPress,
        int layerModShift,
        int layerModMask
) {
    public static final String ON_PRESS = "ON_PRESS";
    public static final String LAYER_MOD_SHIFT = "QMK_LM_SHIFT";
    public static final String LAYER_MOD_MASK = "QMK_LM_MASK";

    public ProtocolLayout {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(bases, "bases");
        for (WrapperKind kind : WrapperKind.values()) {
            if (kind.hasBase() && !bases.containsKey(kind)) {
                throw new KeycodeTableException("Missing base address for " + kind);
            }
        }
        bases = Map.copyOf(bases);
        if (layerModShift <= 0) {
            throw new KeycodeTableException("layerModShift must be > 0");
        }
    }

    /**
     * Reads the layout from named constants.
     *
     * @param constants constant lookup that throws {@link KeycodeTableException} on a miss
     */
    static ProtocolLayout from(ProtocolVersion version, ToIntFunction<String> constants) {
        Map<WrapperKind, Integer> bases = new EnumMap<>(WrapperKind.class);
        for (WrapperKind kind : WrapperKind.values()) {
            if (kind.hasBase()) {
                bases.put(kind, constants.applyAsInt(kind.baseConstant()));
            }
        }
        return new ProtocolLayout(
                version,
                bases,
                constants.applyAsInt(ON_PRESS),
                constants.applyAsInt(LAYER_MOD_SHIFT),
                constants.applyAsInt(LAYER_MOD_MASK));
    }

    public int base(WrapperKind kind) {
        Integer base = bases.get(kind);
        if (base == null) {
            throw new KeycodeTableException(kind + " has no base address");
        }
        return base;
    }

    /** Highest value in the layer-mod range: layer 15 with every mask bit set. */
    public int layerModMaxCode() {
        return base(WrapperKind.LAYER_MOD) | (0x0F << layerModShift) | layerModMask;
    }
}
