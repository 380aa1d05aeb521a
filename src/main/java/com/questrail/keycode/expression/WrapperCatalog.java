package com.questrail.keycode.expression;

import com.questrail.keycode.table.ModifierCombo;
import com.questrail.keycode.table.WrapperKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * WrapperCatalog
 * =============================================================================
 * Every wrapper name the expression language accepts.
 *
 * <h2>Families</h2>
 * <ul>
 *   <li>modifier masks and their aliases: {@code LSFT(kc)}, {@code S(kc)},
 *       {@code RHYPR(kc)}</li>
 *   <li>mod-taps and their aliases: {@code LCTL_T(kc)}, {@code CTL_T(kc)},
 *       plus the generic {@code MT(mods, kc)}</li>
 *   <li>layer-tap {@code LT(layer, kc)} and {@code LT0..LT15(kc)}</li>
 *   <li>layer-mod {@code LM(layer, mods)} and {@code LM0..LM15(mods)}</li>
 *   <li>single-operand: {@code TO MO DF PDF TG OSL TT OSM TD SH_T}</li>
 * </ul>
 *
 * <p>Names map to a {@link WrapperKind}; the protocol-specific bits come from
 * the layout handed to {@link Wrapper#apply}, so one catalog serves both
 * protocol revisions.</p>
 */
public final class WrapperCatalog
{
    static final int LAYER_SHORTCUTS = 16;

    private static final WrapperCatalog STANDARD = buildStandard();

    private final Map<String, Wrapper> byName;

    private WrapperCatalog(Map<String, Wrapper> byName) {
        this.byName = Collections.unmodifiableMap(byName);
    }

    public static WrapperCatalog standard() {
        return STANDARD;
    }

    public Optional<Wrapper> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Set<String> names() {
        return byName.keySet();
    }

    private static WrapperCatalog buildStandard() {
        Map<String, Wrapper> w = new LinkedHashMap<>();

        for (ModifierCombo combo : ModifierCombo.values()) {
            Wrapper mask = Wrapper.fixed(combo.maskName(), WrapperKind.MODIFIER, combo.modifiers());
            put(w, mask);
            combo.maskAliases().forEach(alias -> put(w, mask.withName(alias)));

            Wrapper tap = Wrapper.fixed(combo.tapName(), WrapperKind.MOD_TAP, combo.modifiers());
            put(w, tap);
            combo.tapAliases().forEach(alias -> put(w, tap.withName(alias)));
        }
        put(w, Wrapper.of("MT", WrapperKind.MOD_TAP));

        put(w, Wrapper.of("LT", WrapperKind.LAYER_TAP));
        put(w, Wrapper.of("LM", WrapperKind.LAYER_MOD));
        for (int layer = 0; layer < LAYER_SHORTCUTS; layer++) {
            put(w, Wrapper.fixed("LT" + layer, WrapperKind.LAYER_TAP, layer));
            put(w, Wrapper.fixed("LM" + layer, WrapperKind.LAYER_MOD, layer));
        }

        put(w, Wrapper.of("TO", WrapperKind.TO_LAYER));
        put(w, Wrapper.of("MO", WrapperKind.MOMENTARY));
        put(w, Wrapper.of("DF", WrapperKind.DEFAULT_LAYER));
        put(w, Wrapper.of("PDF", WrapperKind.PERSISTENT_DEFAULT_LAYER));
        put(w, Wrapper.of("TG", WrapperKind.TOGGLE_LAYER));
        put(w, Wrapper.of("OSL", WrapperKind.ONE_SHOT_LAYER));
        put(w, Wrapper.of("TT", WrapperKind.LAYER_TAP_TOGGLE));
        put(w, Wrapper.of("OSM", WrapperKind.ONE_SHOT_MOD));
        put(w, Wrapper.of("TD", WrapperKind.TAP_DANCE));
        put(w, Wrapper.of("SH_T", WrapperKind.SWAP_HANDS_TAP));

        return new WrapperCatalog(w);
    }

    private static void put(Map<String, Wrapper> w, Wrapper wrapper) {
        if (w.putIfAbsent(wrapper.name(), wrapper) != null) {
            throw new IllegalStateException("Duplicate wrapper name " + wrapper.name());
        }
    }
}
