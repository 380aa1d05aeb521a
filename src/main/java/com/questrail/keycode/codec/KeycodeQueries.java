package com.questrail.keycode.codec;

import com.questrail.keycode.api.Keycode;
import com.questrail.keycode.api.KeycodeCodec;
import com.questrail.keycode.model.MaskedId;
import com.questrail.keycode.registry.KeycodeRegistry;
import com.questrail.keycode.registry.catalog.QuantumKeycodes;
import com.questrail.keycode.table.ProtocolLayout;
import com.questrail.keycode.table.WrapperKind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * KeycodeQueries
 * =============================================================================
 * Predicates, field extractors, builders and display helpers over one
 * registry snapshot and the codec bound to it.
 *
 * <h2>Numeric helpers</h2>
 * <p>Range checks and bit packing for modifier masks, mod-taps, layer-taps,
 * swap-hands taps and layer-mods read their base addresses from the
 * registry's protocol layout, so the same call is correct for both protocol
 * revisions.</p>
 *
 * <h2>Text helpers</h2>
 * <p>Outer/inner lookups split {@code WRAPPER(INNER)} text only when
 * {@code WRAPPER} is a masked wrapper of the active table; any other text is
 * looked up whole.</p>
 *
 * <h2>Export</h2>
 * <p>{@link #serializeForExport(int)} emits hex for values stock firmware
 * source has no name for, so an exported keymap compiles without this
 * codec's extended vocabulary.</p>
 */
public final class KeycodeQueries
{
    static final Set<String> EXTENDED_OUTER_MASKS = Set.of(
            "LCSG(kc)", "LSAG(kc)",
            "RCS(kc)", "RCA(kc)", "RSA(kc)", "RMEH(kc)", "RSG(kc)",
            "RCSG(kc)", "RAG(kc)", "RCAG(kc)", "RSAG(kc)", "RHYPR(kc)",
            "LCSG_T(kc)", "LSAG_T(kc)",
            "RCS_T(kc)", "RCA_T(kc)", "RSA_T(kc)", "RAG_T(kc)", "RSG_T(kc)",
            "RCSG_T(kc)", "RSAG_T(kc)", "RMEH_T(kc)", "RALL_T(kc)",
            "SH_T(kc)");

    static final List<String> EXTENDED_PREFIXES = List.of(
            "SH_", "SQ_", "LM_", "JS_", "PB_", "QK_KEY_OVERRIDE_");

    private static final Pattern MACRO_ID = Pattern.compile("M(\\d+)");
    private static final Pattern LABEL_PREFIXES = Pattern.compile("KC_|QK_|RGB_|BL_");

    private static final int MOD_MASK_FIRST = 0x0100;
    private static final int MOD_MASK_LAST = 0x1FFF;

    private final KeycodeRegistry registry;
    private final KeycodeCodec codec;

    public KeycodeQueries(KeycodeRegistry registry, KeycodeCodec codec) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    private ProtocolLayout layout() {
        return registry.table().layout();
    }

    // ---------------------------------------------------------------------
    // Text lookups
    // ---------------------------------------------------------------------

    /** {@code true} when {@code id} is {@code WRAPPER(...)} for a masked wrapper. */
    public boolean isMask(String id) {
        return MaskedId.parse(id)
                .map(m -> registry.table().isMaskedWrapper(m.wrapper()))
                .orElse(false);
    }

    public boolean isBasic(String id) {
        return codec.deserialize(id) < 0x00FF;
    }

    /**
     * Looks a descriptor up by id; the template argument {@code kc} on its
     * own stands for {@code KC_NO}.
     */
    public Optional<Keycode> findKeycode(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String key = MaskedId.TEMPLATE_ARGUMENT.equals(id) ? "KC_NO" : MaskedId.lookupKey(id);
        return registry.findById(key);
    }

    public Optional<Keycode> findOuterKeycode(String id) {
        return findKeycode(masked(id).map(MaskedId::wrapper).orElse(id));
    }

    public Optional<Keycode> findInnerKeycode(String id) {
        return findKeycode(masked(id).map(MaskedId::inner).orElse(id));
    }

    public Optional<Keycode> findByQmkId(String id) {
        return registry.findByQmkId(id);
    }

    public Optional<Keycode> findByRecorderAlias(String alias) {
        return registry.findByRecorderAlias(alias);
    }

    private Optional<MaskedId> masked(String id) {
        return isMask(id) ? MaskedId.parse(id) : Optional.empty();
    }

    // ---------------------------------------------------------------------
    // Display
    // ---------------------------------------------------------------------

    public String keycodeLabel(String id) {
        return findOuterKeycode(id).map(Keycode::label).orElse(id);
    }

    public Optional<String> keycodeTooltip(String id) {
        return findOuterKeycode(id).map(k -> k.tooltip()
                .map(tooltip -> k.id() + ": " + tooltip)
                .orElse(k.id()));
    }

    /**
     * Short single-line label for a numeric keycode: masked forms keep their
     * structure with common prefixes removed ({@code LT1(A)}), everything
     * else uses the descriptor label.
     */
    public String codeToLabel(int value) {
        String id = codec.serialize(value);
        if (isMask(id)) {
            return LABEL_PREFIXES.matcher(id).replaceAll("");
        }
        return keycodeLabel(id).replace('\n', ' ');
    }

    /**
     * Text for a C keymap: hex for layer-mods, for extended wrappers and for
     * extended feature keys, {@link KeycodeCodec#serialize(int)} otherwise.
     */
    public String serializeForExport(int value) {
        if (isLayerModKeycode(value)) {
            return hex(value);
        }
        if (registry.table().isMaskedValue(value & 0xFF00)) {
            Optional<Keycode> outer = registry.findByValue(value & 0xFF00);
            if (outer.isPresent() && EXTENDED_OUTER_MASKS.contains(outer.get().id())) {
                return hex(value);
            }
        } else {
            Optional<Keycode> keycode = registry.findByValue(value);
            if (keycode.isPresent() && hasExtendedPrefix(keycode.get().id())) {
                return hex(value);
            }
        }
        return codec.serialize(value);
    }

    private static boolean hasExtendedPrefix(String id) {
        return EXTENDED_PREFIXES.stream().anyMatch(id::startsWith);
    }

    private static String hex(int value) {
        return "0x" + Integer.toHexString(value);
    }

    // ---------------------------------------------------------------------
    // Modifier masks
    // ---------------------------------------------------------------------

    public boolean isModMaskKeycode(int value) {
        return value >= MOD_MASK_FIRST && value <= MOD_MASK_LAST;
    }

    /** Basic key or basic key under a modifier mask. */
    public boolean isModifiableKeycode(int value) {
        return value >= 0 && value <= MOD_MASK_LAST;
    }

    public int extractModMask(int value) {
        return (value >> 8) & 0x1F;
    }

    public int extractBasicKey(int value) {
        return value & 0xFF;
    }

    /** A zero mask yields the bare basic key. */
    public int buildModMaskKeycode(int modMask, int basicKey) {
        if (modMask == 0) {
            return basicKey & 0xFF;
        }
        return WrapperKind.MODIFIER.pack(layout(), modMask, basicKey & 0xFF);
    }

    // ---------------------------------------------------------------------
    // Mod-tap, layer-tap, swap-hands tap
    // ---------------------------------------------------------------------

    public boolean isModTapKeycode(int value) {
        return WrapperKind.MOD_TAP.contains(layout(), value);
    }

    /** A zero mask yields the bare basic key. */
    public int buildModTapKeycode(int modMask, int basicKey) {
        if (modMask == 0) {
            return basicKey & 0xFF;
        }
        return WrapperKind.MOD_TAP.pack(layout(), modMask, basicKey);
    }

    public boolean isLayerTapKeycode(int value) {
        return WrapperKind.LAYER_TAP.contains(layout(), value);
    }

    public int extractLayerTapLayer(int value) {
        return WrapperKind.LAYER_TAP.unpack(layout(), value)[0];
    }

    public int buildLayerTapKeycode(int layer, int basicKey) {
        return WrapperKind.LAYER_TAP.pack(layout(), layer, basicKey);
    }

    public boolean isSwapHandsTapKeycode(int value) {
        return WrapperKind.SWAP_HANDS_TAP.contains(layout(), value);
    }

    public int buildSwapHandsTapKeycode(int basicKey) {
        return WrapperKind.SWAP_HANDS_TAP.pack(layout(), basicKey);
    }

    // ---------------------------------------------------------------------
    // Layer-mod
    // ---------------------------------------------------------------------

    public boolean isLayerModKeycode(int value) {
        return WrapperKind.LAYER_MOD.contains(layout(), value);
    }

    public int extractLayerModLayer(int value) {
        return WrapperKind.LAYER_MOD.unpack(layout(), value)[0];
    }

    public int extractLayerModModifiers(int value) {
        return WrapperKind.LAYER_MOD.unpack(layout(), value)[1];
    }

    public int buildLayerModKeycode(int layer, int modifiers) {
        return WrapperKind.LAYER_MOD.pack(layout(), layer, modifiers);
    }

    /**
     * {@code MOD_*} operands whose bits fit the layer-mod modifier field;
     * right-hand modifiers drop out where the field is four bits wide.
     */
    public List<Keycode> availableLayerModifiers() {
        int mask = layout().layerModMask();
        return registry.layerModModifiers().stream()
                .filter(k -> registry.valueOf(k).stream().allMatch(v -> (v & ~mask) == 0))
                .collect(Collectors.toUnmodifiableList());
    }

    // ---------------------------------------------------------------------
    // Tap dance, macros, reset
    // ---------------------------------------------------------------------

    public boolean isTapDanceKeycode(int value) {
        return (value & 0xFF00) == layout().base(WrapperKind.TAP_DANCE);
    }

    public int tapDanceIndex(int value) {
        return value & 0xFF;
    }

    public boolean isMacroKeycode(int value) {
        return macroIndex(value).isPresent();
    }

    /** Macro slot of {@code value}, or empty when it is not a macro key. */
    public OptionalInt macroIndex(int value) {
        Optional<String> id = registeredId(value);
        if (id.isEmpty()) {
            return OptionalInt.empty();
        }
        Matcher m = MACRO_ID.matcher(id.get());
        return m.matches() ? OptionalInt.of(Integer.parseInt(m.group(1))) : OptionalInt.empty();
    }

    public boolean isResetKeycode(int value) {
        return registeredId(value).filter(QuantumKeycodes.RESET_KEYCODE::equals).isPresent();
    }

    // misses are silent; serialize would report them
    private Optional<String> registeredId(int value) {
        return registry.findByValue(value).map(Keycode::id);
    }
}
