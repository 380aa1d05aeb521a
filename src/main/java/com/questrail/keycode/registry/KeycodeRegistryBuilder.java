package com.questrail.keycode.registry;

import com.questrail.keycode.api.Keycode;
import com.questrail.keycode.config.KeyboardContext;
import com.questrail.keycode.model.MaskedId;
import com.questrail.keycode.registry.catalog.BasicKeycodes;
import com.questrail.keycode.registry.catalog.LightingKeycodes;
import com.questrail.keycode.registry.catalog.MediaKeycodes;
import com.questrail.keycode.registry.catalog.ModifierKeycodes;
import com.questrail.keycode.registry.catalog.QuantumKeycodes;
import com.questrail.keycode.table.KeycodeTable;
import com.questrail.keycode.table.KeycodeTables;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * KeycodeRegistryBuilder
 * =============================================================================
 * Assembles a {@link KeycodeRegistry} for a device.
 *
 * <h2>Registry order</h2>
 * <p>Descriptors are registered in a fixed category order: special, basic,
 * shifted, ISO, layers, boot, modifiers, quantum, lighting, media, tap dance,
 * macro, user, hidden, MIDI. Order matters because the value index is
 * first-wins: when two descriptors share a value, the earlier one is what
 * {@code serialize} returns.</p>
 *
 * <h2>Feature gating</h2>
 * <p>After assembly each descriptor is marked hidden when it requires a
 * feature the device does not report. Hidden descriptors stay in every index;
 * only category listings filter them.</p>
 *
 * <h2>Failure</h2>
 * <ul>
 *   <li>A descriptor id absent from the protocol table throws
 *       {@link com.questrail.keycode.table.KeycodeTableException}</li>
 *   <li>Two descriptors claiming one recorder alias throws
 *       {@link IllegalStateException}</li>
 * </ul>
 * Both indicate catalog defects, not bad device input.
 */
public final class KeycodeRegistryBuilder
{
    private KeycodeRegistryBuilder() {
    }

    /**
     * Builds a registry against the shared table for {@code context.protocol()}.
     */
    public static KeycodeRegistry build(KeyboardContext context, long revision) {
        Objects.requireNonNull(context, "context");
        return build(KeycodeTables.forVersion(context.protocol()), context, revision);
    }

    public static KeycodeRegistry build(KeycodeTable table, KeyboardContext context, long revision) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(context, "context");
        if (table.version() != context.protocol()) {
            throw new IllegalArgumentException(
                    "Table is for " + table.version() + " but context requests " + context.protocol());
        }

        List<Keycode> ordered = new ArrayList<>();
        ordered.addAll(BasicKeycodes.SPECIAL);
        ordered.addAll(BasicKeycodes.BASIC);
        ordered.addAll(BasicKeycodes.SHIFTED);
        ordered.addAll(BasicKeycodes.ISO);
        ordered.addAll(DeviceKeycodes.layers(context));
        ordered.addAll(QuantumKeycodes.BOOT);
        ordered.addAll(ModifierKeycodes.ALL);
        ordered.addAll(QuantumKeycodes.ALL);
        ordered.addAll(LightingKeycodes.ALL);
        ordered.addAll(MediaKeycodes.ALL);
        ordered.addAll(DeviceKeycodes.tapDance(context));
        ordered.addAll(DeviceKeycodes.macros(context));
        ordered.addAll(DeviceKeycodes.user(context));
        ordered.addAll(DeviceKeycodes.hidden());
        ordered.addAll(DeviceKeycodes.midi(context));

        return index(table, context, revision, ordered);
    }

    /**
     * Applies feature gating and builds the lookup indices over descriptors
     * already in registry order.
     */
    static KeycodeRegistry index(KeycodeTable table, KeyboardContext context, long revision, List<Keycode> ordered) {
        List<Keycode> keycodes = new ArrayList<>(ordered.size());
        for (Keycode keycode : ordered) {
            keycodes.add(keycode.withHidden(!keycode.isSupportedBy(context.supportedFeatures())));
        }

        Map<String, Keycode> byId = new HashMap<>();
        Map<String, Keycode> byAlias = new HashMap<>();
        Map<String, Keycode> byRecorderAlias = new HashMap<>();
        Map<Integer, Keycode> byValue = new HashMap<>();
        Map<String, Integer> valueById = new HashMap<>();

        for (Keycode keycode : keycodes) {
            int value = table.resolve(keycode.id());
            byId.putIfAbsent(MaskedId.lookupKey(keycode.id()), keycode);
            valueById.putIfAbsent(keycode.id(), value);
            byValue.putIfAbsent(value, keycode);
            for (String alias : keycode.aliases()) {
                byAlias.putIfAbsent(alias, keycode);
            }
            for (String alias : keycode.recorderAliases()) {
                Keycode previous = byRecorderAlias.putIfAbsent(alias, keycode);
                if (previous != null && !previous.id().equals(keycode.id())) {
                    throw new IllegalStateException("Misconfigured: two keycodes claim the same alias " + alias);
                }
            }
        }

        // MOD_* operands: id and alias lookups only, their values collide with basic keys
        for (Keycode modifier : ModifierKeycodes.LAYER_MOD_MODIFIERS) {
            byId.put(modifier.id(), modifier);
            byAlias.putIfAbsent(modifier.id(), modifier);
            valueById.put(modifier.id(), table.resolve(modifier.id()));
        }

        return new KeycodeRegistry(
                table, context, revision, keycodes,
                byId, byAlias, byRecorderAlias, byValue, valueById,
                ModifierKeycodes.LAYER_MOD_MODIFIERS);
    }
}
