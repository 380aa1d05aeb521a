package com.questrail.keycode.registry;

import com.questrail.keycode.api.Keycode;
import com.questrail.keycode.api.KeycodeCategory;
import com.questrail.keycode.api.ProtocolVersion;
import com.questrail.keycode.config.KeyboardContext;
import com.questrail.keycode.model.MaskedId;
import com.questrail.keycode.table.KeycodeTable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * KeycodeRegistry
 * =============================================================================
 * Immutable snapshot of every descriptor available for one device, with the
 * lookup indices the codec needs.
 *
 * <h2>Indices</h2>
 * <ul>
 *   <li><b>by id</b>: descriptor id with any {@code (kc)} suffix removed, plus
 *       the {@code MOD_*} layer-mod operands</li>
 *   <li><b>by alias</b>: every alias, including the id itself</li>
 *   <li><b>by recorder alias</b>: keystroke-recorder names, kept apart from
 *       the alias namespace</li>
 *   <li><b>by value</b>: numeric value to descriptor, first registered
 *       descriptor wins, {@code MOD_*} operands excluded</li>
 * </ul>
 *
 * <h2>Snapshots</h2>
 * <p>A registry never changes after construction. A rebuild produces a new
 * instance with a higher {@link #revision()}; readers holding the old one keep
 * a consistent view.</p>
 *
 * <p>Instances are built by {@link KeycodeRegistryBuilder}.</p>
 */
public final class KeycodeRegistry
{
    private final KeycodeTable table;
    private final KeyboardContext context;
    private final long revision;
    private final List<Keycode> keycodes;
    private final Map<KeycodeCategory, List<Keycode>> byCategory;
    private final Map<String, Keycode> byId;
    private final Map<String, Keycode> byAlias;
    private final Map<String, Keycode> byRecorderAlias;
    private final Map<Integer, Keycode> byValue;
    private final Map<String, Integer> valueById;
    private final List<Keycode> layerModModifiers;

    KeycodeRegistry(
            KeycodeTable table,
            KeyboardContext context,
            long revision,
            List<Keycode> keycodes,
            Map<String, Keycode> byId,
            Map<String, Keycode> byAlias,
            Map<String, Keycode> byRecorderAlias,
            Map<Integer, Keycode> byValue,
            Map<String, Integer> valueById,
            List<Keycode> layerModModifiers
    ) {
        this.table = Objects.requireNonNull(table, "table");
        this.context = Objects.requireNonNull(context, "context");
        this.revision = revision;
        this.keycodes = List.copyOf(keycodes);
        this.byId = Collections.unmodifiableMap(byId);
        this.byAlias = Collections.unmodifiableMap(byAlias);
        this.byRecorderAlias = Collections.unmodifiableMap(byRecorderAlias);
        this.byValue = Collections.unmodifiableMap(byValue);
        this.valueById = Collections.unmodifiableMap(valueById);
        this.layerModModifiers = List.copyOf(layerModModifiers);

        Map<KeycodeCategory, List<Keycode>> grouped = new EnumMap<>(KeycodeCategory.class);
        for (KeycodeCategory category : KeycodeCategory.values()) {
            grouped.put(category, List.of());
        }
        grouped.putAll(this.keycodes.stream()
                .collect(Collectors.groupingBy(Keycode::category, () -> new EnumMap<>(KeycodeCategory.class),
                        Collectors.collectingAndThen(Collectors.toList(), List::copyOf))));
        grouped.put(KeycodeCategory.LAYER_MOD_MODIFIER, this.layerModModifiers);
        this.byCategory = Collections.unmodifiableMap(grouped);
    }

    public KeycodeTable table() {
        return table;
    }

    public ProtocolVersion protocol() {
        return table.version();
    }

    public KeyboardContext context() {
        return context;
    }

    public long revision() {
        return revision;
    }

    /** All descriptors in registry order, hidden ones included. */
    public List<Keycode> keycodes() {
        return keycodes;
    }

    public List<Keycode> category(KeycodeCategory category) {
        return byCategory.get(Objects.requireNonNull(category, "category"));
    }

    /** Descriptors of a category that the device supports. */
    public List<Keycode> visible(KeycodeCategory category) {
        return category(category).stream().filter(k -> !k.hidden()).collect(Collectors.toUnmodifiableList());
    }

    public int hiddenCount() {
        return (int) keycodes.stream().filter(Keycode::hidden).count();
    }

    /** {@code MOD_*} operands usable inside layer-mod keycodes. */
    public List<Keycode> layerModModifiers() {
        return layerModModifiers;
    }

    /**
     * Looks a descriptor up by id. Masked templates are found by their
     * wrapper name: {@code LSFT} finds {@code LSFT(kc)}.
     */
    public Optional<Keycode> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /** Exact id match; {@code LSFT(kc)} must be given with its suffix. */
    public Optional<Keycode> findByQmkId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        Keycode keycode = byId.get(MaskedId.lookupKey(id));
        return keycode != null && keycode.id().equals(id) ? Optional.of(keycode) : Optional.empty();
    }

    public Optional<Keycode> findByAlias(String alias) {
        return Optional.ofNullable(byAlias.get(alias));
    }

    public Optional<Keycode> findByRecorderAlias(String alias) {
        return Optional.ofNullable(byRecorderAlias.get(alias));
    }

    public Optional<Keycode> findByValue(int value) {
        return Optional.ofNullable(byValue.get(value));
    }

    /** Numeric value of a registered descriptor id, {@code MOD_*} operands included. */
    public OptionalInt valueOf(String id) {
        Integer value = valueById.get(id);
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    public OptionalInt valueOf(Keycode keycode) {
        return valueOf(keycode.id());
    }

    /**
     * Resolves a bare identifier used in keycode expressions: any alias of a
     * registered descriptor, or a {@code MOD_*} operand.
     */
    public OptionalInt resolveIdentifier(String name) {
        Keycode keycode = byAlias.get(name);
        return keycode == null ? OptionalInt.empty() : valueOf(keycode.id());
    }

    @Override
    public String toString() {
        return "KeycodeRegistry[" + protocol() + ", revision=" + revision + ", " + keycodes.size() + " keycodes]";
    }
}
