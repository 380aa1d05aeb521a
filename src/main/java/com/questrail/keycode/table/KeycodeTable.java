package com.questrail.keycode.table;

import com.questrail.keycode.api.ProtocolVersion;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * KeycodeTable
 * =============================================================================
 * Immutable map from keycode name to 16-bit value for one protocol revision.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>Every canonical keycode id the descriptor catalogs reference</li>
 *   <li>Structural constants ({@code QK_*} bases, {@code MOD_*} bits, layout
 *       parameters)</li>
 *   <li>Masked wrapper templates keyed with their {@code (kc)} suffix, e.g.
 *       {@code LSFT(kc)} or {@code LT3(kc)}, valued at the wrapper applied to
 *       {@code KC_NO}</li>
 * </ul>
 *
 * <h2>Masked values</h2>
 * <p>The table also records which high-byte values belong to masked wrappers.
 * The codec uses {@link #maskedWrapperAt(int)} to decompose a value into an
 * outer wrapper and an inner basic keycode. When two masked templates share a
 * value the first one defined keeps it.</p>
 *
 * <p>Tables are produced by {@link KeycodeTableGenerator}; use
 * {@link KeycodeTables} for the shared per-revision instances.</p>
 */
public final class KeycodeTable
{
    private final ProtocolVersion version;
    private final Map<String, Integer> values;
    private final Set<String> maskedWrappers;
    private final Map<Integer, String> maskedWrapperByValue;
    private final ProtocolLayout layout;

    private KeycodeTable(Builder b) {
        this.version = b.version;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(b.values));
        this.maskedWrappers = Collections.unmodifiableSet(new LinkedHashSet<>(b.maskedWrappers));
        this.maskedWrapperByValue = Map.copyOf(b.maskedWrapperByValue);
        this.layout = b.layout();
    }

    public ProtocolVersion version() {
        return version;
    }

    public ProtocolLayout layout() {
        return layout;
    }

    /** All entries in definition order. */
    public Map<String, Integer> values() {
        return values;
    }

    /**
     * @throws KeycodeTableException if {@code name} is not in this table
     */
    public int resolve(String name) {
        Integer value = values.get(name);
        if (value == null) {
            throw new KeycodeTableException("No keycode '" + name + "' in " + version + " table");
        }
        return value;
    }

    public OptionalInt find(String name) {
        Integer value = values.get(name);
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /** Wrapper names of masked templates, without the {@code (kc)} suffix. */
    public Set<String> maskedWrappers() {
        return maskedWrappers;
    }

    public boolean isMaskedWrapper(String wrapperName) {
        return maskedWrappers.contains(wrapperName);
    }

    public boolean isMaskedValue(int value) {
        return maskedWrapperByValue.containsKey(value);
    }

    /**
     * @return wrapper name whose template value equals {@code value}
     */
    public Optional<String> maskedWrapperAt(int value) {
        return Optional.ofNullable(maskedWrapperByValue.get(value));
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "KeycodeTable[" + version + ", " + values.size() + " entries]";
    }

    static Builder builder(ProtocolVersion version) {
        return new Builder(version);
    }

    /**
     * Mutable staging area used by the generator. Redefining a name is a
     * construction defect and throws.
     */
    static final class Builder
    {
        private static final String TEMPLATE_SUFFIX = "(kc)";

        private final ProtocolVersion version;
        private final Map<String, Integer> values = new LinkedHashMap<>();
        private final Set<String> maskedWrappers = new LinkedHashSet<>();
        private final Map<Integer, String> maskedWrapperByValue = new HashMap<>();
        private ProtocolLayout layout;

        private Builder(ProtocolVersion version) {
            this.version = Objects.requireNonNull(version, "version");
        }

        Builder define(String name, int value) {
            Objects.requireNonNull(name, "name");
            if (values.putIfAbsent(name, value) != null) {
                throw new KeycodeTableException("Duplicate keycode '" + name + "' in " + version + " table");
            }
            return this;
        }

        /** Defines consecutive values starting at {@code start}. */
        Builder sequence(int start, String... names) {
            int value = start;
            for (String name : names) {
                define(name, value++);
            }
            return this;
        }

        /** Defines {@code count} values named by {@code pattern} formatted with the index. */
        Builder indexed(String pattern, int start, int count) {
            for (int i = 0; i < count; i++) {
                define(String.format(pattern, i), start + i);
            }
            return this;
        }

        Builder masked(String template, int value) {
            if (!template.endsWith(TEMPLATE_SUFFIX)) {
                throw new KeycodeTableException("Masked template must end with (kc): " + template);
            }
            define(template, value);
            String wrapper = template.substring(0, template.length() - TEMPLATE_SUFFIX.length());
            maskedWrappers.add(wrapper);
            maskedWrapperByValue.putIfAbsent(value, wrapper);
            return this;
        }

        int resolve(String name) {
            Integer value = values.get(name);
            if (value == null) {
                throw new KeycodeTableException("No keycode '" + name + "' defined yet in " + version + " table");
            }
            return value;
        }

        /** Layout read from the structural constants defined so far; computed once. */
        ProtocolLayout layout() {
            if (layout == null) {
                layout = ProtocolLayout.from(version, this::resolve);
            }
            return layout;
        }

        KeycodeTable build() {
            return new KeycodeTable(this);
        }
    }
}
