package com.questrail.keycode.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Keycode
 * =============================================================================
 * Descriptor of one named key function.
 *
 * <h2>Identity</h2>
 * <p>{@link #id()} is the canonical textual identifier, for example
 * {@code KC_A}, {@code MO(2)} or the masked template {@code LSFT(kc)}. The
 * first element of {@link #aliases()} is always the id itself; further aliases
 * are alternative spellings accepted as input.</p>
 *
 * <h2>Values</h2>
 * <p>A descriptor carries no numeric value. Values depend on the protocol
 * revision and are owned by the keycode table the registry was built from, so
 * the same descriptor text maps to different numbers under v5 and v6.</p>
 *
 * <h2>Lifetime</h2>
 * <p>Descriptors are immutable and belong to the registry snapshot that
 * produced them. The {@code hidden} flag is fixed at rebuild time from the
 * device's feature set. Callers re-resolve by id after a rebuild rather than
 * holding descriptors across rebuilds.</p>
 */
public final class Keycode
{
    private final String id;
    private final String label;
    private final String tooltip;
    private final boolean masked;
    private final String printable;
    private final List<String> aliases;
    private final List<String> recorderAliases;
    private final KeycodeCategory category;
    private final String requiresFeature;
    private final boolean hidden;

    private Keycode(Builder b, boolean hidden) {
        this.id = b.id;
        this.label = b.label;
        this.tooltip = b.tooltip;
        this.masked = b.masked;
        this.printable = b.printable;
        List<String> all = new ArrayList<>(1 + b.aliases.size());
        all.add(b.id);
        all.addAll(b.aliases);
        this.aliases = Collections.unmodifiableList(all);
        this.recorderAliases = List.copyOf(b.recorderAliases);
        this.category = b.category;
        this.requiresFeature = b.requiresFeature;
        this.hidden = hidden;
    }

    private Keycode(Keycode source, boolean hidden) {
        this.id = source.id;
        this.label = source.label;
        this.tooltip = source.tooltip;
        this.masked = source.masked;
        this.printable = source.printable;
        this.aliases = source.aliases;
        this.recorderAliases = source.recorderAliases;
        this.category = source.category;
        this.requiresFeature = source.requiresFeature;
        this.hidden = hidden;
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    public Optional<String> tooltip() {
        return Optional.ofNullable(tooltip);
    }

    /**
     * @return {@code true} for wrapper templates that consume an inner keycode
     *         or modifier argument, such as {@code LSFT(kc)} or {@code LT3(kc)}
     */
    public boolean masked() {
        return masked;
    }

    public Optional<String> printable() {
        return Optional.ofNullable(printable);
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * Aliases in the keystroke-recorder namespace ({@code "a"}, {@code "left shift"}).
     * They are deliberately separate from {@link #aliases()}.
     */
    public List<String> recorderAliases() {
        return recorderAliases;
    }

    public KeycodeCategory category() {
        return category;
    }

    public Optional<String> requiresFeature() {
        return Optional.ofNullable(requiresFeature);
    }

    /**
     * @return {@code true} when the device does not support this keycode; it
     *         stays addressable but is left out of category listings
     */
    public boolean hidden() {
        return hidden;
    }

    public boolean isSupportedBy(Set<String> supportedFeatures) {
        Objects.requireNonNull(supportedFeatures, "supportedFeatures");
        return requiresFeature == null || supportedFeatures.contains(requiresFeature);
    }

    /**
     * Returns this descriptor with the given hidden flag, reusing {@code this}
     * when the flag already matches.
     */
    public Keycode withHidden(boolean hidden) {
        return hidden == this.hidden ? this : new Keycode(this, hidden);
    }

    @Override
    public String toString() {
        return "Keycode[" + id + "]";
    }

    public static Builder builder(String id, String label) {
        return new Builder(id, label);
    }

    public static final class Builder {
        private final String id;
        private final String label;
        private String tooltip;
        private boolean masked;
        private String printable;
        private final List<String> aliases = new ArrayList<>();
        private final List<String> recorderAliases = new ArrayList<>();
        private KeycodeCategory category = KeycodeCategory.BASIC;
        private String requiresFeature;

        private Builder(String id, String label) {
            this.id = Objects.requireNonNull(id, "id");
            this.label = Objects.requireNonNull(label, "label");
        }

        public Builder withTooltip(String tooltip) {
            this.tooltip = tooltip;
            return this;
        }

        public Builder masked() {
            this.masked = true;
            return this;
        }

        public Builder withPrintable(String printable) {
            this.printable = printable;
            return this;
        }

        public Builder withAliases(String... aliases) {
            for (String alias : aliases) {
                this.aliases.add(Objects.requireNonNull(alias, "alias"));
            }
            return this;
        }

        public Builder withRecorderAliases(String... recorderAliases) {
            for (String alias : recorderAliases) {
                this.recorderAliases.add(Objects.requireNonNull(alias, "recorderAlias"));
            }
            return this;
        }

        public Builder withCategory(KeycodeCategory category) {
            this.category = Objects.requireNonNull(category, "category");
            return this;
        }

        public Builder withRequiresFeature(String requiresFeature) {
            this.requiresFeature = requiresFeature;
            return this;
        }

        public Keycode build() {
            return new Keycode(this, false);
        }
    }
}
