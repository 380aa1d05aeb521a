package com.questrail.keycode;

import com.questrail.keycode.api.Keycode;
import com.questrail.keycode.api.KeycodeCategory;
import com.questrail.keycode.api.KeycodeCodec;
import com.questrail.keycode.api.ProtocolVersion;
import com.questrail.keycode.codec.KeycodeQueries;
import com.questrail.keycode.codec.impl.DefaultKeycodeCodec;
import com.questrail.keycode.config.KeyboardContext;
import com.questrail.keycode.config.KeycodeServiceConfig;
import com.questrail.keycode.observability.KeycodeObservabilitySink;
import com.questrail.keycode.observability.RegistryRebuiltEvent;
import com.questrail.keycode.registry.KeycodeRegistry;
import com.questrail.keycode.registry.KeycodeRegistryBuilder;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * KeycodeService
 * -----------------------------------------------------------------------------
 * Owner of the active keycode registry and the codec bound to it.
 *
 * <h2>What this class is</h2>
 * <ul>
 *   <li>The single holder of the current {@link KeycodeRegistry} snapshot</li>
 *   <li>The entry point for rebuilding that snapshot when the protocol
 *       revision or the connected device changes</li>
 *   <li>A facade over {@link KeycodeCodec} and {@link KeycodeQueries} that
 *       always answers against the latest snapshot</li>
 * </ul>
 *
 * <h2>Rebuilds</h2>
 * <p>A rebuild constructs a complete registry and codec off to the side and
 * installs them with a single volatile write. A call that starts before the
 * write sees the old snapshot throughout; one that starts after sees the new
 * one. No caller ever observes a half-built registry.</p>
 *
 * <p>{@link #setProtocol(ProtocolVersion)} only records the revision; it
 * takes effect at the next {@link #recreateKeycodes()}.
 * {@link #recreateKeyboardKeycodes(KeyboardContext)} applies the context's
 * own revision immediately.</p>
 *
 * <h2>Descriptor identity</h2>
 * <p>Descriptors are rebuilt on every rebuild. Hold ids, not
 * {@link Keycode} instances, across a rebuild.</p>
 */
public final class KeycodeService
{
    private final KeycodeObservabilitySink sink;

    private volatile ProtocolVersion protocol;
    private volatile Snapshot snapshot;
    private long revision;

    private record Snapshot(KeycodeRegistry registry, KeycodeCodec codec, KeycodeQueries queries)
    {
    }

    public KeycodeService() {
        this(KeycodeServiceConfig.defaults());
    }

    public KeycodeService(KeycodeServiceConfig config) {
        Objects.requireNonNull(config, "config");
        this.sink = config.observability();
        this.protocol = config.initialProtocol();
        install(KeyboardContext.defaults(protocol));
    }

    // ---------------------------------------------------------------------
    // Protocol and rebuilds
    // ---------------------------------------------------------------------

    /** Records the protocol reported by a device; see {@link ProtocolVersion#fromMajor(int)}. */
    public void setProtocol(int major) {
        setProtocol(ProtocolVersion.fromMajor(major));
    }

    public void setProtocol(ProtocolVersion protocol) {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
    }

    /** Protocol major number last recorded, which may not be built yet. */
    public int getProtocol() {
        return protocol.major();
    }

    public ProtocolVersion protocolVersion() {
        return protocol;
    }

    /**
     * Rebuilds with the recorded protocol and the device context of the
     * current snapshot.
     */
    public synchronized void recreateKeycodes() {
        KeyboardContext current = snapshot.registry().context();
        install(current.toBuilder().withProtocol(protocol).build());
    }

    /**
     * Rebuilds for a connected device. Family sizes, custom keycodes, MIDI
     * level and feature gating all come from {@code context}.
     */
    public synchronized void recreateKeyboardKeycodes(KeyboardContext context) {
        Objects.requireNonNull(context, "context");
        this.protocol = context.protocol();
        install(context);
    }

    private synchronized void install(KeyboardContext context) {
        long next = revision + 1;
        KeycodeRegistry registry = KeycodeRegistryBuilder.build(context, next);
        KeycodeCodec codec = new DefaultKeycodeCodec(registry, sink);
        this.snapshot = new Snapshot(registry, codec, new KeycodeQueries(registry, codec));
        this.revision = next;

        sink.onRegistryRebuilt(new RegistryRebuiltEvent(
                Instant.now(),
                registry.protocol(),
                next,
                registry.keycodes().size(),
                registry.hiddenCount()));
    }

    /** Incremented by every rebuild; the first snapshot is revision 1. */
    public long revision() {
        return snapshot.registry().revision();
    }

    public KeycodeRegistry registry() {
        return snapshot.registry();
    }

    public KeycodeCodec codec() {
        return snapshot.codec();
    }

    public KeycodeQueries queries() {
        return snapshot.queries();
    }

    // ---------------------------------------------------------------------
    // Codec
    // ---------------------------------------------------------------------

    public String serialize(int value) {
        return snapshot.codec().serialize(value);
    }

    public int deserialize(String text) {
        return snapshot.codec().deserialize(text);
    }

    public int deserialize(int value) {
        return snapshot.codec().deserialize(value);
    }

    public String normalize(String text) {
        return snapshot.codec().normalize(text);
    }

    public String serializeForExport(int value) {
        return snapshot.queries().serializeForExport(value);
    }

    // ---------------------------------------------------------------------
    // Lookups and display
    // ---------------------------------------------------------------------

    public Optional<Keycode> findKeycode(String id) {
        return snapshot.queries().findKeycode(id);
    }

    public Optional<Keycode> findByQmkId(String id) {
        return snapshot.queries().findByQmkId(id);
    }

    public Optional<Keycode> findByRecorderAlias(String alias) {
        return snapshot.queries().findByRecorderAlias(alias);
    }

    public Optional<Keycode> findOuterKeycode(String id) {
        return snapshot.queries().findOuterKeycode(id);
    }

    public Optional<Keycode> findInnerKeycode(String id) {
        return snapshot.queries().findInnerKeycode(id);
    }

    public String keycodeLabel(String id) {
        return snapshot.queries().keycodeLabel(id);
    }

    public Optional<String> keycodeTooltip(String id) {
        return snapshot.queries().keycodeTooltip(id);
    }

    public String codeToLabel(int value) {
        return snapshot.queries().codeToLabel(value);
    }

    /** Every descriptor of a category, hidden ones included. */
    public List<Keycode> keycodes(KeycodeCategory category) {
        return snapshot.registry().category(category);
    }

    /** Descriptors of a category the connected device supports. */
    public List<Keycode> visibleKeycodes(KeycodeCategory category) {
        return snapshot.registry().visible(category);
    }

    public List<Keycode> availableLayerModifiers() {
        return snapshot.queries().availableLayerModifiers();
    }

    // ---------------------------------------------------------------------
    // Predicates and extractors
    // ---------------------------------------------------------------------

    public boolean isMask(String id) {
        return snapshot.queries().isMask(id);
    }

    public boolean isBasic(String id) {
        return snapshot.queries().isBasic(id);
    }

    public boolean isTapDanceKeycode(int value) {
        return snapshot.queries().isTapDanceKeycode(value);
    }

    public int tapDanceIndex(int value) {
        return snapshot.queries().tapDanceIndex(value);
    }

    public boolean isMacroKeycode(int value) {
        return snapshot.queries().isMacroKeycode(value);
    }

    public OptionalInt macroIndex(int value) {
        return snapshot.queries().macroIndex(value);
    }

    public boolean isResetKeycode(int value) {
        return snapshot.queries().isResetKeycode(value);
    }

    public boolean isLayerModKeycode(int value) {
        return snapshot.queries().isLayerModKeycode(value);
    }
}
