package com.questrail.keycode.codec.impl;

import com.questrail.keycode.api.Keycode;
import com.questrail.keycode.api.KeycodeCodec;
import com.questrail.keycode.expression.ExpressionEvaluator;
import com.questrail.keycode.expression.KeycodeExpressionException;
import com.questrail.keycode.model.MaskedId;
import com.questrail.keycode.observability.KeycodeObservabilitySink;
import com.questrail.keycode.observability.UnrepresentableValueEvent;
import com.questrail.keycode.observability.UnresolvedTextEvent;
import com.questrail.keycode.registry.KeycodeRegistry;
import com.questrail.keycode.table.KeycodeTable;
import com.questrail.keycode.table.ProtocolLayout;
import com.questrail.keycode.table.WrapperKind;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultKeycodeCodec
 * =============================================================================
 * {@link KeycodeCodec} bound to one {@link KeycodeRegistry} snapshot.
 *
 * <h2>serialize</h2>
 * <ol>
 *   <li>Layer-mod values render as {@code LM<layer>(MOD_x)}, or
 *       {@code LM<layer>(0x..)} when the modifier bits have no name. Layer-mod
 *       bits do not follow the high-byte/low-byte split, so this runs
 *       first.</li>
 *   <li>When the high byte is a masked wrapper value, the wrapper and the
 *       low-byte key are looked up separately and composed:
 *       {@code 0x021E} becomes {@code LSFT(KC_1)}.</li>
 *   <li>Otherwise the first descriptor registered with the value wins.</li>
 *   <li>Anything left renders as a four-digit hex literal and is reported to
 *       the observability sink.</li>
 * </ol>
 *
 * <h2>deserialize</h2>
 * <p>An exact descriptor id resolves directly. Everything else goes through
 * the {@link ExpressionEvaluator}; text it rejects yields
 * {@link #NO_KEYCODE} and an {@link UnresolvedTextEvent}.
 * {@link #deserializeStored(String)} reports the same event for values that
 * resolve but do not fit 16 bits.</p>
 */
public final class DefaultKeycodeCodec implements KeycodeCodec
{
    private static final int HIGH_BYTE = 0xFF00;
    private static final int LOW_BYTE = 0x00FF;

    private final KeycodeRegistry registry;
    private final KeycodeObservabilitySink sink;
    private final ExpressionEvaluator evaluator;
    private final Map<Integer, String> layerModifierNames;

    public DefaultKeycodeCodec(KeycodeRegistry registry, KeycodeObservabilitySink sink) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.evaluator = new ExpressionEvaluator(registry.table().layout(), registry::resolveIdentifier);

        Map<Integer, String> names = new HashMap<>();
        for (Keycode modifier : registry.layerModModifiers()) {
            registry.valueOf(modifier).ifPresent(v -> names.putIfAbsent(v, modifier.id()));
        }
        this.layerModifierNames = Map.copyOf(names);
    }

    public KeycodeRegistry registry() {
        return registry;
    }

    @Override
    public String serialize(int value) {
        ProtocolLayout layout = registry.table().layout();
        if (WrapperKind.LAYER_MOD.contains(layout, value)) {
            return serializeLayerMod(layout, value);
        }

        KeycodeTable table = registry.table();
        if (table.isMaskedValue(value & HIGH_BYTE)) {
            Optional<String> composed = compose(value);
            if (composed.isPresent()) {
                return composed.get();
            }
        }

        Optional<Keycode> exact = registry.findByValue(value);
        if (exact.isPresent()) {
            return exact.get().id();
        }

        String fallback = String.format("0x%04x", value);
        sink.onUnrepresentableValue(new UnrepresentableValueEvent(Instant.now(), value, fallback));
        return fallback;
    }

    @Override
    public int deserialize(String text) {
        if (text == null) {
            sink.onUnresolvedText(new UnresolvedTextEvent(Instant.now(), null,
                    new KeycodeExpressionException("Expression is null")));
            return NO_KEYCODE;
        }

        Optional<Keycode> exact = registry.findByQmkId(text);
        if (exact.isPresent()) {
            return registry.valueOf(exact.get()).orElseThrow();
        }

        try {
            return evaluator.evaluate(text);
        } catch (KeycodeExpressionException e) {
            sink.onUnresolvedText(new UnresolvedTextEvent(Instant.now(), text, e));
            return NO_KEYCODE;
        }
    }

    @Override
    public int deserializeStored(String text) {
        int value = deserialize(text);
        if (value < 0 || value > MAX_STORED_KEYCODE) {
            sink.onUnresolvedText(new UnresolvedTextEvent(Instant.now(), text,
                    new KeycodeExpressionException(
                            String.format("Value 0x%x of '%s' does not fit a keymap slot", value, text))));
            return NO_KEYCODE;
        }
        return value;
    }

    private String serializeLayerMod(ProtocolLayout layout, int value) {
        int[] parts = WrapperKind.LAYER_MOD.unpack(layout, value);
        String modifier = layerModifierNames.get(parts[1]);
        return modifier != null
                ? "LM" + parts[0] + "(" + modifier + ")"
                : "LM" + parts[0] + "(0x" + Integer.toHexString(parts[1]) + ")";
    }

    private Optional<String> compose(int value) {
        Optional<Keycode> outer = registry.findByValue(value & HIGH_BYTE);
        Optional<Keycode> inner = registry.findByValue(value & LOW_BYTE);
        if (outer.isEmpty() || inner.isEmpty()) {
            return Optional.empty();
        }
        return MaskedId.parse(outer.get().id())
                .filter(MaskedId::isTemplate)
                .map(m -> MaskedId.of(m.wrapper(), inner.get().id()).render());
    }
}
