package com.questrail.keycode;

import com.questrail.keycode.api.KeycodeCategory;
import com.questrail.keycode.api.KeycodeCodec;
import com.questrail.keycode.api.ProtocolVersion;
import com.questrail.keycode.config.CustomKeycodeDefinition;
import com.questrail.keycode.config.KeyboardContext;
import com.questrail.keycode.config.KeycodeServiceConfig;
import com.questrail.keycode.observability.RecordingKeycodeObservabilitySink;
import com.questrail.keycode.observability.RegistryRebuiltEvent;
import com.questrail.keycode.observability.Slf4jKeycodeObservabilitySink;
import com.questrail.keycode.observability.UnresolvedTextEvent;
import com.questrail.keycode.registry.KeycodeRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KeycodeServiceTest
 * -----------------------------------------------------------------------------
 * Snapshot lifecycle of the service: initial build, deferred protocol
 * changes, device rebuilds and the events each rebuild reports.
 */
final class KeycodeServiceTest
{
    private static KeycodeService serviceWith(RecordingKeycodeObservabilitySink sink) {
        return new KeycodeService(KeycodeServiceConfig.builder().withObservability(sink).build());
    }

    @Test
    void startsWithLegacyRevisionOne() {
        RecordingKeycodeObservabilitySink sink = new RecordingKeycodeObservabilitySink();
        KeycodeService service = serviceWith(sink);

        assertEquals(1, service.revision());
        assertEquals(5, service.getProtocol());
        assertEquals(ProtocolVersion.V5, service.registry().protocol());
        assertEquals("MO(1)", service.serialize(0x5101));

        List<RegistryRebuiltEvent> events = sink.eventsOfType(RegistryRebuiltEvent.class);
        assertEquals(1, events.size());
        assertEquals(1, events.get(0).revision());
        assertEquals(service.registry().keycodes().size(), events.get(0).keycodeCount());
    }

    @Test
    void setProtocolTakesEffectOnRecreate() {
        KeycodeService service = new KeycodeService();

        service.setProtocol(6);
        assertEquals(6, service.getProtocol());
        assertEquals(ProtocolVersion.V5, service.registry().protocol());
        assertEquals(1, service.revision());

        service.recreateKeycodes();
        assertEquals(ProtocolVersion.V6, service.registry().protocol());
        assertEquals(2, service.revision());
        assertEquals("MO(1)", service.serialize(0x5221));
    }

    @Test
    void unknownProtocolNumbersMeanLegacy() {
        KeycodeService service = new KeycodeService(
                KeycodeServiceConfig.builder().withInitialProtocol(ProtocolVersion.V6).build());

        service.setProtocol(0);
        service.recreateKeycodes();

        assertEquals(ProtocolVersion.V5, service.protocolVersion());
        assertEquals(ProtocolVersion.V5, service.registry().protocol());
    }

    @Test
    void deviceRebuildAppliesContextImmediately() {
        RecordingKeycodeObservabilitySink sink = new RecordingKeycodeObservabilitySink();
        KeycodeService service = serviceWith(sink);

        KeyboardContext device = KeyboardContext.builder()
                .withProtocol(ProtocolVersion.V6)
                .withLayers(8)
                .withTapDanceCount(4)
                .addCustomKeycode(CustomKeycodeDefinition.of("MY_KEY", "Does a thing", "Mine"))
                .withSupportedFeatures(Set.of("caps_word"))
                .build();
        service.recreateKeyboardKeycodes(device);

        assertEquals(2, service.revision());
        assertEquals(6, service.getProtocol());
        assertEquals(4, service.keycodes(KeycodeCategory.TAP_DANCE).size());
        assertEquals(1, service.keycodes(KeycodeCategory.USER).size());
        assertEquals(0x7E00, service.deserialize("MY_KEY"));
        assertEquals("Mine", service.keycodeLabel("USER00"));
        assertTrue(service.visibleKeycodes(KeycodeCategory.QUANTUM).stream()
                .anyMatch(k -> k.id().equals("QK_CAPS_WORD_TOGGLE")));
        assertEquals(2, sink.eventsOfType(RegistryRebuiltEvent.class).size());
    }

    @Test
    void recreateKeepsDeviceContext() {
        KeycodeService service = new KeycodeService();
        service.recreateKeyboardKeycodes(KeyboardContext.builder()
                .withProtocol(ProtocolVersion.V6)
                .withLayers(8)
                .build());

        service.setProtocol(ProtocolVersion.V5);
        service.recreateKeycodes();

        KeycodeRegistry registry = service.registry();
        assertEquals(ProtocolVersion.V5, registry.protocol());
        assertEquals(8, registry.context().layers());
        assertEquals(3, service.revision());
    }

    @Test
    void heldCodecKeepsItsSnapshot() {
        KeycodeService service = new KeycodeService();
        KeycodeCodec legacy = service.codec();

        service.recreateKeyboardKeycodes(KeyboardContext.defaults(ProtocolVersion.V6));

        assertEquals(0x5101, legacy.deserialize("MO(1)"));
        assertEquals(0x5221, service.deserialize("MO(1)"));
    }

    @Test
    void delegatesAnswerAgainstCurrentSnapshot() {
        KeycodeService service = new KeycodeService();
        service.recreateKeyboardKeycodes(KeyboardContext.defaults(ProtocolVersion.V6));

        assertEquals("LSFT(KC_1)", service.normalize("KC_EXLM"));
        assertEquals(0x1234, service.deserialize(0x1234));
        assertEquals("0x5021", service.serializeForExport(0x5021));
        assertEquals("KC_ENTER", service.findKeycode("KC_ENTER").orElseThrow().id());
        assertEquals("KC_ENTER", service.findByQmkId("KC_ENTER").orElseThrow().id());
        assertEquals("KC_ESCAPE", service.findByRecorderAlias("esc").orElseThrow().id());
        assertEquals("LT2(kc)", service.findOuterKeycode("LT2(KC_A)").orElseThrow().id());
        assertEquals("KC_A", service.findInnerKeycode("LT2(KC_A)").orElseThrow().id());
        assertEquals("KC_A", service.keycodeTooltip("KC_A").orElseThrow());
        assertEquals("LT2(A)", service.codeToLabel(0x4204));
        assertEquals(10, service.availableLayerModifiers().size());

        assertTrue(service.isMask("LSFT(KC_A)"));
        assertTrue(service.isBasic("KC_A"));
        assertTrue(service.isTapDanceKeycode(0x5703));
        assertEquals(3, service.tapDanceIndex(0x5703));
        assertTrue(service.isMacroKeycode(0x7705));
        assertEquals(5, service.macroIndex(0x7705).getAsInt());
        assertTrue(service.isResetKeycode(0x7C00));
        assertTrue(service.isLayerModKeycode(0x5021));
    }

    @Test
    void unresolvedTextIsReportedToConfiguredSink() {
        RecordingKeycodeObservabilitySink sink = new RecordingKeycodeObservabilitySink();
        KeycodeService service = serviceWith(sink);

        assertEquals(KeycodeCodec.NO_KEYCODE, service.deserialize("KC_DOES_NOT_EXIST"));
        assertTrue(sink.hasEventOfType(UnresolvedTextEvent.class));
    }

    @Test
    void slf4jSinkAcceptsEveryEvent() {
        KeycodeService service = new KeycodeService(KeycodeServiceConfig.builder()
                .withObservability(new Slf4jKeycodeObservabilitySink())
                .build());

        assertDoesNotThrow(() -> {
            service.recreateKeycodes();
            service.deserialize("not a keycode");
            service.serialize(0xFFFF);
        });
    }

    @Test
    void readersNeverSeeAHalfBuiltSnapshot() throws Exception {
        KeycodeService service = new KeycodeService();
        AtomicBoolean running = new AtomicBoolean(true);
        AtomicBoolean inconsistent = new AtomicBoolean(false);
        CountDownLatch started = new CountDownLatch(1);

        Thread reader = new Thread(() -> {
            started.countDown();
            while (running.get()) {
                KeycodeRegistry registry = service.registry();
                int expected = registry.protocol() == ProtocolVersion.V6 ? 0x5221 : 0x5101;
                if (registry.valueOf("MO(1)").orElse(-1) != expected) {
                    inconsistent.set(true);
                }
            }
        });
        reader.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        for (int i = 0; i < 20; i++) {
            service.setProtocol(i % 2 == 0 ? ProtocolVersion.V6 : ProtocolVersion.V5);
            service.recreateKeycodes();
        }
        running.set(false);
        reader.join(TimeUnit.SECONDS.toMillis(5));

        assertFalse(inconsistent.get());
        assertEquals(21, service.revision());
    }
}
