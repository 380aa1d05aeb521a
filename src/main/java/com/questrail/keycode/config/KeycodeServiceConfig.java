package com.questrail.keycode.config;

import com.questrail.keycode.api.ProtocolVersion;
import com.questrail.keycode.observability.KeycodeObservabilitySink;
import com.questrail.keycode.observability.NullKeycodeObservabilitySink;

import java.util.Objects;

/**
 * Start-up configuration of a {@code KeycodeService}.
 */
public record KeycodeServiceConfig(
    ProtocolVersion initialProtocol,
    KeycodeObservabilitySink observability
) {
    public KeycodeServiceConfig {
        Objects.requireNonNull(initialProtocol, "initialProtocol");
        Objects.requireNonNull(observability, "observability");
    }

    public static KeycodeServiceConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ProtocolVersion initialProtocol = ProtocolVersion.V5;
        private KeycodeObservabilitySink observability = NullKeycodeObservabilitySink.INSTANCE;

        public Builder withInitialProtocol(ProtocolVersion initialProtocol) {
            this.initialProtocol = initialProtocol;
            return this;
        }

        public Builder withObservability(KeycodeObservabilitySink observability) {
            this.observability = observability;
            return this;
        }

        public KeycodeServiceConfig build() {
            return new KeycodeServiceConfig(initialProtocol, observability);
        }
    }
}
