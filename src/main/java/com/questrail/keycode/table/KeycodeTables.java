package com.questrail.keycode.table;

import com.questrail.keycode.api.ProtocolVersion;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Shared, eagerly generated table per protocol revision. Tables are immutable,
 * so every registry built for the same revision reads the same instance.
 */
public final class KeycodeTables
{
    private static final Map<ProtocolVersion, KeycodeTable> TABLES;

    static {
        Map<ProtocolVersion, KeycodeTable> tables = new EnumMap<>(ProtocolVersion.class);
        for (ProtocolVersion version : ProtocolVersion.values()) {
            tables.put(version, KeycodeTableGenerator.generate(version));
        }
        TABLES = Collections.unmodifiableMap(tables);
    }

    private KeycodeTables() {
    }

    public static KeycodeTable forVersion(ProtocolVersion version) {
        return TABLES.get(Objects.requireNonNull(version, "version"));
    }
}
