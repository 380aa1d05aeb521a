package com.questrail.keycode.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Device-declared custom keycode occupying one {@code USERnn} slot.
 *
 * <p>Every field is optional; each missing one falls back to the slot id
 * ({@code USER00}, {@code USER01} ...).</p>
 */
public final class CustomKeycodeDefinition
{
    private final String name;
    private final String title;
    private final String shortName;

    private CustomKeycodeDefinition(String name, String title, String shortName) {
        this.name = name;
        this.title = title;
        this.shortName = shortName;
    }

    public static CustomKeycodeDefinition of(String name, String title, String shortName) {
        return new CustomKeycodeDefinition(name, title, shortName);
    }

    public static CustomKeycodeDefinition named(String name) {
        return new CustomKeycodeDefinition(Objects.requireNonNull(name, "name"), null, null);
    }

    public static CustomKeycodeDefinition empty() {
        return new CustomKeycodeDefinition(null, null, null);
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public Optional<String> title() {
        return Optional.ofNullable(title);
    }

    public Optional<String> shortName() {
        return Optional.ofNullable(shortName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CustomKeycodeDefinition other)) return false;
        return Objects.equals(name, other.name)
                && Objects.equals(title, other.title)
                && Objects.equals(shortName, other.shortName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, title, shortName);
    }

    @Override
    public String toString() {
        return "CustomKeycodeDefinition{name=" + name + ", title=" + title + ", shortName=" + shortName + "}";
    }
}
