package com.questrail.keycode.table;

import java.util.Objects;

/**
 * Indexed run of table entries produced by one wrapper kind, such as
 * {@code MO(0)..MO(31)} or the masked {@code LT0(kc)..LT15(kc)}.
 *
 * @param pattern {@link String#format} pattern taking the index
 * @param kind    wrapper kind that packs the index
 * @param count   number of entries
 * @param masked  whether entries are masked templates
 */
record KeycodeFamily(String pattern, WrapperKind kind, int count, boolean masked)
{
    KeycodeFamily {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(kind, "kind");
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }
    }

    static KeycodeFamily of(String pattern, WrapperKind kind, int count) {
        return new KeycodeFamily(pattern, kind, count, false);
    }

    static KeycodeFamily masked(String pattern, WrapperKind kind, int count) {
        return new KeycodeFamily(pattern, kind, count, true);
    }

    /**
     * Defines every member. Two-argument kinds take the index as their first
     * argument and {@code 0} as the second.
     */
    void expandInto(KeycodeTable.Builder table, ProtocolLayout layout) {
        for (int i = 0; i < count; i++) {
            int value = kind.arity() == 2 ? kind.pack(layout, i, 0) : kind.pack(layout, i);
            String name = String.format(pattern, i);
            if (masked) {
                table.masked(name, value);
            } else {
                table.define(name, value);
            }
        }
    }
}
