package com.questrail.keycode.expression;

import java.util.OptionalInt;

/**
 * Resolves a bare identifier appearing in a keycode expression.
 */
@FunctionalInterface
public interface IdentifierResolver
{
    OptionalInt resolve(String name);
}
