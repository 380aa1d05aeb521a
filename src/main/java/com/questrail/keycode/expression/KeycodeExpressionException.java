package com.questrail.keycode.expression;

/**
 * Indicates that keycode text could not be turned into a numeric keycode.
 *
 * This typically reflects:
 * <ul>
 *   <li>A character outside the expression alphabet</li>
 *   <li>An unknown identifier or wrapper name</li>
 *   <li>A wrapper call with the wrong number of arguments</li>
 *   <li>Tokens left over after a complete expression</li>
 * </ul>
 */
public final class KeycodeExpressionException extends RuntimeException
{
    public KeycodeExpressionException(String message) {
        super(message);
    }

    public KeycodeExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
