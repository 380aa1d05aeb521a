package com.questrail.keycode.table;

/**
 * Indicates a defect in keycode table construction or in a caller that asks
 * a table for a constant it was never given.
 *
 * This is never caused by user-supplied text. Typical causes:
 * <ul>
 *   <li>A descriptor catalog references an id missing from the table</li>
 *   <li>Two generator rules define the same constant</li>
 *   <li>A wrapper kind is packed with the wrong number of arguments</li>
 * </ul>
 */
public final class KeycodeTableException extends RuntimeException
{
    public KeycodeTableException(String message) {
        super(message);
    }

    public KeycodeTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
