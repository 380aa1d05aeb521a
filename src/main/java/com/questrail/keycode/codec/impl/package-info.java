/**
 * Registry-backed codec implementation.
 *
 * <pre>
 *   int value
 *        → layer-mod split        (LM&lt;n&gt;(MOD_x))
 *        → masked composition     (WRAPPER(INNER))
 *        → exact descriptor id
 *        → 0x.... fallback
 *
 *   String text
 *        → exact descriptor id
 *        → ExpressionEvaluator
 *        → KC_NO on failure
 * </pre>
 */
package com.questrail.keycode.codec.impl;
