/**
 * Netty-backed keymap byte handling.
 *
 * <p>Netty types stay inside this package. Everything above it exchanges
 * {@code byte[]} and {@link com.questrail.keycode.keymap.KeymapBuffer} only.</p>
 */
package com.questrail.keycode.keymap.netty;
