/**
 * Keycode Codec
 * =============================================================================
 *
 * <p>Conversion between the 16-bit keycodes a device stores and the text a
 * user reads and types.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   KeycodeTable        (numeric layout of one protocol revision)
 *        → KeycodeRegistry   (descriptors available on one device)
 *            → KeycodeCodec      (serialize / deserialize / normalize)
 *                → KeycodeQueries    (labels, predicates, builders)
 * </pre>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>The codec never mutates its registry; a device change means a new
 *       registry and a new codec.</li>
 *   <li>Neither direction throws for bad device data. Unknown values become
 *       hex literals and unparsable text becomes {@code KC_NO}, each reported
 *       to the observability sink.</li>
 *   <li>Bit packing lives in {@link com.questrail.keycode.table.WrapperKind},
 *       never here.</li>
 * </ul>
 */
package com.questrail.keycode.codec;
