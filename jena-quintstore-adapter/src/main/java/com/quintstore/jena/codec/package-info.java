/**
 * Term encoding for the quint table.
 *
 * <p>{@link com.quintstore.jena.codec.TermCodec} maps Jena nodes to stored
 * strings and back; {@link com.quintstore.jena.codec.FpString} provides the
 * order-preserving numeric key used inside encoded numeric and dateTime
 * literals.</p>
 */
package com.quintstore.jena.codec;
