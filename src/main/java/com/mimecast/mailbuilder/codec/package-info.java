/**
 * Content-Transfer-Encoding codec and boundary generation.
 *
 * <p>The {@link com.mimecast.mailbuilder.codec.ContentEncoding} encodes and decodes base64 and quoted-printable bodies.
 * <br>Decoding reports whether a transform was applied so rebuilt messages can be encoded back.
 *
 * <p>The {@link com.mimecast.mailbuilder.codec.Boundaries} generates random multipart boundaries.
 */
package com.mimecast.mailbuilder.codec;
