/**
 * Multipart body scanning.
 *
 * <p>{@link com.mimecast.mailbuilder.mime.multipart.MultipartReader} splits a body at its boundary
 * <br>and returns {@link com.mimecast.mailbuilder.mime.multipart.MultipartPart} instances with raw part headers.
 */
package com.mimecast.mailbuilder.mime.multipart;
