/**
 * Deals with the headers of a MIME message.
 *
 * <p>This package contains {@link com.mimecast.mailbuilder.mime.headers.MimeHeaders},
 * <br>the ordered multi-map of canonical header names to values used by every message node.
 */
package com.mimecast.mailbuilder.mime.headers;
