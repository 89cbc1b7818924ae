/**
 * Handles the configuration of the decomposer and builder.
 *
 * <p>Provides the configuration foundation and the typed {@link com.mimecast.mailbuilder.config.BuilderConfig} accessors.
 * <br>Configuration files are JSON5 and are read with Gson in lenient mode.
 *
 * <p>Recognised properties:
 * <ul>
 *   <li><b>newline</b>: line terminator for rebuilt headers and boundaries (default <code>\r\n</code>).</li>
 *   <li><b>maxRfc822Depth</b>: nested message/rfc822 unwrap limit (default 5).</li>
 *   <li><b>base64LineLength</b>: base64 output wrapping (default 76).</li>
 * </ul>
 */
package com.mimecast.mailbuilder.config;
