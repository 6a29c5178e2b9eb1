/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.streamasr.config.AudioFormatConfig} - startup check of the
 *       audio format declared to the service (16kHz, 16-bit, mono PCM)</li>
 *   <li>{@link com.phillippitts.streamasr.config.ThreadPoolConfig} - executor for background
 *       recognition sessions</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.asr} - recognition pipeline wiring</li>
 *   <li>{@code config.properties} - externalized configuration</li>
 *   <li>{@code config.logging} - MDC filter</li>
 * </ul>
 */
package com.phillippitts.streamasr.config;
