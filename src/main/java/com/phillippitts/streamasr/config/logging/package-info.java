/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - HTTP request id, set by
 *       {@link com.phillippitts.streamasr.config.logging.MdcFilter}</li>
 *   <li>{@code reqid} - request id sent to the recognition service for the running session</li>
 *   <li>{@code sessionState} - state of the running session</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 15:42:32.529 [thread-name] [requestId] [reqid] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.streamasr.config.logging;
