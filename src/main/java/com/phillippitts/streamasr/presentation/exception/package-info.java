/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.streamasr.exception.InvalidAudioException} and invalid request
 *       bodies → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.streamasr.exception.ConnectionException},
 *       {@link com.phillippitts.streamasr.exception.TransportException} → 503 Service Unavailable (retry)</li>
 *   <li>{@link com.phillippitts.streamasr.exception.RemoteServiceException},
 *       {@link com.phillippitts.streamasr.exception.FrameDecodeException} → 502 Bad Gateway</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "RemoteServiceException",
 *   "message": "Recognition service rejected the request",
 *   "details": "Service code 1013",
 *   "timestamp": "2026-03-02T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.streamasr.presentation.exception;
