/**
 * Application-specific exception hierarchy.
 *
 * <p>Every failure a recognition session can report is a subclass of
 * {@link com.phillippitts.streamasr.exception.StreamAsrException}, which lets the session
 * return failures as values and lets the REST layer map them to HTTP status codes.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.streamasr.exception.ConnectionException} - transport could not
 *       be opened</li>
 *   <li>{@link com.phillippitts.streamasr.exception.TransportException} - send/receive failed or
 *       a receive deadline expired mid-session</li>
 *   <li>{@link com.phillippitts.streamasr.exception.FrameDecodeException} - malformed frame, bad
 *       gzip or bad JSON</li>
 *   <li>{@link com.phillippitts.streamasr.exception.RemoteServiceException} - service returned a
 *       non-success status or an error frame</li>
 *   <li>{@link com.phillippitts.streamasr.exception.CodecException} - one Opus packet failed to
 *       decode; recovered locally by skipping the packet</li>
 *   <li>{@link com.phillippitts.streamasr.exception.UnexpectedSessionException} - anything else</li>
 *   <li>{@link com.phillippitts.streamasr.exception.InvalidAudioException} - malformed audio input</li>
 * </ul>
 *
 * @see com.phillippitts.streamasr.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.streamasr.exception;
