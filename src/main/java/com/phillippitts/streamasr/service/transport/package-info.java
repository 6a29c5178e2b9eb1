/**
 * Connection to the recognition service.
 *
 * <p>{@link com.phillippitts.streamasr.service.transport.AsrTransport} is the seam the session
 * orchestrator talks to; {@link com.phillippitts.streamasr.service.transport.WebSocketAsrTransport}
 * implements it with the Java-WebSocket client. Tests substitute a scripted in-memory transport.
 */
package com.phillippitts.streamasr.service.transport;
