/**
 * Framed binary protocol spoken with the remote recognition service.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.streamasr.service.protocol.FrameHeader} - the 4-byte nibble-packed
 *       header; the only place its bit layout lives</li>
 *   <li>{@link com.phillippitts.streamasr.service.protocol.FrameCodec} - request frame encoding
 *       and server frame decoding</li>
 *   <li>{@link com.phillippitts.streamasr.service.protocol.DecodedResponse} - typed view of a
 *       decoded server frame</li>
 *   <li>{@link com.phillippitts.streamasr.service.protocol.SessionRequestConfig} - the JSON
 *       configuration document opening every session</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.streamasr.service.protocol;
