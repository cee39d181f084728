package com.dendo.renkei.protocol.codec;

import com.dendo.renkei.protocol.internal.decode.RenkeiDecodeException;
import com.dendo.renkei.protocol.model.RenkeiCommand;
import com.dendo.renkei.protocol.model.RenkeiInbound;

/**
 * RenkeiFrameDecoder
 * -----------------------------------------------------------------------------
 * Inbound half of the wire codec.
 *
 * <p>The decoder receives exactly one line with its delimiter already removed.
 * Line splitting happens in the transport; a malformed line therefore never
 * affects the next one.</p>
 */
public interface RenkeiFrameDecoder
{
    /**
     * Decode a line sent by the motor.
     *
     * @param line one protocol line without its newline
     * @return a {@code RenkeiResponse} or {@code RenkeiPushEvent}
     * @throws RenkeiDecodeException if the line is not a well-formed frame
     */
    RenkeiInbound decode(byte[] line);

    /**
     * Decode a line in the request direction. Used by tooling and device
     * simulators that sit on the motor side of the connection.
     *
     * @throws RenkeiDecodeException if the line is not a well-formed request
     */
    RenkeiCommand decodeCommand(byte[] line);
}
