package com.dendo.renkei.protocol.codec;

import com.dendo.renkei.protocol.model.RenkeiCommand;

/**
 * RenkeiFrameEncoder
 * -----------------------------------------------------------------------------
 * Outbound half of the wire codec.
 *
 * <p>Produces one complete protocol line, including the terminating newline,
 * ready to be written to the socket unchanged.</p>
 */
public interface RenkeiFrameEncoder
{
    byte[] encode(RenkeiCommand command);
}
