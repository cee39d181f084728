/**
 * Wire codec for the RENKEI motor protocol.
 *
 * <p>The protocol is newline-delimited JSON over TCP:</p>
 * <pre>
 *   request   {"cmd": "GET_STATUS", "params": {}}
 *   response  {"response": "GET_STATUS", "data": {...}}
 *   push      {"event": "CURRENT_POS", "data": {...}}
 * </pre>
 *
 * <p>A frame whose {@code response} names something other than a command the
 * client issues (or {@code ERROR}) is a push event, not a response.</p>
 *
 * <p>Placement:</p>
 * <pre>
 *   socket bytes
 *        → LineBasedFrameDecoder (transport: newline split, resync)
 *            → RenkeiFrameDecoder (this package: JSON → RenkeiInbound)
 *                → EventDispatcher
 * </pre>
 */
package com.dendo.renkei.protocol.codec;
