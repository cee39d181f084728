/**
 * Transport boundary of the RENKEI client.
 *
 * <p>{@link com.dendo.renkei.protocol.transport.StreamEndpoint} is the raw I/O
 * port. {@link com.dendo.renkei.protocol.transport.TcpTransportAdapter} is the
 * translation layer: it decodes lines into frames and turns transport callbacks
 * into driver events. Framework types (Netty channels, buffers) stay inside the
 * {@code tcp.netty} package.</p>
 */
package com.dendo.renkei.protocol.transport;
