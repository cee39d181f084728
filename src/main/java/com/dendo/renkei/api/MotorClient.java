package com.dendo.renkei.api;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * MotorClient
 * -----------------------------------------------------------------------------
 * Public operation surface of a RENKEI PoE motor connection.
 *
 * <p>No method blocks on network I/O. Operations return futures that complete
 * on the client's callback thread. Argument ranges are checked synchronously and
 * violations throw {@link MotorValidationException}; every other failure completes
 * the future exceptionally with a {@link RenkeiClientException} subtype:</p>
 * <ul>
 *   <li>{@link NotConnectedException} when the client is not {@link ConnectionState#CONNECTED}</li>
 *   <li>{@link CommandInFlightException} when the same command is already awaiting a response</li>
 *   <li>{@link CommandTimeoutException} when no response arrives within the command timeout</li>
 *   <li>{@link DeviceErrorException} when the motor reports an error</li>
 *   <li>{@link ConnectionLostException} when the session drops before the response</li>
 * </ul>
 */
public interface MotorClient extends AutoCloseable
{
    /**
     * Starts connecting. The client keeps reconnecting after failures until
     * {@link #disconnect()} is called.
     *
     * @return a future completing the first time the client reaches
     *         {@link ConnectionState#CONNECTED}
     */
    CompletableFuture<Void> connect();

    /**
     * Closes the session, cancels reconnection and fails every pending command.
     */
    void disconnect();

    ConnectionState state();

    /**
     * Wall-clock time the last inbound frame was received, if any.
     */
    Optional<Instant> lastSeen();

    /**
     * Move to a percentage of travel.
     *
     * @param position     0&ndash;100
     * @param delaySeconds 0&ndash;30
     */
    CompletableFuture<Void> move(int position, int delaySeconds);

    /**
     * Move to a raw encoder position.
     *
     * @param position    0&ndash;65536
     * @param delayMillis 0&ndash;10000
     */
    CompletableFuture<Void> absoluteMove(int position, int delayMillis);

    CompletableFuture<Void> stop();

    /**
     * Jog the motor so it can be identified physically.
     *
     * @param count 1&ndash;10
     */
    CompletableFuture<Void> jog(int count);

    CompletableFuture<MotorStatus> getStatus();

    CompletableFuture<MotorInfo> getInfo();

    /**
     * Installs the status listener, replacing any previous one. {@code null} removes it.
     */
    void setStatusListener(MotorStatusListener listener);

    /**
     * Installs the connection state listener, replacing any previous one. {@code null} removes it.
     */
    void setConnectionStateListener(ConnectionStateListener listener);

    /**
     * Disconnects and releases all threads. The client cannot be reused.
     */
    @Override
    void close();
}
