package com.dendo.renkei.protocol.internal.exec;

import com.dendo.renkei.protocol.internal.state.ConnectionIntents;
import com.dendo.renkei.protocol.internal.state.ConnectionSnapshot;

/**
 * ConnectionIntentExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure connection state machine and the impure
 * world of sockets and timers.
 *
 * <p>Implementations realise the transport and timer intents produced by
 * {@link com.dendo.renkei.protocol.internal.state.ConnectionReducer}. Outcomes
 * (socket up, connect failed, timer elapsed) are reported back only as events,
 * tagged with the snapshot's generation.</p>
 *
 * <p>Execution must be <b>non-blocking</b>. Intents concerning pending commands
 * are handled by the driver, which owns the pending-command table.</p>
 */
public interface ConnectionIntentExecutor
{
    /**
     * @param intents  actions to perform, in {@link ConnectionIntents.Kind} order
     * @param snapshot the state the reducer just produced
     */
    void execute(ConnectionIntents intents, ConnectionSnapshot snapshot);

    /**
     * Cancel every timer and stop probing. Called once when the client shuts down.
     */
    void shutdown();
}
