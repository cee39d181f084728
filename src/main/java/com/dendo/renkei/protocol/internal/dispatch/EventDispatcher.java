package com.dendo.renkei.protocol.internal.dispatch;

import com.dendo.renkei.api.DeviceErrorException;
import com.dendo.renkei.api.MotorStatus;
import com.dendo.renkei.protocol.internal.decode.MotorDataDecoder;
import com.dendo.renkei.protocol.internal.decode.RenkeiDecodeException;
import com.dendo.renkei.protocol.internal.exec.PendingCommandTable;
import com.dendo.renkei.protocol.internal.time.WallClock;
import com.dendo.renkei.protocol.model.CommandName;
import com.dendo.renkei.protocol.model.DeviceErrorCode;
import com.dendo.renkei.protocol.model.RenkeiInbound;
import com.dendo.renkei.protocol.model.RenkeiPushEvent;
import com.dendo.renkei.protocol.model.RenkeiResponse;
import com.dendo.renkei.protocol.observability.RenkeiObservabilitySink;
import com.dendo.renkei.protocol.observability.RenkeiProtocolEvent;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * EventDispatcher
 * =============================================================================
 * Routes decoded inbound frames.
 *
 * <h2>Routing</h2>
 * <ul>
 *   <li>Responses resolve the pending command of the same name. A response
 *       nobody is waiting for is reported as stray and dropped.</li>
 *   <li>{@code ERROR} responses name no command; they fail the oldest pending
 *       command with {@link DeviceErrorException} and are published as status
 *       whether or not anything was pending.</li>
 *   <li>{@code GET_STATUS} responses are additionally published as status.</li>
 *   <li>{@code CURRENT_POS} and {@code ERROR} push events become status updates.</li>
 *   <li>Any other push type is reported and dropped.</li>
 * </ul>
 *
 * <h2>Status accumulation</h2>
 * Push events carry only some fields. Each update is merged into the last
 * known status and the merged snapshot is what listeners receive. The
 * percentage only comes from pushes, so it is dropped when the connection is
 * lost rather than carried next to a refreshed encoder position.
 *
 * <h2>Threading</h2>
 * Confined to the connection driver's thread, like the table it resolves into.
 */
public final class EventDispatcher
{
    private final MotorDataDecoder dataDecoder;
    private final ListenerNotifier notifier;
    private final RenkeiObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private MotorStatus lastKnown = MotorStatus.empty();

    public EventDispatcher(MotorDataDecoder dataDecoder,
                           ListenerNotifier notifier,
                           RenkeiObservabilitySink observabilitySink,
                           WallClock wallClock) {
        this.dataDecoder = Objects.requireNonNull(dataDecoder, "dataDecoder");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public void dispatch(RenkeiInbound frame, PendingCommandTable pending) {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(pending, "pending");

        if (frame instanceof RenkeiResponse response) {
            onResponse(response, pending);
        } else if (frame instanceof RenkeiPushEvent event) {
            onPushEvent(event);
        }
    }

    private void onResponse(RenkeiResponse response, PendingCommandTable pending) {
        if (response.isError()) {
            onErrorResponse(response.data(), pending);
            return;
        }

        if (pending.resolve(response)) {
            report(RenkeiProtocolEvent.Kind.RESPONSE_RECEIVED, response.name());
        } else {
            report(RenkeiProtocolEvent.Kind.STRAY_RESPONSE, response.name() + " " + response.data());
        }

        if (response.command().filter(c -> c == CommandName.GET_STATUS).isPresent()) {
            publish(response.name(), () -> dataDecoder.status(response.data()));
        }
    }

    private void onErrorResponse(Map<String, Object> data, PendingCommandTable pending) {
        String code = dataDecoder.errorCode(data);
        String description = describe(code, data);

        String failed = pending.failOldest(new DeviceErrorException(code, description));
        if (failed == null) {
            report(RenkeiProtocolEvent.Kind.STRAY_RESPONSE, "ERROR " + code + " with no pending command");
        } else {
            report(RenkeiProtocolEvent.Kind.DEVICE_ERROR, failed + " failed: " + code + " " + description);
        }
        publish(RenkeiResponse.ERROR, () -> dataDecoder.errorNotice(data));
    }

    /**
     * Called when the connection leaves {@code CONNECTED}.
     */
    public void connectionLost() {
        lastKnown = lastKnown.withoutCurrentPercent();
    }

    MotorStatus lastKnown() {
        return lastKnown;
    }

    private void onPushEvent(RenkeiPushEvent event) {
        switch (event.name()) {
            case RenkeiPushEvent.CURRENT_POS -> publish(event.name(), () -> dataDecoder.currentPosition(event.data()));
            case RenkeiPushEvent.ERROR -> {
                String code = dataDecoder.errorCode(event.data());
                report(RenkeiProtocolEvent.Kind.DEVICE_ERROR, "pushed " + code + " " + describe(code, event.data()));
                publish(event.name(), () -> dataDecoder.errorNotice(event.data()));
            }
            default -> report(RenkeiProtocolEvent.Kind.UNKNOWN_EVENT, event.name() + " " + event.data());
        }
    }

    private void publish(String source, Supplier<MotorStatus> update) {
        final MotorStatus decoded;
        try {
            decoded = update.get();
        } catch (RenkeiDecodeException e) {
            report(RenkeiProtocolEvent.Kind.DECODE_ERROR, source + ": " + e.getMessage());
            return;
        }
        lastKnown = lastKnown.mergedWith(decoded);
        report(RenkeiProtocolEvent.Kind.STATUS_UPDATE, source);
        notifier.publishStatus(lastKnown);
    }

    private String describe(String code, Map<String, Object> data) {
        if (data.containsKey("description")) {
            return dataDecoder.errorDescription(data);
        }
        return DeviceErrorCode.fromCode(code)
                .map(DeviceErrorCode::description)
                .orElse(dataDecoder.errorDescription(data));
    }

    private void report(RenkeiProtocolEvent.Kind kind, String detail) {
        observabilitySink.onProtocolEvent(new RenkeiProtocolEvent(wallClock.now(), kind, detail));
    }
}
