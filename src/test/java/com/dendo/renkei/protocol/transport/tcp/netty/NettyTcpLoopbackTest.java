package com.dendo.renkei.protocol.transport.tcp.netty;

import com.dendo.renkei.api.ConnectionLostException;
import com.dendo.renkei.api.ConnectionState;
import com.dendo.renkei.api.MotorInfo;
import com.dendo.renkei.api.MotorStatus;
import com.dendo.renkei.protocol.RenkeiMotorClient;
import com.dendo.renkei.protocol.config.RenkeiClientConfig;
import com.dendo.renkei.protocol.internal.exec.RenkeiTimingPolicy;
import com.dendo.renkei.protocol.observability.RecordingObservabilitySink;
import com.dendo.renkei.protocol.observability.RenkeiProtocolEvent;
import com.dendo.renkei.protocol.transport.StreamEndpointListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyTcpLoopbackTest
 * -----------------------------------------------------------------------------
 * Runs the production client over a real loopback socket against a scripted
 * motor: framing, malformed and oversized lines, request/response, pushes and
 * loss of the connection.
 */
class NettyTcpLoopbackTest {

    private static final long WAIT_MILLIS = 5000;

    private ServerSocket server;
    private RenkeiMotorClient client;

    @AfterEach
    void tearDown() throws IOException {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.close();
        }
    }

    private static RenkeiClientConfig config(int port) {
        return RenkeiClientConfig.builder()
                .withHost("127.0.0.1")
                .withPort(port)
                .withMaxLineLength(1024)
                .withTimingPolicy(RenkeiTimingPolicy.defaults()
                        .withStabiliseDelay(Duration.ofMillis(50))
                        .withHealthCheckInterval(Duration.ZERO)
                        .withReconnectInterval(Duration.ofSeconds(30))
                        .withCommandTimeout(Duration.ofSeconds(5))
                        .withConnectTimeout(Duration.ofSeconds(2)))
                .build();
    }

    private static void awaitTrue(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(WAIT_MILLIS);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + what);
            }
            Thread.sleep(10);
        }
    }

    private static void writeLine(OutputStream out, String line) throws IOException {
        out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    @Test
    void talksToScriptedMotorOverLoopback() throws Exception {
        server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        List<MotorStatus> statuses = new CopyOnWriteArrayList<>();
        List<String> requests = new CopyOnWriteArrayList<>();

        CompletableFuture<Void> motor = CompletableFuture.runAsync(() -> {
            try (Socket socket = server.accept()) {
                socket.setSoTimeout((int) WAIT_MILLIS);
                OutputStream out = socket.getOutputStream();
                BufferedReader in = new BufferedReader(
                        new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));

                writeLine(out, "not json");
                writeLine(out, "x".repeat(9000));
                writeLine(out, "{\"event\":\"CURRENT_POS\",\"data\":{\"absolute\":\"0x1F40\",\"percent\":12}}");

                String request = in.readLine();
                requests.add(request);
                writeLine(out, "{\"response\":\"GET_INFO\",\"data\":{\"ip\":\"127.0.0.1\","
                        + "\"mac\":\"00:11:22:33:44:55\",\"firmware\":\"2.1.0\"}}");

                // Wait for the client to hang up or for the test to move on.
                in.readLine();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });

        client = RenkeiMotorClient.create(config(server.getLocalPort()), sink);
        client.setStatusListener(statuses::add);

        client.connect().get(WAIT_MILLIS, TimeUnit.MILLISECONDS);
        assertEquals(ConnectionState.CONNECTED, client.state());

        MotorInfo info = client.getInfo().get(WAIT_MILLIS, TimeUnit.MILLISECONDS);

        assertEquals(List.of("{\"cmd\":\"GET_INFO\",\"params\":{}}"), requests);
        assertEquals("2.1.0", info.firmware());
        assertEquals("RENKEI PoE 334455", info.deviceName());
        assertTrue(client.lastSeen().isPresent());

        awaitTrue(() -> !statuses.isEmpty(), "CURRENT_POS push");
        assertEquals(OptionalInt.of(8000), statuses.get(0).currentPos());
        assertEquals(2, sink.getProtocolEvents(RenkeiProtocolEvent.Kind.DECODE_ERROR).size());

        client.disconnect();
        motor.get(WAIT_MILLIS, TimeUnit.MILLISECONDS);
        awaitTrue(() -> client.state() == ConnectionState.DISCONNECTED, "DISCONNECTED");
    }

    @Test
    void peerCloseMovesClientToReconnecting() throws Exception {
        server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        List<ConnectionState> states = new CopyOnWriteArrayList<>();

        CompletableFuture<Socket> accepted = CompletableFuture.supplyAsync(() -> {
            try {
                return server.accept();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });

        client = RenkeiMotorClient.create(config(server.getLocalPort()), new RecordingObservabilitySink());
        client.setConnectionStateListener(states::add);
        client.connect().get(WAIT_MILLIS, TimeUnit.MILLISECONDS);

        CompletableFuture<MotorStatus> status = client.getStatus();
        try (Socket socket = accepted.get(WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
            socket.setSoTimeout((int) WAIT_MILLIS);
            BufferedReader in = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            // Hang up only once the request is on the wire.
            assertEquals("{\"cmd\":\"GET_STATUS\",\"params\":{}}", in.readLine());
        }

        awaitTrue(() -> client.state() == ConnectionState.RECONNECTING, "RECONNECTING");
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> status.get(WAIT_MILLIS, TimeUnit.MILLISECONDS));
        assertInstanceOf(ConnectionLostException.class, ex.getCause());
        awaitTrue(() -> states.contains(ConnectionState.RECONNECTING), "state listener");
    }

    @Test
    void refusedConnectionKeepsRetrying() throws Exception {
        int closedPort;
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = probe.getLocalPort();
        }
        RecordingObservabilitySink sink = new RecordingObservabilitySink();

        client = RenkeiMotorClient.create(config(closedPort), sink);
        CompletableFuture<Void> connected = client.connect();

        awaitTrue(() -> client.state() == ConnectionState.RECONNECTING, "RECONNECTING");
        assertFalse(connected.isDone());
        assertFalse(sink.getTransportEvents().isEmpty());
    }

    @Test
    void closeStraightAfterConnectLeavesNoSocketOpen() throws Exception {
        server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        server.setSoTimeout((int) WAIT_MILLIS);
        List<Long> up = new CopyOnWriteArrayList<>();

        NettyTcpStreamEndpoint endpoint = new NettyTcpStreamEndpoint(
                "127.0.0.1", server.getLocalPort(), Duration.ofSeconds(2), 1024);
        endpoint.setListener(new StreamEndpointListener() {
            @Override
            public void onTransportUp(long generation) {
                up.add(generation);
            }

            @Override
            public void onConnectFailed(long generation, Throwable cause) {
            }

            @Override
            public void onTransportDown(long generation, Throwable cause) {
            }

            @Override
            public void onLine(long generation, byte[] line) {
            }

            @Override
            public void onLineDiscarded(long generation, String reason) {
            }
        });

        try {
            endpoint.connect(1);
            endpoint.close();

            try (Socket socket = server.accept()) {
                socket.setSoTimeout((int) WAIT_MILLIS);
                assertEquals(-1, socket.getInputStream().read(), "client side must hang up");
            } catch (SocketTimeoutException e) {
                // The attempt was cancelled before it reached the server.
                assertTrue(up.isEmpty());
            }
            assertFalse(endpoint.send("{}".getBytes(StandardCharsets.UTF_8)));
        } finally {
            endpoint.shutdown();
        }
    }
}
