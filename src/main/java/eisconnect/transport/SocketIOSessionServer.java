package eisconnect.transport;

import com.corundumstudio.socketio.AckRequest;
import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import eisconnect.core.BatterySessionEngine;
import eisconnect.domain.Ack;
import eisconnect.error.SessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Socket.IO server exposing the session engine to measurement clients.
 *
 * <p>Events:
 * <ul>
 *   <li>{@code start_session} - session metadata JSON</li>
 *   <li>{@code push_sample} - sample JSON</li>
 *   <li>{@code end_session} - no payload</li>
 * </ul>
 * Each event is answered through the Socket.IO acknowledgement with either the
 * {@link Ack} or an error object carrying the error kind and details.
 */
public class SocketIOSessionServer {
    private static final Logger logger = LoggerFactory.getLogger(SocketIOSessionServer.class);

    static final String EVENT_START_SESSION = "start_session";
    static final String EVENT_PUSH_SAMPLE = "push_sample";
    static final String EVENT_END_SESSION = "end_session";

    private final String host;
    private final int port;
    private final BatterySessionEngine engine;
    private final SessionPayloadCodec codec;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger connectedClients = new AtomicInteger(0);

    private SocketIOServer server;

    /**
     * Create a new Socket.IO session server.
     *
     * @param host   the address to bind
     * @param port   the server port to listen on
     * @param engine the engine that handles session operations
     */
    public SocketIOSessionServer(String host, int port, BatterySessionEngine engine) {
        this(host, port, engine, new SessionPayloadCodec());
    }

    SocketIOSessionServer(String host, int port, BatterySessionEngine engine, SessionPayloadCodec codec) {
        this.host = Objects.requireNonNull(host, "host cannot be null");
        this.port = port;
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            try {
                startServer();
                logger.info("Socket.IO session server started on {}:{}", host, port);
            } catch (Exception e) {
                running.set(false);
                throw new RuntimeException("Failed to start Socket.IO server", e);
            }
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (server != null) {
                server.stop();
                server = null;
            }
            logger.info("Socket.IO session server stopped");
        }
    }

    public boolean isRunning() {
        return running.get() && server != null;
    }

    /**
     * Get the number of connected clients.
     */
    public int getConnectedClients() {
        return connectedClients.get();
    }

    private void startServer() {
        Configuration config = new Configuration();
        config.setHostname(host);
        config.setPort(port);
        config.setOrigin("*");
        config.setMaxFramePayloadLength(1048576); // 1MB max frame size
        config.setMaxHttpContentLength(1048576);  // 1MB max HTTP content
        config.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        config.setUpgradeTimeout(10000);
        config.setPingTimeout(60000);
        config.setPingInterval(25000);

        server = new SocketIOServer(config);

        server.addConnectListener(client -> {
            int count = connectedClients.incrementAndGet();
            logger.info("Client connected: {} (Total connections: {})", client.getSessionId(), count);
        });

        server.addDisconnectListener(client -> {
            int count = connectedClients.decrementAndGet();
            logger.info("Client disconnected: {} (Total connections: {})", client.getSessionId(), count);
        });

        server.addEventListener(EVENT_START_SESSION, Object.class,
                (client, data, ackRequest) -> reply(client, ackRequest, EVENT_START_SESSION,
                        handleStartSession(data)));

        server.addEventListener(EVENT_PUSH_SAMPLE, Object.class,
                (client, data, ackRequest) -> reply(client, ackRequest, EVENT_PUSH_SAMPLE,
                        handlePushSample(data)));

        server.addEventListener(EVENT_END_SESSION, Object.class,
                (client, data, ackRequest) -> reply(client, ackRequest, EVENT_END_SESSION,
                        handleEndSession()));

        server.start();
    }

    Map<String, Object> handleStartSession(Object payload) {
        return invoke(() -> engine.startSession(codec.readMeta(payload)));
    }

    Map<String, Object> handlePushSample(Object payload) {
        return invoke(() -> engine.pushSample(codec.readSample(payload)));
    }

    Map<String, Object> handleEndSession() {
        return invoke(engine::endSession);
    }

    void reply(SocketIOClient client, AckRequest ackRequest, String event, Map<String, Object> response) {
        try {
            if (ackRequest != null && ackRequest.isAckRequested()) {
                ackRequest.sendAckData(response);
            } else if (!Boolean.TRUE.equals(response.get("success"))) {
                // No ack callback: push the error as its own event so it is not lost
                client.sendEvent(event + "_error", response);
            }
        } catch (Exception e) {
            logger.error("Failed to reply to {} from client: {}", event, client.getSessionId(), e);
        }
    }

    private Map<String, Object> invoke(Supplier<Ack> operation) {
        try {
            return codec.ackReply(operation.get());
        } catch (SessionException e) {
            logger.debug("Session operation failed: {} {}", e.kind(), e.getMessage());
            return codec.errorReply(e);
        }
    }
}
