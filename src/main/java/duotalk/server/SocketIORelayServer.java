package duotalk.server;

import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.MultiTypeArgs;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import duotalk.config.RelayConfig;
import duotalk.core.RelayStatistics;
import duotalk.room.RoomRegistry;
import duotalk.session.ConnectionSession;
import duotalk.session.SessionInbox;
import duotalk.signaling.SignalKind;
import duotalk.signaling.SignalingRelay;
import duotalk.transcription.TranscriptionLinkFactory;
import duotalk.transcription.UpstreamEndpoint;
import duotalk.transcription.WebSocketTranscriptionLink;
import duotalk.transport.ClientChannel;
import duotalk.transport.ClientEvents;
import duotalk.transport.ConnectionDirectory;
import duotalk.transport.SocketIOClientChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Socket.IO server that browsers connect to.
 * Maps client events onto one {@link ConnectionSession} per connection.
 */
public class SocketIORelayServer {
    private static final Logger logger = LoggerFactory.getLogger(SocketIORelayServer.class);

    private static final int MAX_FRAME_BYTES = 1048576;

    private final RelayConfig config;
    private final TranscriptionLinkFactory linkFactory;
    private final RelayStatistics statistics;
    private final ConnectionDirectory directory = new ConnectionDirectory();
    private final RoomRegistry rooms = new RoomRegistry(directory);
    private final SignalingRelay relay = new SignalingRelay(directory);
    private final Map<String, ConnectionSession> sessions = new ConcurrentHashMap<>();
    private final Executor sessionExecutor;
    private final ExecutorService ownedExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private SocketIOServer server;

    /**
     * Create a server streaming audio to the configured upstream service.
     *
     * @param config     process configuration
     * @param statistics counters to update
     */
    public SocketIORelayServer(RelayConfig config, RelayStatistics statistics) {
        this(config, WebSocketTranscriptionLink.factory(UpstreamEndpoint.from(config)), statistics,
                newSessionExecutor());
    }

    SocketIORelayServer(RelayConfig config,
                        TranscriptionLinkFactory linkFactory,
                        RelayStatistics statistics,
                        Executor sessionExecutor) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.linkFactory = Objects.requireNonNull(linkFactory, "linkFactory cannot be null");
        this.statistics = Objects.requireNonNull(statistics, "statistics cannot be null");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor cannot be null");
        this.ownedExecutor = sessionExecutor instanceof ExecutorService ? (ExecutorService) sessionExecutor : null;
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            try {
                startServer();
                logger.info("Socket.IO server started on {}:{}", config.host(), config.port());
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
            sessions.values().forEach(ConnectionSession::disconnect);
            sessions.clear();
            if (ownedExecutor != null) {
                ownedExecutor.shutdown();
                try {
                    if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                        ownedExecutor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    ownedExecutor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
            logger.info("Socket.IO server stopped");
        }
    }

    public boolean isRunning() {
        return running.get() && server != null;
    }

    public int getConnectedClients() {
        return sessions.size();
    }

    RoomRegistry rooms() {
        return rooms;
    }

    ConnectionSession session(String connectionId) {
        return sessions.get(connectionId);
    }

    private void startServer() {
        Configuration socketConfig = new Configuration();
        socketConfig.setHostname(config.host());
        socketConfig.setPort(config.port());
        socketConfig.setOrigin("*");

        // Audio chunks arrive as binary attachments
        socketConfig.setMaxFramePayloadLength(MAX_FRAME_BYTES);
        socketConfig.setMaxHttpContentLength(MAX_FRAME_BYTES);

        socketConfig.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        socketConfig.setUpgradeTimeout(10000);
        socketConfig.setPingTimeout(60000);
        socketConfig.setPingInterval(25000);

        server = new SocketIOServer(socketConfig);

        server.addConnectListener(this::handleConnect);
        server.addDisconnectListener(this::handleDisconnect);

        server.addEventListener(ClientEvents.JOIN, String.class,
                (client, room, ackRequest) -> handleJoin(client, room));
        server.addEventListener(ClientEvents.MICROPHONE_STREAM, byte[].class,
                (client, frame, ackRequest) -> handleAudio(client, frame));

        for (SignalKind kind : SignalKind.values()) {
            server.addMultiTypeEventListener(kind.eventName(),
                    (client, args, ackRequest) -> handleSignal(kind, client, args),
                    String.class, Object.class);
        }

        server.start();
    }

    void handleConnect(SocketIOClient client) {
        ClientChannel channel = new SocketIOClientChannel(client);
        ConnectionSession session = new ConnectionSession(channel, rooms, relay, linkFactory, statistics,
                new SessionInbox(channel.id(), sessionExecutor));
        directory.register(channel);
        sessions.put(channel.id(), session);
        statistics.recordConnectionOpened();
        logger.info("Client connected: {} (Total connections: {})", channel.id(), sessions.size());
    }

    void handleDisconnect(SocketIOClient client) {
        String id = client.getSessionId().toString();
        directory.unregister(id);
        ConnectionSession session = sessions.remove(id);
        if (session == null) {
            return;
        }
        session.disconnect();
        statistics.recordConnectionClosed();
        logger.info("Client disconnected: {} (Total connections: {})", id, sessions.size());
    }

    void handleJoin(SocketIOClient client, String room) {
        ConnectionSession session = sessionOf(client);
        if (session != null) {
            session.join(room);
        }
    }

    void handleAudio(SocketIOClient client, byte[] frame) {
        ConnectionSession session = sessionOf(client);
        if (session != null) {
            session.audio(frame);
        }
    }

    void handleSignal(SignalKind kind, SocketIOClient client, MultiTypeArgs args) {
        ConnectionSession session = sessionOf(client);
        if (session == null) {
            return;
        }
        if (args == null || args.size() < 1) {
            logger.debug("Ignoring {} without a target from {}", kind.eventName(), session.id());
            return;
        }
        String targetId = args.first();
        Object payload = args.size() > 1 ? args.second() : null;
        session.signal(kind, targetId, payload);
    }

    private ConnectionSession sessionOf(SocketIOClient client) {
        ConnectionSession session = sessions.get(client.getSessionId().toString());
        if (session == null) {
            logger.debug("Event from unknown client {}", client.getSessionId());
        }
        return session;
    }

    private static ExecutorService newSessionExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors()), r -> {
            Thread t = new Thread(r, "session-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
