package duotalk.session;

import com.fasterxml.jackson.databind.JsonNode;
import duotalk.core.RelayStatistics;
import duotalk.room.JoinResult;
import duotalk.room.RoomRegistry;
import duotalk.signaling.SignalKind;
import duotalk.signaling.SignalingRelay;
import duotalk.transcription.TranscriptionLink;
import duotalk.transcription.TranscriptionLinkFactory;
import duotalk.transport.ClientChannel;
import duotalk.transport.ClientEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Lifecycle of one client connection: admission, signaling, transcription and teardown.
 * <p>
 * Public methods only enqueue work on the session's inbox; all state is read and
 * written by inbox tasks, one at a time. Link callbacks are routed through the
 * same inbox, so audio and transcript ordering follow arrival order.
 */
public class ConnectionSession {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionSession.class);

    private final ClientChannel channel;
    private final RoomRegistry rooms;
    private final SignalingRelay relay;
    private final TranscriptionLinkFactory linkFactory;
    private final RelayStatistics statistics;
    private final Executor inbox;

    // Confined to the inbox; volatile only for observation from other threads
    private volatile SessionState state = SessionState.CONNECTED;
    private volatile String roomId;
    private volatile TranscriptionLink link;
    private boolean micSignalled;

    public ConnectionSession(ClientChannel channel,
                             RoomRegistry rooms,
                             SignalingRelay relay,
                             TranscriptionLinkFactory linkFactory,
                             RelayStatistics statistics,
                             Executor inbox) {
        this.channel = Objects.requireNonNull(channel, "channel cannot be null");
        this.rooms = Objects.requireNonNull(rooms, "rooms cannot be null");
        this.relay = Objects.requireNonNull(relay, "relay cannot be null");
        this.linkFactory = Objects.requireNonNull(linkFactory, "linkFactory cannot be null");
        this.statistics = Objects.requireNonNull(statistics, "statistics cannot be null");
        this.inbox = Objects.requireNonNull(inbox, "inbox cannot be null");
    }

    public String id() {
        return channel.id();
    }

    public SessionState state() {
        return state;
    }

    /**
     * Room this connection was admitted to, or null.
     */
    public String roomId() {
        return roomId;
    }

    /**
     * Transcription link of this connection, or null before admission.
     */
    public TranscriptionLink link() {
        return link;
    }

    public void join(String requestedRoom) {
        inbox.execute(() -> handleJoin(requestedRoom));
    }

    public void audio(byte[] frame) {
        inbox.execute(() -> handleAudio(frame));
    }

    public void signal(SignalKind kind, String targetId, Object payload) {
        inbox.execute(() -> handleSignal(kind, targetId, payload));
    }

    public void disconnect() {
        inbox.execute(this::handleDisconnect);
    }

    private void handleJoin(String requestedRoom) {
        if (state != SessionState.CONNECTED) {
            logger.warn("Ignoring join to {} from {}: session is {}", requestedRoom, id(), state);
            return;
        }
        if (requestedRoom == null || requestedRoom.isBlank()) {
            logger.warn("Ignoring join without a room id from {}", id());
            return;
        }

        JoinResult result = rooms.join(requestedRoom, id());
        if (!result.isAdmitted()) {
            statistics.recordRejection();
            channel.send(ClientEvents.FULL, requestedRoom);
            return;
        }

        roomId = requestedRoom;
        state = SessionState.ADMITTED;
        statistics.recordAdmission();
        rooms.notifyPeers(requestedRoom, id(), ClientEvents.USER_JOINED);

        TranscriptionLink created = linkFactory.create(id());
        created.setListener(new LinkEvents());
        link = created;
        created.open();
    }

    private void handleAudio(byte[] frame) {
        if (state != SessionState.ADMITTED) {
            logger.trace("Dropping audio from {}: session is {}", id(), state);
            return;
        }
        link.sendAudio(frame);
    }

    private void handleSignal(SignalKind kind, String targetId, Object payload) {
        if (state != SessionState.ADMITTED) {
            logger.debug("Dropping {} from {}: session is {}", kind.eventName(), id(), state);
            return;
        }
        statistics.recordSignal(relay.relay(kind, id(), targetId, payload));
    }

    private void handleDisconnect() {
        if (state == SessionState.DISCONNECTED) {
            return;
        }
        SessionState previous = state;
        state = SessionState.DISCONNECTED;

        if (previous == SessionState.ADMITTED) {
            rooms.notifyPeers(roomId, id(), ClientEvents.BYE);
            rooms.leave(roomId, id());
            if (link != null) {
                link.close();
            }
        }
        logger.info("Connection {} disconnected", id());
    }

    private void handleLinkOpen() {
        if (state != SessionState.ADMITTED || micSignalled) {
            return;
        }
        micSignalled = true;
        channel.send(ClientEvents.CAN_OPEN_MIC);
    }

    private void handleTranscript(JsonNode result) {
        if (state != SessionState.ADMITTED) {
            logger.debug("Discarding transcript for {}: session is {}", id(), state);
            return;
        }
        rooms.broadcastToRoom(roomId, null, ClientEvents.TRANSCRIPT_RESULT, id(), result);
        statistics.recordTranscriptBroadcast();
    }

    private void handleLinkClosed() {
        if (state == SessionState.ADMITTED) {
            logger.info("Transcription stopped for {}, no further results for this connection", id());
        }
    }

    private final class LinkEvents implements TranscriptionLink.Listener {
        @Override
        public void onOpen(String connectionId) {
            inbox.execute(ConnectionSession.this::handleLinkOpen);
        }

        @Override
        public void onTranscript(String connectionId, JsonNode result) {
            inbox.execute(() -> handleTranscript(result));
        }

        @Override
        public void onClosed(String connectionId) {
            inbox.execute(ConnectionSession.this::handleLinkClosed);
        }
    }
}
