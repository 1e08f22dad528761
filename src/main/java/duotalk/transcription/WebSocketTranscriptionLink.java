package duotalk.transcription;

import com.fasterxml.jackson.databind.JsonNode;
import org.java_websocket.WebSocket;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.drafts.Draft_6455;
import org.java_websocket.exceptions.InvalidDataException;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.handshake.ServerHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link TranscriptionLink} over a Java-WebSocket client connection.
 * <p>
 * State transitions and audio sends share one lock, so frames reach the
 * upstream in call order and nothing is sent after the end-of-stream marker.
 * Closing while the handshake is still in flight aborts the attempt, so an
 * upstream that accepts the connection but never answers cannot hold the link.
 */
public class WebSocketTranscriptionLink implements TranscriptionLink {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketTranscriptionLink.class);

    static final int CONNECT_TIMEOUT_MS = 10_000;
    private static final byte[] END_OF_STREAM = new byte[0];

    private final String connectionId;
    private final UpstreamEndpoint endpoint;
    private final TranscriptDecoder decoder;
    private final UpstreamClient client;
    private final Object stateLock = new Object();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong framesForwarded = new AtomicLong();
    private final AtomicLong framesDropped = new AtomicLong();

    private volatile LinkState state = LinkState.CONNECTING;
    private volatile Listener listener;

    public WebSocketTranscriptionLink(String connectionId, UpstreamEndpoint endpoint, TranscriptDecoder decoder) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId cannot be null");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint cannot be null");
        this.decoder = Objects.requireNonNull(decoder, "decoder cannot be null");
        this.client = new UpstreamClient(endpoint);
    }

    /**
     * Factory producing links against the given endpoint.
     */
    public static TranscriptionLinkFactory factory(UpstreamEndpoint endpoint) {
        TranscriptDecoder decoder = new TranscriptDecoder();
        return connectionId -> new WebSocketTranscriptionLink(connectionId, endpoint, decoder);
    }

    @Override
    public void open() {
        synchronized (stateLock) {
            if (state != LinkState.CONNECTING || !started.compareAndSet(false, true)) {
                return;
            }
        }
        logger.info("Opening transcription link for {} to {}", connectionId, endpoint);
        client.connect();
    }

    @Override
    public void sendAudio(byte[] frame) {
        if (frame == null) {
            return;
        }
        synchronized (stateLock) {
            if (state != LinkState.OPEN) {
                framesDropped.incrementAndGet();
                logger.trace("Dropping {} byte frame for {}: link is {}", frame.length, connectionId, state);
                return;
            }
            try {
                client.send(frame);
                framesForwarded.incrementAndGet();
            } catch (WebsocketNotConnectedException e) {
                framesDropped.incrementAndGet();
                logger.debug("Upstream socket for {} is gone, dropping frame", connectionId);
            }
        }
    }

    @Override
    public void close() {
        boolean closeSocket = false;
        boolean abortHandshake = false;
        boolean closedNow = false;
        synchronized (stateLock) {
            switch (state) {
                case OPEN:
                    try {
                        client.send(END_OF_STREAM);
                    } catch (WebsocketNotConnectedException e) {
                        logger.debug("Upstream socket for {} already gone, skipping end-of-stream", connectionId);
                    }
                    state = LinkState.CLOSING;
                    closeSocket = true;
                    break;
                case CONNECTING:
                    if (started.get()) {
                        state = LinkState.CLOSING;
                        abortHandshake = true;
                    } else {
                        state = LinkState.CLOSED;
                        closedNow = true;
                    }
                    break;
                default:
                    return;
            }
        }
        logger.info("Closing transcription link for {} ({} frames forwarded, {} dropped)",
                connectionId, framesForwarded.get(), framesDropped.get());
        if (closeSocket) {
            client.close();
        }
        if (abortHandshake) {
            logger.debug("Link for {} still connecting, aborting handshake", connectionId);
            client.closeConnection(CloseFrame.NEVER_CONNECTED, "Closed before handshake completed");
        }
        if (closedNow) {
            notifyClosed();
        }
    }

    @Override
    public LinkState state() {
        return state;
    }

    @Override
    public String connectionId() {
        return connectionId;
    }

    @Override
    public void setListener(Listener listener) {
        this.listener = listener;
    }

    public long framesForwarded() {
        return framesForwarded.get();
    }

    public long framesDropped() {
        return framesDropped.get();
    }

    private void onUpstreamOpen() {
        boolean opened = false;
        synchronized (stateLock) {
            if (state == LinkState.CONNECTING) {
                state = LinkState.OPEN;
                opened = true;
            }
        }
        if (!opened) {
            logger.debug("Upstream for {} opened after close was requested, closing", connectionId);
            client.close();
            return;
        }
        logger.info("Transcription link for {} is open", connectionId);
        Listener current = listener;
        if (current != null) {
            try {
                current.onOpen(connectionId);
            } catch (RuntimeException e) {
                logger.warn("Link listener failed on open for {}", connectionId, e);
            }
        }
    }

    private void onUpstreamMessage(JsonNode result) {
        Listener current = listener;
        if (current != null) {
            try {
                current.onTranscript(connectionId, result);
            } catch (RuntimeException e) {
                logger.warn("Link listener failed on transcript for {}", connectionId, e);
            }
        }
    }

    private void onUpstreamClose(int code, String reason, boolean remote) {
        LinkState previous;
        synchronized (stateLock) {
            previous = state;
            state = LinkState.CLOSED;
        }
        if (previous == LinkState.CLOSED) {
            return;
        }
        if (remote && previous == LinkState.OPEN) {
            logger.warn("Upstream closed transcription stream for {}: {} {}", connectionId, code, reason);
        } else if (previous == LinkState.CONNECTING) {
            logger.warn("Could not open transcription link for {}: {} {}", connectionId, code, reason);
        } else {
            logger.info("Transcription link for {} closed", connectionId);
        }
        notifyClosed();
    }

    private void notifyClosed() {
        Listener current = listener;
        if (current != null) {
            try {
                current.onClosed(connectionId);
            } catch (RuntimeException e) {
                logger.warn("Link listener failed on close for {}", connectionId, e);
            }
        }
    }

    private final class UpstreamClient extends WebSocketClient {

        UpstreamClient(UpstreamEndpoint endpoint) {
            super(endpoint.uri(), new Draft_6455(), endpoint.headers(), CONNECT_TIMEOUT_MS);
        }

        /**
         * An abort can land before the socket exists; drop the socket here so
         * the reader and writer threads exit instead of waiting on a dead attempt.
         */
        @Override
        public void onWebsocketHandshakeSentAsClient(WebSocket conn, ClientHandshake request)
                throws InvalidDataException {
            super.onWebsocketHandshakeSentAsClient(conn, request);
            if (state == LinkState.CONNECTING) {
                return;
            }
            Socket socket = getSocket();
            if (socket != null) {
                try {
                    socket.close();
                } catch (IOException e) {
                    logger.debug("Failed to close abandoned upstream socket for {}", connectionId, e);
                }
            }
        }

        @Override
        public void onOpen(ServerHandshake handshake) {
            onUpstreamOpen();
        }

        @Override
        public void onMessage(String message) {
            try {
                onUpstreamMessage(decoder.decode(message));
            } catch (IllegalArgumentException e) {
                logger.warn("Dropping upstream message for {}: {}", connectionId, e.getMessage());
            } catch (RuntimeException e) {
                logger.warn("Failed to handle upstream message for {}", connectionId, e);
            }
        }

        @Override
        public void onMessage(ByteBuffer bytes) {
            try {
                onUpstreamMessage(decoder.decode(bytes));
            } catch (IllegalArgumentException e) {
                logger.warn("Dropping binary upstream message for {}: {}", connectionId, e.getMessage());
            } catch (RuntimeException e) {
                logger.warn("Failed to handle binary upstream message for {}", connectionId, e);
            }
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
            onUpstreamClose(code, reason, remote);
        }

        @Override
        public void onError(Exception ex) {
            logger.warn("Transcription link error for {}", connectionId, ex);
        }
    }
}
