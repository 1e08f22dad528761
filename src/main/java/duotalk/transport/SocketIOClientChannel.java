package duotalk.transport;

import com.corundumstudio.socketio.SocketIOClient;

import java.util.Objects;

/**
 * {@link ClientChannel} backed by a netty-socketio client.
 */
public class SocketIOClientChannel implements ClientChannel {

    private final SocketIOClient client;
    private final String id;

    public SocketIOClientChannel(SocketIOClient client) {
        this.client = Objects.requireNonNull(client, "client cannot be null");
        this.id = client.getSessionId().toString();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String event, Object... args) {
        client.sendEvent(event, args);
    }

    @Override
    public String toString() {
        return "SocketIOClientChannel{" + id + "}";
    }
}
