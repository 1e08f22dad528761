package duotalk.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Currently connected clients, by connection id.
 */
public class ConnectionDirectory {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionDirectory.class);

    private final Map<String, ClientChannel> channels = new ConcurrentHashMap<>();

    public void register(ClientChannel channel) {
        Objects.requireNonNull(channel, "channel cannot be null");
        channels.put(channel.id(), channel);
        logger.debug("Registered connection {} ({} connected)", channel.id(), channels.size());
    }

    public void unregister(String connectionId) {
        if (connectionId != null && channels.remove(connectionId) != null) {
            logger.debug("Unregistered connection {} ({} connected)", connectionId, channels.size());
        }
    }

    public Optional<ClientChannel> find(String connectionId) {
        if (connectionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(channels.get(connectionId));
    }

    public int size() {
        return channels.size();
    }
}
