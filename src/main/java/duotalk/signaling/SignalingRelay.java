package duotalk.signaling;

import duotalk.transport.ClientChannel;
import duotalk.transport.ConnectionDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Forwards peer-to-peer negotiation payloads to the addressed connection.
 * <p>
 * Payloads are opaque and passed through untouched. A message addressed to a
 * connection that is not currently connected is dropped without notifying
 * the sender.
 */
public class SignalingRelay {
    private static final Logger logger = LoggerFactory.getLogger(SignalingRelay.class);

    private final ConnectionDirectory directory;

    public SignalingRelay(ConnectionDirectory directory) {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
    }

    /**
     * Relay one negotiation message.
     *
     * @param kind     message kind
     * @param senderId connection the message came from
     * @param targetId connection the message is addressed to
     * @param payload  opaque negotiation payload
     * @return true if the message was handed to the target's channel
     */
    public boolean relay(SignalKind kind, String senderId, String targetId, Object payload) {
        Optional<ClientChannel> target = directory.find(targetId);
        if (target.isEmpty()) {
            logger.debug("Dropping {} from {}: target {} is not connected",
                    kind.eventName(), senderId, targetId);
            return false;
        }

        try {
            target.get().send(kind.eventName(), senderId, payload);
            logger.debug("Relayed {} from {} to {}", kind.eventName(), senderId, targetId);
            return true;
        } catch (Exception e) {
            logger.warn("Failed to relay {} from {} to {}", kind.eventName(), senderId, targetId, e);
            return false;
        }
    }
}
