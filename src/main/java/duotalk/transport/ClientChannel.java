package duotalk.transport;

/**
 * Outbound side of one client connection.
 * Implementations deliver named events with positional arguments to the client.
 */
public interface ClientChannel {
    /**
     * Server-assigned connection identifier, unique for the connection's lifetime.
     */
    String id();

    /**
     * Deliver an event to the client.
     *
     * @param event the event name
     * @param args  event arguments, passed through as-is
     * @throws RuntimeException if delivery fails
     */
    void send(String event, Object... args);
}
