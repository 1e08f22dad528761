package duotalk.session;

/**
 * Lifecycle of a client connection.
 */
public enum SessionState {
    /** Connected but not in any room. */
    CONNECTED,
    /** Admitted to a room; signaling and transcription active. */
    ADMITTED,
    /** Terminal. */
    DISCONNECTED
}
