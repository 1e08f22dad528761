package duotalk.transcription;

/**
 * Lifecycle of an upstream transcription link.
 */
public enum LinkState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED
}
