package duotalk.transport;

/**
 * Event names exchanged with browser clients.
 */
public final class ClientEvents {
    public static final String JOIN = "join";
    public static final String FULL = "full";
    public static final String USER_JOINED = "user-joined";
    public static final String BYE = "bye";
    public static final String CAN_OPEN_MIC = "can-open-mic";
    public static final String MICROPHONE_STREAM = "microphone-stream";
    public static final String TRANSCRIPT_RESULT = "transcript-result";

    private ClientEvents() {
    }
}
