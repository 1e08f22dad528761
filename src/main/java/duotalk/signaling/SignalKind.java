package duotalk.signaling;

/**
 * Negotiation messages relayed between peers. The same event name is used
 * in both directions.
 */
public enum SignalKind {
    VIDEO_OFFER("video-offer"),
    VIDEO_ANSWER("video-answer"),
    ICE_CANDIDATE("ice-candidate");

    private final String eventName;

    SignalKind(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
