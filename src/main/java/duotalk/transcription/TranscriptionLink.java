package duotalk.transcription;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One streaming session to the external speech-recognition service, owned by
 * a single client connection.
 * <p>
 * Audio is forwarded only while the link is {@link LinkState#OPEN}; frames
 * sent in any other state are discarded, never queued.
 */
public interface TranscriptionLink {

    /**
     * Start connecting to the upstream service. Subsequent calls do nothing.
     */
    void open();

    /**
     * Forward one audio frame if the link is open, drop it otherwise.
     *
     * @param frame raw audio bytes
     */
    void sendAudio(byte[] frame);

    /**
     * End the stream and close the upstream connection. Idempotent.
     */
    void close();

    LinkState state();

    /**
     * Id of the connection this link transcribes.
     */
    String connectionId();

    /**
     * Set the listener notified of link events.
     * @param listener the link listener
     */
    void setListener(Listener listener);

    /**
     * Callbacks from a link. Invoked on the link's I/O thread.
     */
    interface Listener {
        /**
         * The upstream accepted the stream; audio may now be captured. Called at most once.
         */
        void onOpen(String connectionId);

        /**
         * One decoded message from the upstream service.
         */
        void onTranscript(String connectionId, JsonNode result);

        /**
         * The link reached {@link LinkState#CLOSED}, whichever side closed it.
         */
        void onClosed(String connectionId);
    }
}
