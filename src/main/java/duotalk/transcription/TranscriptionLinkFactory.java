package duotalk.transcription;

/**
 * Creates an unopened link for a connection.
 */
@FunctionalInterface
public interface TranscriptionLinkFactory {
    TranscriptionLink create(String connectionId);
}
