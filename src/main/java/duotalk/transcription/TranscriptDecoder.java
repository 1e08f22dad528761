package duotalk.transcription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Decodes the envelope of upstream messages: exactly one JSON document per
 * message. The document itself is passed on untouched.
 */
public class TranscriptDecoder {
    private final ObjectMapper objectMapper;

    public TranscriptDecoder() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    }

    /**
     * Decode one text message.
     *
     * @param message the raw message
     * @return the parsed document
     * @throws IllegalArgumentException if the message is empty or not a single JSON document
     */
    public JsonNode decode(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Empty upstream message");
        }
        try {
            JsonNode node = objectMapper.readTree(message);
            if (node == null || node.isMissingNode()) {
                throw new IllegalArgumentException("Empty upstream message");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed upstream message: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decode a binary message holding UTF-8 JSON.
     */
    public JsonNode decode(ByteBuffer message) {
        ByteBuffer copy = message.duplicate();
        byte[] bytes = new byte[copy.remaining()];
        copy.get(bytes);
        return decode(new String(bytes, StandardCharsets.UTF_8));
    }
}
