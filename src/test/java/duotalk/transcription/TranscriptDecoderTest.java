package duotalk.transcription;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class TranscriptDecoderTest {

    private TranscriptDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new TranscriptDecoder();
    }

    @Test
    @DisplayName("Should decode a transcript document without interpreting it")
    void testDecode() {
        String json = """
            {
                "channel_index": [0, 1],
                "duration": 1.02,
                "is_final": true,
                "channel": {
                    "alternatives": [
                        {"transcript": "Hello there.", "confidence": 0.98}
                    ]
                }
            }
            """;

        JsonNode node = decoder.decode(json);

        assertThat(node.at("/channel/alternatives/0/transcript").asText()).isEqualTo("Hello there.");
        assertThat(node.get("duration").asDouble()).isEqualTo(1.02);
        assertThat(node.get("channel_index")).hasSize(2);
    }

    @Test
    @DisplayName("Should keep fields it does not know about")
    void testUnknownFields() {
        JsonNode node = decoder.decode("{\"type\":\"Metadata\",\"request_id\":\"abc\"}");

        assertThat(node.get("type").asText()).isEqualTo("Metadata");
        assertThat(node.get("request_id").asText()).isEqualTo("abc");
    }

    @Test
    @DisplayName("Should decode UTF-8 binary messages")
    void testDecodeBinary() {
        ByteBuffer buffer = ByteBuffer.wrap("{\"transcript\":\"café\"}".getBytes(StandardCharsets.UTF_8));

        JsonNode node = decoder.decode(buffer);

        assertThat(node.get("transcript").asText()).isEqualTo("café");
        assertThat(buffer.remaining()).isPositive();
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void testMalformed() {
        assertThatThrownBy(() -> decoder.decode("{\"transcript\": "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Malformed upstream message");
    }

    @Test
    @DisplayName("Should reject more than one document in a message")
    void testTrailingDocument() {
        assertThatThrownBy(() -> decoder.decode("{\"a\":1} {\"b\":2}"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject empty messages")
    void testEmpty() {
        assertThatThrownBy(() -> decoder.decode(""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Empty upstream message");
        assertThatThrownBy(() -> decoder.decode((String) null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
