package duotalk.transcription;

import duotalk.config.RelayConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class UpstreamEndpointTest {

    @Test
    @DisplayName("Should append the fixed audio parameters to the base address")
    void testUri() {
        UpstreamEndpoint endpoint = new UpstreamEndpoint("wss://api.deepgram.com/v1/listen", "secret");

        URI uri = endpoint.uri();

        assertThat(uri.getScheme()).isEqualTo("wss");
        assertThat(uri.getHost()).isEqualTo("api.deepgram.com");
        assertThat(uri.getPath()).isEqualTo("/v1/listen");
        assertThat(uri.getQuery()).isEqualTo("encoding=ogg-opus&sample_rate=16000&punctuate=true");
    }

    @Test
    @DisplayName("Should extend an existing query string")
    void testUriWithQuery() {
        UpstreamEndpoint endpoint = new UpstreamEndpoint("wss://example.test/listen?model=general", "secret");

        assertThat(endpoint.uri().getQuery())
                .isEqualTo("model=general&encoding=ogg-opus&sample_rate=16000&punctuate=true");
    }

    @Test
    @DisplayName("Should carry the credential in the authorization header")
    void testHeaders() {
        UpstreamEndpoint endpoint = new UpstreamEndpoint("wss://example.test/listen", "secret");

        assertThat(endpoint.headers()).isEqualTo(Map.of("Authorization", "Token secret"));
    }

    @Test
    @DisplayName("Should not print the credential")
    void testToStringHidesKey() {
        UpstreamEndpoint endpoint = new UpstreamEndpoint("wss://example.test/listen", "secret");

        assertThat(endpoint.toString()).doesNotContain("secret");
    }

    @Test
    @DisplayName("Should build from the relay configuration")
    void testFromConfig() {
        RelayConfig config = new RelayConfig("0.0.0.0", 3000, "key", "wss://example.test/stream");

        UpstreamEndpoint endpoint = UpstreamEndpoint.from(config);

        assertThat(endpoint.uri().toString()).startsWith("wss://example.test/stream?");
        assertThat(endpoint.headers()).containsEntry("Authorization", "Token key");
    }
}
