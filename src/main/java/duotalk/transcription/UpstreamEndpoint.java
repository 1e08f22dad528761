package duotalk.transcription;

import duotalk.config.RelayConfig;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * Address and credentials of the streaming transcription service.
 * Audio parameters are fixed; the client must record with the same settings.
 */
public final class UpstreamEndpoint {
    public static final String ENCODING = "ogg-opus";
    public static final int SAMPLE_RATE = 16000;
    public static final boolean PUNCTUATE = true;

    private final String baseUrl;
    private final String apiKey;

    public UpstreamEndpoint(String baseUrl, String apiKey) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl cannot be null");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey cannot be null");
    }

    public static UpstreamEndpoint from(RelayConfig config) {
        return new UpstreamEndpoint(config.upstreamUrl(), config.apiKey());
    }

    public URI uri() {
        String separator = baseUrl.contains("?") ? "&" : "?";
        return URI.create(baseUrl + separator
                + "encoding=" + ENCODING
                + "&sample_rate=" + SAMPLE_RATE
                + "&punctuate=" + PUNCTUATE);
    }

    public Map<String, String> headers() {
        return Map.of("Authorization", "Token " + apiKey);
    }

    @Override
    public String toString() {
        return "UpstreamEndpoint{" + uri() + "}";
    }
}
