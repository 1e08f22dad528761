package duotalk.config;

import java.util.Map;

/**
 * Process configuration for the relay server.
 *
 * @param host bind address for the Socket.IO server
 * @param port listen port
 * @param apiKey credential for the speech-recognition service
 * @param upstreamUrl base address of the streaming transcription endpoint
 */
public record RelayConfig(
        String host,
        int port,
        String apiKey,
        String upstreamUrl
) {
    public static final String API_KEY_ENV = "DG_KEY";
    public static final String HOST_ENV = "HOST";
    public static final String PORT_ENV = "PORT";
    public static final String UPSTREAM_URL_ENV = "DG_URL";

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 3000;
    public static final String DEFAULT_UPSTREAM_URL = "wss://api.deepgram.com/v1/listen";

    public RelayConfig {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("You must define " + API_KEY_ENV + " in the environment");
        }
        if (port < 0 || port > 65535) {
            throw new ConfigurationException("Port out of range: " + port);
        }
    }

    /**
     * Build the configuration from environment variables and command line arguments.
     * Arguments take precedence over the environment.
     *
     * @param env  process environment
     * @param args command line arguments:
     *             [0] - host (default: HOST or 0.0.0.0)
     *             [1] - port (default: PORT or 3000)
     * @return the resolved configuration
     * @throws ConfigurationException if the API key is absent or the port is invalid
     */
    public static RelayConfig fromEnvironment(Map<String, String> env, String[] args) {
        String host = args.length > 0 ? args[0] : env.getOrDefault(HOST_ENV, DEFAULT_HOST);
        String portValue = args.length > 1 ? args[1] : env.get(PORT_ENV);
        String upstreamUrl = env.getOrDefault(UPSTREAM_URL_ENV, DEFAULT_UPSTREAM_URL);

        return new RelayConfig(host, parsePort(portValue), env.get(API_KEY_ENV), upstreamUrl);
    }

    private static int parsePort(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_PORT;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid port: " + value, e);
        }
    }

    @Override
    public String toString() {
        return "RelayConfig{host=" + host + ", port=" + port
                + ", upstreamUrl=" + upstreamUrl + ", apiKey=****}";
    }
}
