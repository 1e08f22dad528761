package duotalk.signaling;

import duotalk.testutil.RecordingChannel;
import duotalk.transport.ConnectionDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SignalingRelayTest {

    private ConnectionDirectory directory;
    private SignalingRelay relay;
    private RecordingChannel alice;
    private RecordingChannel bob;

    @BeforeEach
    void setUp() {
        directory = new ConnectionDirectory();
        relay = new SignalingRelay(directory);
        alice = new RecordingChannel("A");
        bob = new RecordingChannel("B");
        directory.register(alice);
        directory.register(bob);
    }

    @Test
    @DisplayName("Should forward the payload verbatim with the sender id")
    void testForwardOffer() {
        Map<String, Object> payload = Map.of("type", "offer", "sdp", "v=0");

        boolean delivered = relay.relay(SignalKind.VIDEO_OFFER, "A", "B", payload);

        assertThat(delivered).isTrue();
        assertThat(bob.events()).hasSize(1);
        RecordingChannel.SentEvent event = bob.events().get(0);
        assertThat(event.name()).isEqualTo("video-offer");
        assertThat(event.args().get(0)).isEqualTo("A");
        assertThat(event.args().get(1)).isSameAs(payload);
        assertThat(alice.events()).isEmpty();
    }

    @Test
    @DisplayName("Should use the message kind as the outgoing event name")
    void testEventNames() {
        relay.relay(SignalKind.VIDEO_ANSWER, "B", "A", "answer");
        relay.relay(SignalKind.ICE_CANDIDATE, "B", "A", "candidate");

        assertThat(alice.eventNames()).containsExactly("video-answer", "ice-candidate");
    }

    @Test
    @DisplayName("Should silently drop a message for an unknown target")
    void testUnknownTarget() {
        boolean delivered = relay.relay(SignalKind.VIDEO_OFFER, "A", "nobody", "payload");

        assertThat(delivered).isFalse();
        assertThat(alice.events()).isEmpty();
        assertThat(bob.events()).isEmpty();
    }

    @Test
    @DisplayName("Should drop a message without a target")
    void testNullTarget() {
        assertThatCode(() -> relay.relay(SignalKind.ICE_CANDIDATE, "A", null, "payload"))
                .doesNotThrowAnyException();
        assertThat(relay.relay(SignalKind.ICE_CANDIDATE, "A", null, "payload")).isFalse();
    }

    @Test
    @DisplayName("Should drop a message for a target that disconnected")
    void testDisconnectedTarget() {
        directory.unregister("B");

        assertThat(relay.relay(SignalKind.VIDEO_OFFER, "A", "B", "payload")).isFalse();
        assertThat(bob.events()).isEmpty();
    }

    @Test
    @DisplayName("Should not throw when the target channel fails")
    void testFailingTarget() {
        bob.failOnSend();

        assertThatCode(() -> assertThat(relay.relay(SignalKind.VIDEO_OFFER, "A", "B", "payload")).isFalse())
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should pass null payloads through")
    void testNullPayload() {
        assertThat(relay.relay(SignalKind.ICE_CANDIDATE, "A", "B", null)).isTrue();
        assertThat(bob.events().get(0).args()).containsExactly("A", null);
    }
}
