package duotalk.testutil;

import duotalk.transport.ClientChannel;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Client channel that records every event sent to it.
 */
public class RecordingChannel implements ClientChannel {

    public record SentEvent(String name, List<Object> args) {
    }

    private final String id;
    private final List<SentEvent> events = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public RecordingChannel(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String event, Object... args) {
        if (failing) {
            throw new IllegalStateException("channel " + id + " is broken");
        }
        events.add(new SentEvent(event, Collections.unmodifiableList(Arrays.asList(args.clone()))));
    }

    public void failOnSend() {
        failing = true;
    }

    public List<SentEvent> events() {
        return List.copyOf(events);
    }

    public List<SentEvent> eventsNamed(String name) {
        return events.stream()
                .filter(e -> e.name().equals(name))
                .collect(Collectors.toList());
    }

    public List<String> eventNames() {
        return events.stream().map(SentEvent::name).collect(Collectors.toList());
    }
}
