package duotalk.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide counters for the relay. Safe to update from any thread.
 */
public class RelayStatistics {
    private volatile long startTime;
    private volatile long stopTime;
    private volatile long startNano;

    private final AtomicLong connectionsOpened = new AtomicLong();
    private final AtomicLong connectionsClosed = new AtomicLong();
    private final AtomicLong admissions = new AtomicLong();
    private final AtomicLong rejections = new AtomicLong();
    private final AtomicLong signalsRelayed = new AtomicLong();
    private final AtomicLong signalsDropped = new AtomicLong();
    private final AtomicLong transcriptsBroadcast = new AtomicLong();

    public void recordStart() {
        startTime = System.currentTimeMillis();
        startNano = System.nanoTime();
        stopTime = 0;
    }

    public void recordStop() {
        stopTime = System.currentTimeMillis();
    }

    public void recordConnectionOpened() {
        connectionsOpened.incrementAndGet();
    }

    public void recordConnectionClosed() {
        connectionsClosed.incrementAndGet();
    }

    public void recordAdmission() {
        admissions.incrementAndGet();
    }

    public void recordRejection() {
        rejections.incrementAndGet();
    }

    public void recordSignal(boolean delivered) {
        if (delivered) {
            signalsRelayed.incrementAndGet();
        } else {
            signalsDropped.incrementAndGet();
        }
    }

    public void recordTranscriptBroadcast() {
        transcriptsBroadcast.incrementAndGet();
    }

    public long getUptime() {
        if (startTime == 0) return 0;
        if (stopTime > 0) {
            return stopTime - startTime;
        }
        long elapsedMs = (System.nanoTime() - startNano) / 1_000_000L;
        return elapsedMs > 0 ? elapsedMs : 1L;
    }

    public long getConnectionsOpened() {
        return connectionsOpened.get();
    }

    public long getConnectionsClosed() {
        return connectionsClosed.get();
    }

    public long getAdmissions() {
        return admissions.get();
    }

    public long getRejections() {
        return rejections.get();
    }

    public long getSignalsRelayed() {
        return signalsRelayed.get();
    }

    public long getSignalsDropped() {
        return signalsDropped.get();
    }

    public long getTranscriptsBroadcast() {
        return transcriptsBroadcast.get();
    }

    @Override
    public String toString() {
        return String.format("RelayStatistics{uptime=%dms, connections=%d/%d, admissions=%d, " +
                        "rejections=%d, signals=%d relayed/%d dropped, transcripts=%d}",
                getUptime(), connectionsOpened.get(), connectionsClosed.get(), admissions.get(),
                rejections.get(), signalsRelayed.get(), signalsDropped.get(), transcriptsBroadcast.get());
    }
}
