package duotalk.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class SessionInboxTest {

    @Test
    @DisplayName("Should run tasks in submission order")
    void testOrder() {
        List<Integer> seen = new ArrayList<>();
        SessionInbox inbox = new SessionInbox("test", Runnable::run);

        for (int i = 0; i < 5; i++) {
            int n = i;
            inbox.execute(() -> seen.add(n));
        }

        assertThat(seen).containsExactly(0, 1, 2, 3, 4);
        assertThat(inbox.pending()).isZero();
    }

    @Test
    @DisplayName("Should run a task submitted from a running task after the current one")
    void testNestedSubmission() {
        List<String> seen = new ArrayList<>();
        SessionInbox inbox = new SessionInbox("test", Runnable::run);

        inbox.execute(() -> {
            seen.add("outer-start");
            inbox.execute(() -> seen.add("inner"));
            seen.add("outer-end");
        });

        assertThat(seen).containsExactly("outer-start", "outer-end", "inner");
    }

    @Test
    @DisplayName("Should keep running after a task throws")
    void testFailingTask() {
        List<String> seen = new ArrayList<>();
        SessionInbox inbox = new SessionInbox("test", Runnable::run);

        inbox.execute(() -> {
            throw new IllegalStateException("boom");
        });
        inbox.execute(() -> seen.add("after"));

        assertThat(seen).containsExactly("after");
    }

    @Test
    @DisplayName("Should preserve order and never run two tasks at once on a thread pool")
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testSerialOnPool() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            SessionInbox inbox = new SessionInbox("test", pool);
            List<Integer> seen = new CopyOnWriteArrayList<>();
            AtomicInteger active = new AtomicInteger();
            AtomicInteger maxActive = new AtomicInteger();
            CountDownLatch done = new CountDownLatch(1000);

            for (int i = 0; i < 1000; i++) {
                int n = i;
                inbox.execute(() -> {
                    maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                    seen.add(n);
                    active.decrementAndGet();
                    done.countDown();
                });
            }

            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(maxActive.get()).isEqualTo(1);
            for (int i = 0; i < 1000; i++) {
                assertThat(seen.get(i)).isEqualTo(i);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should discard tasks when the executor is shut down")
    void testRejectedExecutor() {
        SessionInbox inbox = new SessionInbox("test", task -> {
            throw new RejectedExecutionException("shut down");
        });

        assertThatCode(() -> inbox.execute(() -> fail("should not run")))
                .doesNotThrowAnyException();
        assertThat(inbox.pending()).isZero();
    }
}
