package duotalk.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serial task queue for one connection, drained on a shared executor.
 * <p>
 * Tasks run one at a time in submission order. A failing task is logged and
 * does not stop the tasks queued behind it.
 */
public class SessionInbox implements Executor {
    private static final Logger logger = LoggerFactory.getLogger(SessionInbox.class);

    private final String name;
    private final Executor executor;
    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    public SessionInbox(String name, Executor executor) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    @Override
    public void execute(Runnable task) {
        tasks.add(Objects.requireNonNull(task, "task cannot be null"));
        schedule();
    }

    /**
     * Number of tasks waiting to run.
     */
    public int pending() {
        return tasks.size();
    }

    private void schedule() {
        if (draining.compareAndSet(false, true)) {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                logger.debug("Executor rejected inbox {}, discarding {} task(s)", name, tasks.size());
                tasks.clear();
            }
        }
    }

    private void drain() {
        try {
            Runnable task;
            while ((task = tasks.poll()) != null) {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    logger.error("Task failed in inbox {}", name, e);
                }
            }
        } finally {
            draining.set(false);
            if (!tasks.isEmpty()) {
                schedule();
            }
        }
    }
}
