package io.gridsync.core.scheduler;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.PriorityQueue;

/**
 * Deterministic event loop driven by the caller, on a virtual clock.
 *
 * <p>
 * Nothing runs until the caller asks: {@link #runMicrotasks()} drains the microtask queue,
 * {@link #advance(Duration)} moves the clock and runs every timer and frame task that falls due
 * (draining microtasks after each one), and {@link #runUntilIdle()} runs everything that is queued.
 * Tasks due at the same instant run in submission order.
 *
 * <p>
 * Not thread-safe: drive it from one thread. Useful wherever an embedding host owns the real loop
 * and pumps the engine itself, and in tests.
 */
public final class ManualEventLoop extends AbstractEventLoop {

    private final Deque<GuardedTask> microtasks = new ArrayDeque<>();
    private final PriorityQueue<Timed> timed = new PriorityQueue<>(
            Comparator.comparingLong(Timed::dueAt).thenComparingLong(Timed::sequence));

    private long now;
    private long sequence;

    /** Creates a loop with a 16 ms frame. */
    public ManualEventLoop() {
        this(16);
    }

    public ManualEventLoop(long frameDelayMs) {
        super(frameDelayMs);
    }

    @Override
    protected void enqueue(GuardedTask task, long delayMs) {
        if (task.phase() == TaskPhase.MICROTASK) {
            microtasks.addLast(task);
        } else {
            timed.add(new Timed(now + delayMs, sequence++, task));
        }
    }

    /** Runs queued microtasks, including ones queued while draining. */
    public void runMicrotasks() {
        GuardedTask task;
        while ((task = microtasks.pollFirst()) != null) {
            task.run();
        }
    }

    /**
     * Moves the virtual clock forward, running every task that falls due on the way.
     *
     * @param duration how far to move; must not be negative
     */
    public void advance(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative: " + duration);
        }
        long target = now + duration.toMillis();
        runMicrotasks();
        while (!timed.isEmpty() && timed.peek().dueAt() <= target) {
            Timed next = timed.poll();
            now = next.dueAt();
            next.task().run();
            runMicrotasks();
        }
        now = target;
    }

    /** Runs everything queued, moving the clock to the last task's due time. */
    public void runUntilIdle() {
        runMicrotasks();
        while (!timed.isEmpty()) {
            Timed next = timed.poll();
            now = Math.max(now, next.dueAt());
            next.task().run();
            runMicrotasks();
        }
    }

    /** Number of queued tasks that have neither run nor been cancelled. */
    public int pendingTasks() {
        int count = 0;
        for (GuardedTask task : microtasks) {
            if (!task.isDone()) {
                count++;
            }
        }
        for (Timed t : timed) {
            if (!t.task().isDone()) {
                count++;
            }
        }
        return count;
    }

    /** Virtual time in milliseconds since the loop was created. */
    public long nowMillis() {
        return now;
    }

    private record Timed(long dueAt, long sequence, GuardedTask task) {}
}
