package com.vidfeed.queue;

import lombok.extern.slf4j.Slf4j;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;

/**
 * Lock-free hand-off of warm-up outcomes from worker threads to the thread that owns the
 * manager's state. Outcomes are applied in the order they were published.
 */
@Slf4j
public class CompletionChannel {

    private final Queue<WarmupOutcome> queue = new ConcurrentLinkedQueue<>();

    public void publish(WarmupOutcome outcome) {
        queue.offer(outcome);
        log.debug("Published warm-up outcome for video {} (gen={}, success={})",
                outcome.getIdentifier().shortId(), outcome.getGeneration(), outcome.isSuccess());
    }

    /**
     * Applies every queued outcome, including ones published while draining.
     *
     * @return number of outcomes applied
     */
    public int drain(Consumer<WarmupOutcome> consumer) {
        int drained = 0;
        WarmupOutcome outcome;
        while ((outcome = queue.poll()) != null) {
            consumer.accept(outcome);
            drained++;
        }
        return drained;
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
