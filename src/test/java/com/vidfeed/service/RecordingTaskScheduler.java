package com.vidfeed.service;

import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mocked {@link TaskScheduler} that keeps scheduled tasks until the test runs them.
 */
class RecordingTaskScheduler {

    static class Task implements ScheduledFuture<Object> {
        final Runnable runnable;
        final Instant at;
        boolean cancelled;
        boolean ran;

        Task(Runnable runnable, Instant at) {
            this.runnable = runnable;
            this.at = at;
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return cancelled || ran;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return 0;
        }

        @Override
        public int compareTo(Delayed other) {
            return 0;
        }
    }

    final TaskScheduler scheduler = mock(TaskScheduler.class);
    final List<Task> tasks = new ArrayList<>();

    RecordingTaskScheduler() {
        when(scheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(invocation -> {
            Task task = new Task(invocation.getArgument(0), invocation.getArgument(1));
            tasks.add(task);
            return task;
        });
    }

    /**
     * Runs every live task due at or before {@code now}.
     */
    int runDue(Instant now) {
        int ran = 0;
        for (Task task : new ArrayList<>(tasks)) {
            if (!task.cancelled && !task.ran && !task.at.isAfter(now)) {
                task.ran = true;
                task.runnable.run();
                ran++;
            }
        }
        return ran;
    }

    long liveTasks() {
        return tasks.stream().filter(t -> !t.cancelled && !t.ran).count();
    }
}
