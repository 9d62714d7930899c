package com.vidfeed.service;

import com.vidfeed.backend.DecoderBackend;
import com.vidfeed.backend.DecoderHandle;
import com.vidfeed.backend.WarmupRequest;
import com.vidfeed.model.VideoIdentifier;
import org.springframework.core.task.TaskRejectedException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Backend whose warm-ups finish only when the test says so.
 */
class ControllableDecoderBackend implements DecoderBackend {

    static class Pending {
        final WarmupRequest request;
        final CompletableFuture<DecoderHandle> future;

        Pending(WarmupRequest request, CompletableFuture<DecoderHandle> future) {
            this.request = request;
            this.future = future;
        }
    }

    /**
     * Future of a backend that keeps working after cancellation and may still deliver a handle.
     */
    static class UninterruptibleFuture extends CompletableFuture<DecoderHandle> {
        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            return false;
        }
    }

    final List<Pending> requests = new ArrayList<>();
    final List<FakeDecoderHandle> handles = new ArrayList<>();
    boolean completeImmediately;
    boolean ignoreCancellation;
    int rejectNext;
    int rejected;

    @Override
    public CompletableFuture<DecoderHandle> prepare(WarmupRequest request) {
        if (rejectNext > 0) {
            rejectNext--;
            rejected++;
            throw new TaskRejectedException("Warm-up executor saturated, rejected " + request);
        }
        Pending pending = new Pending(request,
                ignoreCancellation ? new UninterruptibleFuture() : new CompletableFuture<>());
        requests.add(pending);
        if (completeImmediately) {
            pending.future.complete(newHandle(request.getIdentifier()));
        }
        return pending.future;
    }

    FakeDecoderHandle complete(VideoIdentifier identifier) {
        FakeDecoderHandle handle = newHandle(identifier);
        latest(identifier).future.complete(handle);
        return handle;
    }

    void fail(VideoIdentifier identifier, Throwable error) {
        latest(identifier).future.completeExceptionally(error);
    }

    void completeAllPending() {
        for (Pending pending : new ArrayList<>(requests)) {
            if (!pending.future.isDone()) {
                pending.future.complete(newHandle(pending.request.getIdentifier()));
            }
        }
    }

    Pending latest(VideoIdentifier identifier) {
        for (int i = requests.size() - 1; i >= 0; i--) {
            if (requests.get(i).request.getIdentifier().equals(identifier)) {
                return requests.get(i);
            }
        }
        throw new AssertionError("No warm-up requested for " + identifier);
    }

    long requestCount(VideoIdentifier identifier) {
        return requests.stream().filter(p -> p.request.getIdentifier().equals(identifier)).count();
    }

    private FakeDecoderHandle newHandle(VideoIdentifier identifier) {
        FakeDecoderHandle handle = new FakeDecoderHandle(identifier);
        handles.add(handle);
        return handle;
    }
}
