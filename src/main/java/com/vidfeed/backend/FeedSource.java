package com.vidfeed.backend;

import com.vidfeed.model.VideoDescriptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Pagination collaborator that supplies feed descriptors in display order.
 */
public interface FeedSource {

    boolean canLoadMore();

    CompletableFuture<List<VideoDescriptor>> loadMore();

    /**
     * A source with nothing left to load.
     */
    static FeedSource exhausted() {
        return new FeedSource() {
            @Override
            public boolean canLoadMore() {
                return false;
            }

            @Override
            public CompletableFuture<List<VideoDescriptor>> loadMore() {
                return CompletableFuture.completedFuture(List.of());
            }
        };
    }
}
