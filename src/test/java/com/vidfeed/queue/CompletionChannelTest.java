package com.vidfeed.queue;

import com.vidfeed.backend.DecoderHandle;
import com.vidfeed.exception.WarmupFailureException;
import com.vidfeed.model.VideoIdentifier;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class CompletionChannelTest {

    private final CompletionChannel channel = new CompletionChannel();

    @Test
    void drainsInPublishOrder() {
        VideoIdentifier a = VideoIdentifier.of("a");
        VideoIdentifier b = VideoIdentifier.of("b");
        channel.publish(WarmupOutcome.ready(a, 1, mock(DecoderHandle.class)));
        channel.publish(WarmupOutcome.failed(b, 2,
                WarmupFailureException.sourceUnavailable("NETWORK", "offline", null)));
        List<VideoIdentifier> seen = new ArrayList<>();

        int drained = channel.drain(outcome -> seen.add(outcome.getIdentifier()));

        assertThat(drained).isEqualTo(2);
        assertThat(seen).containsExactly(a, b);
        assertThat(channel.isEmpty()).isTrue();
    }

    @Test
    void outcomesPublishedWhileDrainingAreApplied() {
        VideoIdentifier a = VideoIdentifier.of("a");
        channel.publish(WarmupOutcome.ready(a, 1, mock(DecoderHandle.class)));
        List<Long> generations = new ArrayList<>();

        channel.drain(outcome -> {
            generations.add(outcome.getGeneration());
            if (outcome.getGeneration() == 1) {
                channel.publish(WarmupOutcome.ready(a, 2, mock(DecoderHandle.class)));
            }
        });

        assertThat(generations).containsExactly(1L, 2L);
    }

    @Test
    void outcomeKnowsWhetherItSucceeded() {
        VideoIdentifier a = VideoIdentifier.of("a");

        assertThat(WarmupOutcome.ready(a, 1, mock(DecoderHandle.class)).isSuccess()).isTrue();
        assertThat(WarmupOutcome.failed(a, 1, WarmupFailureException.decodeFailure("FORMAT_ERROR", "x", null))
                .isSuccess()).isFalse();
    }
}
