package com.vidfeed.scheduler;

import com.vidfeed.model.VideoIdentifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityOrderTest {

    @Test
    void ranksFollowListPosition() {
        VideoIdentifier a = VideoIdentifier.of("a");
        VideoIdentifier b = VideoIdentifier.of("b");
        PriorityOrder order = new PriorityOrder(List.of(a, b));

        assertThat(order.rankOf(a)).isZero();
        assertThat(order.rankOf(b)).isEqualTo(1);
        assertThat(order.rankOf(VideoIdentifier.of("c"))).isEqualTo(PriorityOrder.OUTSIDE_WINDOW);
        assertThat(order.contains(b)).isTrue();
        assertThat(PriorityOrder.empty().size()).isZero();
    }
}
