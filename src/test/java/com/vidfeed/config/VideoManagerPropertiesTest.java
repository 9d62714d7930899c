package com.vidfeed.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VideoManagerPropertiesTest {

    @Test
    void defaultsAreValid() {
        VideoManagerProperties properties = new VideoManagerProperties();

        assertThatCode(properties::validate).doesNotThrowAnyException();
        assertThat(properties.getCapacity()).isEqualTo(3);
        assertThat(properties.getFarRadius()).isEqualTo(2);
        assertThat(properties.getMaxRetries()).isEqualTo(5);
    }

    @Test
    void presetsAreValid() {
        VideoManagerProperties cellular = VideoManagerProperties.cellular();
        VideoManagerProperties wifi = VideoManagerProperties.wifi();
        VideoManagerProperties testing = VideoManagerProperties.testing();

        assertThatCode(cellular::validate).doesNotThrowAnyException();
        assertThatCode(wifi::validate).doesNotThrowAnyException();
        assertThatCode(testing::validate).doesNotThrowAnyException();
        assertThat(cellular.getCapacity()).isLessThan(wifi.getCapacity());
        assertThat(testing.getWarmupTimeout()).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    void rejectsZeroCapacity() {
        VideoManagerProperties properties = new VideoManagerProperties();
        properties.setCapacity(0);

        assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsNearRadiusBeyondFarRadius() {
        VideoManagerProperties properties = new VideoManagerProperties();
        properties.setNearRadius(3);

        assertThatThrownBy(properties::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("radii");
    }

    @Test
    void rejectsShrinkingBackoff() {
        VideoManagerProperties properties = new VideoManagerProperties();
        properties.setBackoffFactor(0.5);

        assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
    }
}
