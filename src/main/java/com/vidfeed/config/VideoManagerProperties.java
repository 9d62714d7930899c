package com.vidfeed.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning knobs of the video resource manager, bound from {@code video.manager.*}.
 */
@Data
@ConfigurationProperties(prefix = "video.manager")
public class VideoManagerProperties {

    private String strategy = "pooled";         // Manager implementation to wire
    private int capacity = 3;                  // Concurrently live decoders
    private int nearRadius = 1;                // Kept under memory pressure
    private int farRadius = 2;                 // Preload window around the viewport
    private boolean directionAware = true;     // Prefer the scroll direction on ties
    private int maxRetries = 5;
    private Duration backoffBase = Duration.ofSeconds(1);
    private double backoffFactor = 2.0;
    private Duration maxBackoff = Duration.ofSeconds(30);
    private Duration warmupTimeout = Duration.ofSeconds(10);
    private int memoryPerSlotMb = 20;
    private int probeBytes = 4096;             // Bytes fetched to sniff the container
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(10);

    @PostConstruct
    public void validate() {
        if (capacity < 1) {
            throw new IllegalStateException("video.manager.capacity must be at least 1, got " + capacity);
        }
        if (nearRadius < 0 || farRadius < nearRadius) {
            throw new IllegalStateException("video.manager radii must satisfy 0 <= near-radius <= far-radius, got near="
                    + nearRadius + ", far=" + farRadius);
        }
        if (maxRetries < 0) {
            throw new IllegalStateException("video.manager.max-retries cannot be negative");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalStateException("video.manager.backoff-factor must be >= 1.0");
        }
        if (backoffBase.isNegative() || maxBackoff.compareTo(backoffBase) < 0) {
            throw new IllegalStateException("video.manager.max-backoff must be >= backoff-base");
        }
        if (warmupTimeout.isZero() || warmupTimeout.isNegative()) {
            throw new IllegalStateException("video.manager.warmup-timeout must be positive");
        }
    }

    /**
     * Conservative preset for metered connections: smaller window, fewer retries.
     */
    public static VideoManagerProperties cellular() {
        VideoManagerProperties props = new VideoManagerProperties();
        props.setCapacity(2);
        props.setNearRadius(0);
        props.setFarRadius(1);
        props.setMaxRetries(2);
        props.setWarmupTimeout(Duration.ofSeconds(15));
        return props;
    }

    public static VideoManagerProperties wifi() {
        VideoManagerProperties props = new VideoManagerProperties();
        props.setCapacity(4);
        props.setMaxRetries(2);
        props.setWarmupTimeout(Duration.ofSeconds(15));
        return props;
    }

    /**
     * Short timeouts for tests.
     */
    public static VideoManagerProperties testing() {
        VideoManagerProperties props = new VideoManagerProperties();
        props.setMaxRetries(1);
        props.setWarmupTimeout(Duration.ofMillis(500));
        return props;
    }
}
