package com.vidfeed.config;

import com.vidfeed.backend.CancellableRequestFactory;
import com.vidfeed.backend.DecoderBackend;
import com.vidfeed.backend.FeedSource;
import com.vidfeed.backend.RemoteProbeDecoderBackend;
import com.vidfeed.service.PooledVideoResourceManager;
import com.vidfeed.service.VideoResourceManager;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.io.SocketConfig;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the resource manager. The implementation is picked by {@code video.manager.strategy};
 * "pooled" is the only strategy shipped.
 */
@Configuration
@EnableConfigurationProperties(VideoManagerProperties.class)
@Slf4j
public class VideoManagerConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CancellableRequestFactory sourceRequestFactory(VideoManagerProperties properties) {
        Timeout readTimeout = Timeout.ofMilliseconds(properties.getReadTimeout().toMillis());
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultSocketConfig(SocketConfig.custom().setSoTimeout(readTimeout).build())
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.ofMilliseconds(properties.getConnectTimeout().toMillis()))
                        .setSocketTimeout(readTimeout)
                        .build())
                .build();
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .build();
        return new CancellableRequestFactory(httpClient);
    }

    @Bean
    public RestTemplate sourceRestTemplate(CancellableRequestFactory sourceRequestFactory) {
        return new RestTemplate(sourceRequestFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public FeedSource feedSource() {
        log.info("No feed source configured, the feed only grows through registration");
        return FeedSource.exhausted();
    }

    @Bean
    @ConditionalOnMissingBean
    public DecoderBackend decoderBackend(RestTemplate sourceRestTemplate,
                                         CancellableRequestFactory sourceRequestFactory,
                                         @Qualifier("videoWarmupExecutor") Executor warmupExecutor,
                                         VideoManagerProperties properties) {
        return new RemoteProbeDecoderBackend(sourceRestTemplate, sourceRequestFactory, warmupExecutor, properties.getProbeBytes());
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "video.manager", name = "strategy", havingValue = "pooled", matchIfMissing = true)
    public VideoResourceManager videoResourceManager(VideoManagerProperties properties,
                                                     DecoderBackend decoderBackend,
                                                     FeedSource feedSource,
                                                     @Qualifier("videoTaskScheduler") TaskScheduler taskScheduler,
                                                     @Qualifier("videoEventExecutor") Executor eventExecutor,
                                                     Clock clock) {
        return new PooledVideoResourceManager(properties, decoderBackend, feedSource, taskScheduler, eventExecutor, clock);
    }
}
