package org.seleznyov.iyu.tracepipe.application.config;

import lombok.extern.slf4j.Slf4j;
import org.seleznyov.iyu.tracepipe.core.configuration.properties.TracePipelineConfiguration;
import org.seleznyov.iyu.tracepipe.core.correlation.EventCorrelator;
import org.seleznyov.iyu.tracepipe.core.ingest.EventIngestor;
import org.seleznyov.iyu.tracepipe.core.pipeline.TracePipeline;
import org.seleznyov.iyu.tracepipe.core.store.HotEventStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Trace pipeline wiring. The pipeline bean owns the drain thread, Spring starts and stops it.
 */
@Configuration
@EnableConfigurationProperties(TracePipelineProperties.class)
@Slf4j
public class TracePipelineConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock tracePipelineClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TracePipelineConfiguration tracePipelineConfiguration(TracePipelineProperties properties) {
        properties.validate();
        final TracePipelineConfiguration configuration = properties.toConfiguration();

        log.info("Trace pipeline configuration: enabled={}, capacity={}, policy={}, ttl={}, maxTracked={}",
            configuration.enabled(),
            configuration.ringBuffer().capacity(),
            configuration.ringBuffer().overflowPolicy(),
            configuration.correlation().ttl(),
            configuration.correlation().maxTrackedCorrelations());
        return configuration;
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnMissingBean(TracePipeline.class)
    public TracePipeline tracePipeline(TracePipelineConfiguration tracePipelineConfiguration, Clock clock) {
        return new TracePipeline(tracePipelineConfiguration, clock);
    }

    @Bean
    public EventIngestor eventIngestor(TracePipeline tracePipeline) {
        return tracePipeline.ingestor();
    }

    @Bean
    public EventCorrelator eventCorrelator(TracePipeline tracePipeline) {
        return tracePipeline.correlator();
    }

    @Bean
    public HotEventStore hotEventStore(TracePipeline tracePipeline) {
        return tracePipeline.store();
    }
}
