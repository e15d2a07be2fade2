package org.seleznyov.iyu.tracepipe.application.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.seleznyov.iyu.tracepipe.application.config.TracePipelineConfig;
import org.seleznyov.iyu.tracepipe.core.pipeline.TracePipeline;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Scheduled maintenance and metrics on top of the pipeline wiring.
 */
@Configuration
@EnableScheduling
@Import({TracePipelineConfig.class, CorrelationCleanupService.class, HotStoreRetentionService.class})
@Slf4j
public class TracePipelineServiceConfiguration {

    @Bean
    public PipelineMetrics pipelineMetrics(ObjectProvider<MeterRegistry> meterRegistry, TracePipeline tracePipeline) {
        final MeterRegistry registry = meterRegistry.getIfAvailable(() -> {
            log.info("No MeterRegistry in context, pipeline metrics go to a SimpleMeterRegistry");
            return new SimpleMeterRegistry();
        });
        return new PipelineMetrics(registry, tracePipeline);
    }
}
