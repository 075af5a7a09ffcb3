package com.tektonqueue.adapter.spring;

import com.tektonqueue.cel.MutationMetrics;
import com.tektonqueue.cli.PreviewRunner;
import com.tektonqueue.config.ConfigLoader;
import com.tektonqueue.config.ConfigStore;
import com.tektonqueue.webhook.PipelineRunDefaulter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for tekton-queue.
 */
@Configuration
@ConditionalOnProperty(prefix = "tekton-queue", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TektonQueueProperties.class)
public class TektonQueueAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TektonQueueAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public MutationMetrics mutationMetrics(MeterRegistry meterRegistry) {
        return new MutationMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfigStore configStore(TektonQueueProperties properties, MutationMetrics metrics) {
        log.info("Loading tekton-queue configuration from: {}", properties.getConfigPath());
        ConfigStore store = new ConfigStore(metrics);
        store.update(ConfigLoader.read(properties.getConfigPath()));
        return store;
    }

    @Bean
    @ConditionalOnMissingBean
    public PipelineRunDefaulter pipelineRunDefaulter(ConfigStore configStore) {
        return new PipelineRunDefaulter(configStore);
    }

    @Bean
    @ConditionalOnProperty(prefix = "tekton-queue.preview", name = "pipeline-run")
    public PreviewRunner previewRunner(TektonQueueProperties properties, PipelineRunDefaulter defaulter) {
        return new PreviewRunner(properties.getPreview().getPipelineRun(), defaulter);
    }
}
