package com.shortspilot.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shortspilot.orchestrator.client.MediaWorkerClient;
import com.shortspilot.orchestrator.notify.LoggingNotifier;
import com.shortspilot.orchestrator.notify.PipelineNotifier;
import com.shortspilot.orchestrator.notify.WebhookNotifier;
import com.shortspilot.orchestrator.quota.QuotaLedger;
import com.shortspilot.orchestrator.service.PublishMetadataFormatter;
import com.shortspilot.orchestrator.service.SegmentPlanner;
import com.shortspilot.orchestrator.stage.FetchStage;
import com.shortspilot.orchestrator.stage.PublishStage;
import com.shortspilot.orchestrator.stage.StageInvoker;
import com.shortspilot.orchestrator.stage.TransformStage;
import com.shortspilot.orchestrator.store.JsonFileTrackingStore;
import com.shortspilot.orchestrator.store.TrackingStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the pipeline components that are plain classes (store, ledger,
 * planner, notifier) and binds the stage executors to the media worker.
 */
@Configuration
@EnableConfigurationProperties({
        PipelineProperties.class,
        StoreProperties.class,
        WorkerProperties.class,
        PublishProperties.class
})
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TrackingStore trackingStore(StoreProperties props, ObjectMapper objectMapper, Clock clock) {
        log.info("Tracking store: {}", props.path().toAbsolutePath());
        return new JsonFileTrackingStore(props.path(), objectMapper, clock);
    }

    @Bean
    public QuotaLedger quotaLedger(TrackingStore store, Clock clock, PipelineProperties props) {
        return new QuotaLedger(store, clock, props.referenceZone(), props.dailyBudget());
    }

    @Bean
    public StageInvoker stageInvoker(MeterRegistry meterRegistry) {
        return new StageInvoker(meterRegistry);
    }

    @Bean
    public SegmentPlanner segmentPlanner(PipelineProperties props) {
        return new SegmentPlanner(props.segmentSeconds(), props.minTailSeconds(), props.maxSegmentsPerItem());
    }

    @Bean
    public PublishMetadataFormatter publishMetadataFormatter(PublishProperties props) {
        return new PublishMetadataFormatter(props);
    }

    // ------------------------------------------------------------------
    // Stage executors
    // ------------------------------------------------------------------

    @Bean
    public FetchStage fetchStage(MediaWorkerClient worker) {
        return worker::fetch;
    }

    @Bean
    public TransformStage transformStage(MediaWorkerClient worker) {
        return worker::transform;
    }

    @Bean
    public PublishStage publishStage(MediaWorkerClient worker) {
        return worker::publish;
    }

    @Bean
    public PipelineNotifier pipelineNotifier(
            @Value("${shortspilot.notify.webhook-url:}") String webhookUrl,
            ObjectMapper objectMapper) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            return new LoggingNotifier();
        }
        log.info("Pipeline notifications go to webhook {}", webhookUrl);
        return new WebhookNotifier(webhookUrl, objectMapper);
    }
}
