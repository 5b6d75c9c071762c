package com.shortspilot.orchestrator.trigger;

import com.shortspilot.orchestrator.service.PipelineInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Long-running mode: one invocation per tick.
 *
 * fixedDelay waits the full interval after the previous invocation finishes,
 * so ticks never overlap within the process.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "shortspilot.trigger.mode", havingValue = "scheduled", matchIfMissing = true)
public class ScheduledTrigger {

    private static final Logger log = LoggerFactory.getLogger(ScheduledTrigger.class);

    private final PipelineInvocation invocation;

    public ScheduledTrigger(PipelineInvocation invocation) {
        this.invocation = invocation;
    }

    @Scheduled(fixedDelayString = "${shortspilot.trigger.fixed-delay-ms:3600000}",
               initialDelayString = "${shortspilot.trigger.initial-delay-ms:10000}")
    public void tick() {
        try {
            invocation.invoke();
        } catch (RuntimeException e) {
            log.error("Unhandled error in pipeline invocation: {}", e.getMessage(), e);
        }
    }
}
