package com.shortspilot.orchestrator.trigger;

import com.shortspilot.orchestrator.service.PipelineInvocation;
import com.shortspilot.orchestrator.service.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * One invocation per process, for cron or a container job.
 *
 * Spring runs this once at startup. {@code main} passes the exit code on to
 * {@code System.exit}:
 *   0: work advanced
 *   3: nothing eligible (or everything blocked by quota)
 *   1: tracking store unreadable or unwritable
 *
 * To run:
 *   java -jar orchestrator.jar --spring.profiles.active=once
 */
@Component
@ConditionalOnProperty(name = "shortspilot.trigger.mode", havingValue = "once")
public class RunOnceRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(RunOnceRunner.class);

    private final PipelineInvocation invocation;

    private volatile int exitCode = 0;

    public RunOnceRunner(PipelineInvocation invocation) {
        this.invocation = invocation;
    }

    @Override
    public void run(String... args) {
        RunSummary summary = invocation.invoke();
        exitCode = summary.outcome().exitCode();
        log.info("Invocation finished with {} (exit code {})", summary.outcome(), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
