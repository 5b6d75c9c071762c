package com.shortspilot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(OrchestratorApplication.class, args);

        // One-shot mode: RunOnceRunner has finished, report its outcome as the exit status.
        if ("once".equals(context.getEnvironment().getProperty("shortspilot.trigger.mode"))) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
