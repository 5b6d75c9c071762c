package com.shortspilot.orchestrator.api;

import com.shortspilot.orchestrator.api.dto.QuotaResponse;
import com.shortspilot.orchestrator.api.dto.RunResponse;
import com.shortspilot.orchestrator.quota.QuotaLedger;
import com.shortspilot.orchestrator.service.PipelineInvocation;
import com.shortspilot.orchestrator.service.RunOutcome;
import com.shortspilot.orchestrator.service.RunSummary;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Quota status and manual runs.
 *
 * GET  /quota: today's consumption in the reference zone
 * POST /runs : one invocation now; 503 if the tracking store is unusable
 */
@RestController
public class PipelineController {

    private final QuotaLedger        ledger;
    private final PipelineInvocation invocation;

    public PipelineController(QuotaLedger ledger, PipelineInvocation invocation) {
        this.ledger     = ledger;
        this.invocation = invocation;
    }

    @GetMapping("/quota")
    public QuotaResponse quota() {
        return QuotaResponse.from(ledger.currentUsage());
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/runs
     */
    @PostMapping("/runs")
    public ResponseEntity<RunResponse> run() {
        RunSummary summary = invocation.invoke();
        HttpStatus status = summary.outcome() == RunOutcome.FATAL_STORE_ERROR
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(RunResponse.from(summary));
    }
}
