package com.shortspilot.orchestrator.api;

import com.shortspilot.orchestrator.quota.QuotaLedger;
import com.shortspilot.orchestrator.quota.QuotaUsage;
import com.shortspilot.orchestrator.service.PipelineInvocation;
import com.shortspilot.orchestrator.service.RunOutcome;
import com.shortspilot.orchestrator.service.RunSummary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PipelineController.class)
class PipelineControllerTest {

    @Autowired MockMvc              mockMvc;
    @MockitoBean QuotaLedger        ledger;
    @MockitoBean PipelineInvocation invocation;

    @Test
    void quota_returnsTodaysUsage() throws Exception {
        when(ledger.currentUsage()).thenReturn(new QuotaUsage(9_600, 10_000, LocalDate.of(2026, 10, 19)));

        mockMvc.perform(get("/quota"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2026-10-19"))
                .andExpect(jsonPath("$.consumedUnits").value(9600))
                .andExpect(jsonPath("$.remainingUnits").value(400));
    }

    @Test
    void runs_workAdvanced_returns200WithSummary() throws Exception {
        when(invocation.invoke()).thenReturn(
                new RunSummary(4, 3, 1, 0, true, RunOutcome.WORK_ADVANCED));

        mockMvc.perform(post("/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("WORK_ADVANCED"))
                .andExpect(jsonPath("$.advanced").value(3))
                .andExpect(jsonPath("$.quotaExhausted").value(true));
    }

    @Test
    void runs_fatalStoreError_returns503() throws Exception {
        when(invocation.invoke()).thenReturn(RunSummary.fatal());

        mockMvc.perform(post("/runs"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.outcome").value("FATAL_STORE_ERROR"));
    }
}
