package com.shortspilot.orchestrator.service;

import com.shortspilot.orchestrator.config.PipelineProperties;
import com.shortspilot.orchestrator.discovery.DiscoveryService;
import com.shortspilot.orchestrator.notify.PipelineNotifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.ZoneId;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineInvocationTest {

    private static final PipelineProperties PROPS = new PipelineProperties(
            10_000, 1_600, 5, 3, ZoneId.of("America/Los_Angeles"), 60, 10, 10);

    @Mock DiscoveryService  discovery;
    @Mock PipelineScheduler scheduler;
    @Mock PipelineNotifier  notifier;

    @Test
    void invoke_runsDiscoveryThenScheduler() {
        PipelineInvocation invocation = new PipelineInvocation(discovery, scheduler, notifier, PROPS, true);
        when(scheduler.runOnce(5)).thenReturn(
                new RunSummary(1, 1, 0, 0, false, RunOutcome.WORK_ADVANCED));

        RunSummary summary = invocation.invoke();

        assertThat(summary.outcome()).isEqualTo(RunOutcome.WORK_ADVANCED);
        InOrder order = inOrder(discovery, scheduler);
        order.verify(discovery).ingest();
        order.verify(scheduler).runOnce(5);
        verify(notifier, never()).queueDrained();
    }

    @Test
    void invoke_discoveryFails_stillRunsScheduler() {
        PipelineInvocation invocation = new PipelineInvocation(discovery, scheduler, notifier, PROPS, true);
        doThrow(new IllegalStateException("worker down")).when(discovery).ingest();
        when(scheduler.runOnce(5)).thenReturn(
                new RunSummary(1, 1, 0, 0, false, RunOutcome.WORK_ADVANCED));

        assertThat(invocation.invoke().outcome()).isEqualTo(RunOutcome.WORK_ADVANCED);
    }

    @Test
    void invoke_discoveryDisabled_skipsIt() {
        PipelineInvocation invocation = new PipelineInvocation(discovery, scheduler, notifier, PROPS, false);
        when(scheduler.runOnce(5)).thenReturn(RunSummary.nothingEligible());

        invocation.invoke();

        verify(discovery, never()).ingest();
    }

    @Test
    void invoke_nothingEligible_notifiesQueueDrained() {
        PipelineInvocation invocation = new PipelineInvocation(discovery, scheduler, notifier, PROPS, false);
        when(scheduler.runOnce(5)).thenReturn(RunSummary.nothingEligible());

        invocation.invoke();

        verify(notifier).queueDrained();
    }

    @Test
    void invoke_blockedByQuota_doesNotNotifyQueueDrained() {
        PipelineInvocation invocation = new PipelineInvocation(discovery, scheduler, notifier, PROPS, false);
        when(scheduler.runOnce(5)).thenReturn(
                new RunSummary(2, 0, 0, 0, true, RunOutcome.NOTHING_ELIGIBLE));

        invocation.invoke();

        verify(notifier, never()).queueDrained();
    }

    @Test
    void invoke_whileAnotherIsRunning_returnsWithoutRunning() throws Exception {
        PipelineInvocation invocation = new PipelineInvocation(discovery, scheduler, notifier, PROPS, false);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(scheduler.runOnce(5)).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new RunSummary(1, 1, 0, 0, false, RunOutcome.WORK_ADVANCED);
        });

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<RunSummary> first = pool.submit(invocation::invoke);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            RunSummary overlapping = invocation.invoke();
            release.countDown();

            assertThat(overlapping.outcome()).isEqualTo(RunOutcome.NOTHING_ELIGIBLE);
            assertThat(first.get(5, TimeUnit.SECONDS).outcome()).isEqualTo(RunOutcome.WORK_ADVANCED);
            verify(scheduler).runOnce(5);
        } finally {
            pool.shutdownNow();
        }
    }
}
