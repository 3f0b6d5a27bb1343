package com.bank.bakeoff.service;

import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BakeoffWorkerTest {

    @Mock private BakeoffService bakeoffService;

    private BakeoffWorker worker;

    @BeforeEach
    void setUp() {
        worker = new BakeoffWorker(bakeoffService, Tracer.NOOP);
    }

    @Test
    void onBakeoffQueued_runsBatchAndReleasesId() {
        worker.onBakeoffQueued(new BakeoffQueuedEvent("B-1"));

        verify(bakeoffService).runBatch("B-1");
        assertThat(worker.isInFlight("B-1")).isFalse();
    }

    @Test
    void onBakeoffQueued_unexpectedError_contained() {
        doThrow(new IllegalStateException("boom")).when(bakeoffService).runBatch("B-1");

        worker.onBakeoffQueued(new BakeoffQueuedEvent("B-1"));

        assertThat(worker.isInFlight("B-1")).isFalse();
    }

    @Test
    void onBakeoffQueued_sameIdWhileRunning_skipped() {
        doAnswer(inv -> {
            assertThat(worker.isInFlight("B-1")).isTrue();
            worker.onBakeoffQueued(new BakeoffQueuedEvent("B-1"));
            return null;
        }).when(bakeoffService).runBatch("B-1");

        worker.onBakeoffQueued(new BakeoffQueuedEvent("B-1"));

        verify(bakeoffService, times(1)).runBatch("B-1");
    }
}
