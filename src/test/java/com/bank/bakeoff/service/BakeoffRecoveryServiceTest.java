package com.bank.bakeoff.service;

import com.bank.bakeoff.config.BakeoffConfig;
import com.bank.bakeoff.model.Bakeoff;
import com.bank.bakeoff.model.BakeoffStatus;
import com.bank.bakeoff.model.ExecutionMode;
import com.bank.bakeoff.repository.BakeoffRepository;
import com.bank.bakeoff.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BakeoffRecoveryServiceTest {

    @Mock private BakeoffRepository bakeoffRepository;
    @Mock private BakeoffWorker bakeoffWorker;
    @Mock private ApplicationEventPublisher eventPublisher;

    private final BakeoffConfig config = new BakeoffConfig();
    private BakeoffRecoveryService service;

    @BeforeEach
    void setUp() {
        service = new BakeoffRecoveryService(bakeoffRepository, bakeoffWorker, config, eventPublisher);
    }

    @Test
    void recoverStalled_requeuesOldQueuedAndStaleBatchRuns() {
        long hourAgo = System.currentTimeMillis() - 3_600_000L;
        Bakeoff oldQueued = bakeoff("B-1", BakeoffStatus.QUEUED, ExecutionMode.BATCH, hourAgo);
        Bakeoff freshQueued = bakeoff("B-2", BakeoffStatus.QUEUED, ExecutionMode.BATCH, System.currentTimeMillis());
        Bakeoff staleBatch = bakeoff("B-3", BakeoffStatus.RUNNING, ExecutionMode.BATCH, hourAgo);
        Bakeoff staleIncremental = bakeoff("B-4", BakeoffStatus.RUNNING, ExecutionMode.INCREMENTAL, hourAgo);
        when(bakeoffRepository.findByStatus(BakeoffStatus.QUEUED)).thenReturn(List.of(oldQueued, freshQueued));
        when(bakeoffRepository.findByStatus(BakeoffStatus.RUNNING)).thenReturn(List.of(staleBatch, staleIncremental));

        service.recoverStalled();

        verify(eventPublisher).publishEvent(new BakeoffQueuedEvent("B-1"));
        verify(eventPublisher).publishEvent(new BakeoffQueuedEvent("B-3"));
        verifyNoMoreInteractions(eventPublisher);
    }

    @Test
    void recoverStalled_skipsBakeoffsRunningInThisProcess() {
        Bakeoff oldQueued = bakeoff("B-1", BakeoffStatus.QUEUED, ExecutionMode.BATCH, 0L);
        when(bakeoffRepository.findByStatus(BakeoffStatus.QUEUED)).thenReturn(List.of(oldQueued));
        when(bakeoffRepository.findByStatus(BakeoffStatus.RUNNING)).thenReturn(List.of());
        when(bakeoffWorker.isInFlight("B-1")).thenReturn(true);

        service.recoverStalled();

        verifyNoInteractions(eventPublisher);
    }

    @Test
    void recoverStalled_disabled_doesNothing() {
        config.getRecovery().setEnabled(false);

        service.recoverStalled();

        verifyNoInteractions(bakeoffRepository, eventPublisher);
    }

    private static Bakeoff bakeoff(String id, BakeoffStatus status, ExecutionMode mode, long updatedAt) {
        Bakeoff base = TestDataFactory.runningBakeoff(id, 2, List.of());
        return base.toBuilder()
                .status(status)
                .progress(base.getProgress().toBuilder().executionMode(mode).build())
                .updatedAt(updatedAt)
                .build();
    }
}
