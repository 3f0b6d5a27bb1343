package com.bank.bakeoff.service;

import com.bank.bakeoff.config.BakeoffConfig;
import com.bank.bakeoff.model.Bakeoff;
import com.bank.bakeoff.model.BakeoffStatus;
import com.bank.bakeoff.model.ExecutionMode;
import com.bank.bakeoff.repository.BakeoffRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Periodically re-enqueues bake-offs whose background run was lost, e.g. to a restart:
 * QUEUED ones that nobody picked up and batch-mode RUNNING ones with no recent progress.
 * Incremental bake-offs are driven by their caller and are never picked up here.
 */
@Service
public class BakeoffRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(BakeoffRecoveryService.class);

    private final BakeoffRepository bakeoffRepository;
    private final BakeoffWorker bakeoffWorker;
    private final BakeoffConfig bakeoffConfig;
    private final ApplicationEventPublisher eventPublisher;

    public BakeoffRecoveryService(BakeoffRepository bakeoffRepository,
                                  BakeoffWorker bakeoffWorker,
                                  BakeoffConfig bakeoffConfig,
                                  ApplicationEventPublisher eventPublisher) {
        this.bakeoffRepository = bakeoffRepository;
        this.bakeoffWorker = bakeoffWorker;
        this.bakeoffConfig = bakeoffConfig;
        this.eventPublisher = eventPublisher;
    }

    @Scheduled(fixedRateString = "${bakeoff.recovery.check-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "30")
    public void recoverStalled() {
        BakeoffConfig.Recovery recovery = bakeoffConfig.getRecovery();
        if (!recovery.isEnabled()) {
            return;
        }

        long now = System.currentTimeMillis();
        long queuedCutoff = now - TimeUnit.SECONDS.toMillis(recovery.getCheckIntervalSeconds());
        long staleCutoff = now - TimeUnit.SECONDS.toMillis(recovery.getStaleAfterSeconds());
        int requeued = 0;

        for (Bakeoff bakeoff : bakeoffRepository.findByStatus(BakeoffStatus.QUEUED)) {
            if (bakeoff.getUpdatedAt() < queuedCutoff && !bakeoffWorker.isInFlight(bakeoff.getId())) {
                eventPublisher.publishEvent(new BakeoffQueuedEvent(bakeoff.getId()));
                requeued++;
            }
        }

        for (Bakeoff bakeoff : bakeoffRepository.findByStatus(BakeoffStatus.RUNNING)) {
            boolean batch = bakeoff.getProgress() != null
                    && bakeoff.getProgress().getExecutionMode() != ExecutionMode.INCREMENTAL;
            if (batch && bakeoff.getUpdatedAt() < staleCutoff && !bakeoffWorker.isInFlight(bakeoff.getId())) {
                log.warn("Bakeoff {} has made no progress for {}s, re-enqueueing",
                        bakeoff.getId(), (now - bakeoff.getUpdatedAt()) / 1000);
                eventPublisher.publishEvent(new BakeoffQueuedEvent(bakeoff.getId()));
                requeued++;
            }
        }

        if (requeued > 0) {
            log.info("Re-enqueued {} stalled bakeoffs", requeued);
        }
    }
}
