package com.bank.bakeoff.service;

import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs queued bake-offs on the bakeoff executor. Ids already running in this process
 * are skipped; a worker in another process loses on the generation check instead.
 */
@Component
public class BakeoffWorker {

    private static final Logger log = LoggerFactory.getLogger(BakeoffWorker.class);

    private final BakeoffService bakeoffService;
    private final Tracer tracer;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public BakeoffWorker(BakeoffService bakeoffService, Tracer tracer) {
        this.bakeoffService = bakeoffService;
        this.tracer = tracer;
    }

    @Async("bakeoffExecutor")
    @EventListener
    public void onBakeoffQueued(BakeoffQueuedEvent event) {
        String bakeoffId = event.bakeoffId();
        if (!inFlight.add(bakeoffId)) {
            log.debug("Bakeoff {} already running in this process, skipping", bakeoffId);
            return;
        }

        Span span = tracer.nextSpan()
                .name("bakeoff.batch")
                .tag("bakeoff.id", bakeoffId)
                .start();
        long start = System.currentTimeMillis();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            bakeoffService.runBatch(bakeoffId);
            log.info("Bakeoff {} batch run finished in {}ms", bakeoffId, System.currentTimeMillis() - start);
        } catch (Exception e) {
            span.error(e);
            log.error("Unexpected error running bakeoff {}: {}", bakeoffId, e.getMessage(), e);
        } finally {
            span.end();
            inFlight.remove(bakeoffId);
        }
    }

    public boolean isInFlight(String bakeoffId) {
        return inFlight.contains(bakeoffId);
    }
}
