package com.linlay.agentsview.sync;

import com.linlay.agentsview.config.SyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers the initial pass once the application is ready and periodic passes afterwards.
 * Overlapping triggers wait on the engine's own lock.
 */
@Component
public class SyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private final SyncEngine syncEngine;
    private final SyncProperties properties;

    public SyncScheduler(SyncEngine syncEngine, SyncProperties properties) {
        this.syncEngine = syncEngine;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isInitialSyncEnabled()) {
            log.info("Initial session sync disabled");
            return;
        }
        runPass("initial");
    }

    @Scheduled(
            fixedDelayString = "${agentsview.sync.periodic.interval:PT15M}",
            initialDelayString = "${agentsview.sync.periodic.interval:PT15M}"
    )
    public void periodicSync() {
        if (!properties.getPeriodic().isEnabled()) {
            return;
        }
        runPass("periodic");
    }

    void runPass(String trigger) {
        try {
            SyncStats stats = syncEngine.syncAll(null);
            log.debug("{} sync done: {}", trigger, stats);
        } catch (RuntimeException ex) {
            log.warn("{} sync failed", trigger, ex);
        }
    }
}
