package org.gc.freegames.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "free-games.scheduler.restore-on-startup", havingValue = "true", matchIfMissing = true)
public class JobRestoreListener {

    private final PushJobScheduler pushJobScheduler;

    /**
     * Restores persisted push jobs once the application is ready.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void restorePersistedJobs() {
        log.debug("Restoring persisted push jobs");
        int restored = pushJobScheduler.restoreAll();
        log.debug("Push job restore finished, {} job(s) active", restored);
    }
}
