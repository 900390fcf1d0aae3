package com.gt.flashcards.task;

import com.gt.flashcards.suspension.SuspensionService;
import com.gt.flashcards.undo.UndoSessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class DatabaseMaintenanceTask {

    private static final Logger log = LoggerFactory.getLogger(DatabaseMaintenanceTask.class);

    private final SuspensionService suspensionService;
    private final UndoSessionRegistry undoSessionRegistry;

    @Autowired
    public DatabaseMaintenanceTask(SuspensionService suspensionService, UndoSessionRegistry undoSessionRegistry) {
        this.suspensionService = suspensionService;
        this.undoSessionRegistry = undoSessionRegistry;
    }

    @Scheduled(cron = "${flashcards.suspension.resumeCron:@daily}")
    public void resumeExpiredTimedPauses() {
        int rowsUpdated = suspensionService.resumeExpiredTimedPauses();

        log.info("Resumed expired timed pauses. {} cards resumed.", rowsUpdated);
    }

    @Scheduled(fixedDelayString = "${flashcards.undo.evictionIntervalMs:900000}")
    public void evictIdleUndoStacks() {
        undoSessionRegistry.evictIdleSessions();
    }
}
