package com.gt.flashcards.undo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

// One undo stack per signed in user. Starting a study session replaces the user's stack.
@Component
public class UndoSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(UndoSessionRegistry.class);

    private final Map<String, UndoStack> stacks = new ConcurrentHashMap<>();
    private final UndoService undoService;
    private final Clock clock;
    private final Duration sessionIdleTimeout;

    @Autowired
    public UndoSessionRegistry(UndoService undoService,
                               Clock clock,
                               @Value("${flashcards.undo.sessionIdleMinutes:240}") long sessionIdleMinutes) {
        this.undoService = undoService;
        this.clock = clock;
        this.sessionIdleTimeout = Duration.ofMinutes(sessionIdleMinutes);
    }

    public UndoStack getStack(String username) {
        return stacks.computeIfAbsent(username, key -> undoService.newStack());
    }

    public UndoStack startSession(String username) {
        UndoStack stack = undoService.newStack();
        stacks.put(username, stack);

        return stack;
    }

    // The next getStack call hands out a fresh, empty stack
    public void endSession(String username) {
        stacks.remove(username);
    }

    public int evictIdleSessions() {
        Instant cutoff = clock.instant().minus(sessionIdleTimeout);
        int evicted = 0;

        for (Map.Entry<String, UndoStack> entry : stacks.entrySet()) {
            if (entry.getValue().getLastAccess().isBefore(cutoff) && stacks.remove(entry.getKey(), entry.getValue())) {
                evicted++;
            }
        }

        if (evicted > 0) {
            log.info("Evicted {} idle undo stacks", evicted);
        }

        return evicted;
    }

    int sessionCount() {
        return stacks.size();
    }
}
