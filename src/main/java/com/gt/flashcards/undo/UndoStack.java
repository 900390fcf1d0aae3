package com.gt.flashcards.undo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Optional;

/**
 * Bounded LIFO of review snapshots for one study session. Once full, recording a new action drops the oldest one.
 *
 * <p>An entry is only consumed when its restore succeeds. If restoring throws, the entry goes back on top of the
 * stack so the same undo can be retried.</p>
 */
public class UndoStack {

    private static final Logger log = LoggerFactory.getLogger(UndoStack.class);

    public interface Restorer {
        UndoResult restore(UndoEntry entry);
    }

    private final ArrayDeque<UndoEntry> entries = new ArrayDeque<>();
    private final int capacity;
    private final Restorer restorer;
    private final Clock clock;
    private Instant lastAccess;

    public UndoStack(int capacity, Restorer restorer, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Undo capacity must be at least 1, got " + capacity);
        }

        this.capacity = capacity;
        this.restorer = restorer;
        this.clock = clock;
        this.lastAccess = clock.instant();
    }

    public synchronized void recordAction(UndoEntry entry) {
        touch();

        if (entries.size() >= capacity) {
            UndoEntry evicted = entries.pollLast();
            log.debug("Undo stack full, dropped oldest entry for card {}", evicted.cardId());
        }

        entries.push(entry);
    }

    public synchronized Optional<UndoResult> undo() {
        touch();

        UndoEntry entry = entries.poll();
        if (entry == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(restorer.restore(entry));
        } catch (RuntimeException ex) {
            entries.push(entry);
            throw ex;
        }
    }

    public synchronized Optional<String> peekUndo() {
        return peekEntry().map(UndoEntry::describe);
    }

    public synchronized Optional<UndoEntry> peekEntry() {
        touch();

        return Optional.ofNullable(entries.peek());
    }

    public synchronized boolean canUndo() {
        touch();

        return !entries.isEmpty();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        touch();
        entries.clear();
    }

    public int getCapacity() {
        return capacity;
    }

    public synchronized Instant getLastAccess() {
        return lastAccess;
    }

    private void touch() {
        lastAccess = clock.instant();
    }
}
