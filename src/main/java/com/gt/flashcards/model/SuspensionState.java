package com.gt.flashcards.model;

import java.time.Instant;
import java.time.LocalDate;

public record SuspensionState(boolean suspended,
                              Instant suspendedAt,
                              SuspensionSource suspendedBy,
                              LocalDate resumeDate,
                              String pauseReason) {

    public static final SuspensionState ACTIVE = new SuspensionState(false, null, null, null, null);

    public boolean isLeechSuspension() {
        return suspended && suspendedBy == SuspensionSource.LeechAuto;
    }
}
