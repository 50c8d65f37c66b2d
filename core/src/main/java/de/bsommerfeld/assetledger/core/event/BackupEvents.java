package de.bsommerfeld.assetledger.core.event;

import java.nio.file.Path;

/**
 * Events published by the background backup service.
 */
public class BackupEvents {

    public record BackupCreatedEvent(Path file, int pruned) {
    }

    public record BackupFailedEvent(String reason) {
    }
}
