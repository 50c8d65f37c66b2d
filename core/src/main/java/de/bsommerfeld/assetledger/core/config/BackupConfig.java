package de.bsommerfeld.assetledger.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Settings for the scheduled background backup.
 */
@JsonPropertyOrder({ "directory", "auto-backup-enabled", "interval-minutes", "retain" })
public class BackupConfig {

    @JsonProperty("directory")
    private String directory = "backups";

    @JsonProperty("auto-backup-enabled")
    private boolean autoBackupEnabled = true;

    @JsonProperty("interval-minutes")
    private int intervalMinutes = 60;

    /** Number of backup files kept; older ones are pruned after each run. */
    @JsonProperty("retain")
    private int retain = 10;

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public boolean isAutoBackupEnabled() {
        return autoBackupEnabled;
    }

    public void setAutoBackupEnabled(boolean autoBackupEnabled) {
        this.autoBackupEnabled = autoBackupEnabled;
    }

    public int getIntervalMinutes() {
        return intervalMinutes;
    }

    public void setIntervalMinutes(int intervalMinutes) {
        this.intervalMinutes = intervalMinutes;
    }

    public int getRetain() {
        return retain;
    }

    public void setRetain(int retain) {
        this.retain = retain;
    }
}
