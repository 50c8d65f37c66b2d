package de.bsommerfeld.assetledger.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Location and connection tuning of the embedded record store.
 */
@JsonPropertyOrder({ "file", "busy-timeout-ms", "cache-size" })
public class DatabaseConfig {

    /** Store file, relative paths are resolved against the app data directory. */
    @JsonProperty("file")
    private String file = "database/asset-ledger.db";

    /** How long a writer waits for the store's write lock before failing. */
    @JsonProperty("busy-timeout-ms")
    private int busyTimeoutMs = 5000;

    /** Page cache size in pages, applied to every new connection. */
    @JsonProperty("cache-size")
    private int cacheSize = 10000;

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    public int getBusyTimeoutMs() {
        return busyTimeoutMs;
    }

    public void setBusyTimeoutMs(int busyTimeoutMs) {
        this.busyTimeoutMs = busyTimeoutMs;
    }

    public int getCacheSize() {
        return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
        this.cacheSize = cacheSize;
    }
}
