package de.bsommerfeld.assetledger.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Root of {@code config.toml}. Each section maps to one TOML table; missing
 * keys keep the defaults declared on the section classes.
 *
 * @see ConfigLoader
 */
@JsonPropertyOrder({ "database", "backup", "security", "user" })
public class GlobalConfig {

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("backup")
    private BackupConfig backup = new BackupConfig();

    @JsonProperty("security")
    private SecurityConfig security = new SecurityConfig();

    @JsonProperty("user")
    private UserConfig user = new UserConfig();

    public DatabaseConfig getDatabase() {
        return database;
    }

    public BackupConfig getBackup() {
        return backup;
    }

    public SecurityConfig getSecurity() {
        return security;
    }

    public UserConfig getUser() {
        return user;
    }
}
