package de.bsommerfeld.assetledger.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-specific preferences.
 */
public class UserConfig {

    /** Display language code, e.g. 'en' or 'ru'. */
    @JsonProperty("language")
    private String language = "en";

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }
}
