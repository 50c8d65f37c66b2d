package de.bsommerfeld.assetledger.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Password hashing parameters.
 */
@JsonPropertyOrder({ "bcrypt-cost", "temporary-password-length" })
public class SecurityConfig {

    /** Log2 work factor. Every +1 doubles hashing time. */
    @JsonProperty("bcrypt-cost")
    private int bcryptCost = 12;

    @JsonProperty("temporary-password-length")
    private int temporaryPasswordLength = 12;

    public int getBcryptCost() {
        return bcryptCost;
    }

    public void setBcryptCost(int bcryptCost) {
        this.bcryptCost = bcryptCost;
    }

    public int getTemporaryPasswordLength() {
        return temporaryPasswordLength;
    }

    public void setTemporaryPasswordLength(int temporaryPasswordLength) {
        this.temporaryPasswordLength = temporaryPasswordLength;
    }
}
