package de.bsommerfeld.assetledger.core.security;

/**
 * Outcome of a password strength check. {@code reason} explains the first
 * rule that failed, or is {@code "OK"}.
 */
public record StrengthCheck(boolean valid, String reason) {

    static final StrengthCheck OK = new StrengthCheck(true, "OK");

    static StrengthCheck rejected(String reason) {
        return new StrengthCheck(false, reason);
    }
}
