package de.bsommerfeld.assetledger.core.security;

/**
 * Password capability used by the account services. Hashes are opaque
 * strings; callers never inspect them.
 */
public interface PasswordHasher {

    /** Returns a salted adaptive hash of {@code plaintext}. */
    String hash(String plaintext);

    /**
     * Checks {@code plaintext} against a hash produced by {@link #hash}.
     * Malformed hashes verify as {@code false}.
     */
    boolean verify(String plaintext, String hash);

    /** Evaluates the password rules without hashing anything. */
    StrengthCheck checkStrength(String plaintext);

    /** Generates a random password that passes {@link #checkStrength}. */
    String generateTemporary();
}
