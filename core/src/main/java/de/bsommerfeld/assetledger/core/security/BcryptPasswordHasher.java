package de.bsommerfeld.assetledger.core.security;

import at.favre.lib.crypto.bcrypt.BCrypt;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.assetledger.core.config.SecurityConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/**
 * {@link PasswordHasher} backed by bcrypt.
 *
 * <p>
 * bcrypt only reads the first 72 bytes of its input, so longer passwords are
 * rejected by {@link #checkStrength} instead of being silently truncated.
 */
@Singleton
public class BcryptPasswordHasher implements PasswordHasher {

    private static final Logger LOG = LoggerFactory.getLogger(BcryptPasswordHasher.class);

    static final int MIN_LENGTH = 8;
    static final int MAX_BYTES = 72;

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ"
            + "abcdefghijklmnopqrstuvwxyz"
            + "0123456789"
            + "!@#$%^&*";

    private final int cost;
    private final int temporaryLength;
    private final SecureRandom random = new SecureRandom();

    @Inject
    public BcryptPasswordHasher(SecurityConfig config) {
        this(config.getBcryptCost(), config.getTemporaryPasswordLength());
    }

    public BcryptPasswordHasher(int cost, int temporaryLength) {
        if (cost < 4 || cost > 31) {
            throw new IllegalArgumentException("bcrypt cost must be within 4..31, was " + cost);
        }
        if (temporaryLength < MIN_LENGTH) {
            throw new IllegalArgumentException("Temporary passwords need at least " + MIN_LENGTH + " characters");
        }
        this.cost = cost;
        this.temporaryLength = temporaryLength;
    }

    @Override
    public String hash(String plaintext) {
        return BCrypt.withDefaults().hashToString(cost, plaintext.toCharArray());
    }

    @Override
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null) {
            return false;
        }
        try {
            return BCrypt.verifyer().verify(plaintext.toCharArray(), hash.toCharArray()).verified;
        } catch (IllegalArgumentException e) {
            LOG.warn("Password verification rejected input: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public StrengthCheck checkStrength(String plaintext) {
        if (plaintext == null || plaintext.length() < MIN_LENGTH) {
            return StrengthCheck.rejected("Password must be at least " + MIN_LENGTH + " characters long");
        }
        if (plaintext.getBytes(StandardCharsets.UTF_8).length > MAX_BYTES) {
            return StrengthCheck.rejected("Password must not exceed " + MAX_BYTES + " bytes");
        }
        if (plaintext.chars().noneMatch(Character::isUpperCase)) {
            return StrengthCheck.rejected("Password must contain at least one upper-case letter");
        }
        if (plaintext.chars().noneMatch(Character::isLowerCase)) {
            return StrengthCheck.rejected("Password must contain at least one lower-case letter");
        }
        if (plaintext.chars().noneMatch(Character::isDigit)) {
            return StrengthCheck.rejected("Password must contain at least one digit");
        }
        return StrengthCheck.OK;
    }

    @Override
    public String generateTemporary() {
        String candidate;
        do {
            StringBuilder sb = new StringBuilder(temporaryLength);
            for (int i = 0; i < temporaryLength; i++) {
                sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
            }
            candidate = sb.toString();
        } while (!checkStrength(candidate).valid());
        return candidate;
    }
}
