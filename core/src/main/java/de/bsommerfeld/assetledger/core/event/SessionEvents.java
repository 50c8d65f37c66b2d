package de.bsommerfeld.assetledger.core.event;

import java.time.Instant;

/**
 * Events describing the lifecycle of the login session.
 */
public class SessionEvents {

    public record LoggedInEvent(long principalId, String username, String roleName, Instant loginTime) {
    }

    /**
     * Fired on explicit logout and when the session is cleared during
     * shutdown.
     */
    public record LoggedOutEvent(long principalId, String username) {
    }

    /** Username only, the password never leaves the authenticator. */
    public record LoginFailedEvent(String username) {
    }
}
