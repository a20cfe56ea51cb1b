package com.satfetch.auth;

import java.util.Map;

/**
 * Produces request-ready credentials for one provider and owns their refresh policy.
 * <p>
 * None of the methods throw for expected failures (rejected credentials, unreachable token
 * endpoint): those are reported through the boolean results.
 */
public interface Authenticator {

    /**
     * Performs the provider's credential exchange. On failure any previous credential is cleared.
     *
     * @return true when a fresh credential is held
     */
    boolean authenticate();

    /**
     * Returns true without side effects when a credential is held and no refresh is forced,
     * otherwise refreshes (or authenticates from scratch).
     */
    boolean ensureAuthenticated(boolean forceRefresh);

    default boolean ensureAuthenticated() {
        return ensureAuthenticated(false);
    }

    boolean isAuthenticated();

    /**
     * Headers to attach to transport requests. Empty for session based providers and while
     * no credential is held.
     */
    Map<String, String> authHeaders();

    /**
     * Opaque session handle for providers that authenticate through a client object.
     *
     * @throws UnsupportedOperationException for header-only providers
     */
    default Object authSession() {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not provide a session");
    }
}
