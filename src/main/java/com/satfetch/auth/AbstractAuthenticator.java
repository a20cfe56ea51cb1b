package com.satfetch.auth;

import com.satfetch.models.Credential;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Credential state machine shared by all providers.
 * <p>
 * States are {@code Unauthenticated} (no credential) and {@code Authenticated}. Every exchange
 * runs under one lock. Callers that queued behind an exchange started after they arrived
 * observe its result instead of starting another one, so many downloaders sharing this
 * instance cause a single round-trip to the provider.
 */
@Slf4j
public abstract class AbstractAuthenticator implements Authenticator {

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Credential credential;
    // bumped after every completed exchange, successful or not
    private volatile long generation;

    protected abstract Credential exchange() throws IOException, AuthenticationException;

    protected Credential refresh(Credential current) throws IOException, AuthenticationException {
        return exchange();
    }

    protected String providerName() {
        return getClass().getSimpleName();
    }

    @Override
    public boolean authenticate() {
        lock.lock();
        try {
            return runExchange(null);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean ensureAuthenticated(boolean forceRefresh) {
        long seen = generation;
        if (!forceRefresh && credential != null) {
            return true;
        }
        lock.lock();
        try {
            if (generation != seen) {
                // someone else finished an exchange while we waited
                return credential != null;
            }
            if (!forceRefresh && credential != null) {
                return true;
            }
            return runExchange(credential);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isAuthenticated() {
        return credential != null;
    }

    @Override
    public Map<String, String> authHeaders() {
        Credential current = credential;
        if (current == null) {
            log.debug("{} has no credential, sending request without auth headers", providerName());
            return Map.of();
        }
        return current.headers();
    }

    protected Credential currentCredential() {
        return credential;
    }

    private boolean runExchange(Credential current) {
        try {
            Credential fresh = current == null ? exchange() : refresh(current);
            if (fresh == null) {
                throw new AuthenticationException("No credential returned");
            }
            credential = fresh;
            log.info("{} {}", providerName(), current == null ? "authenticated" : "refreshed credentials");
            return true;
        } catch (AuthenticationException | IOException e) {
            credential = null;
            log.error("{} authentication failed: {}", providerName(), e.getMessage());
            return false;
        } finally {
            generation++;
        }
    }
}
