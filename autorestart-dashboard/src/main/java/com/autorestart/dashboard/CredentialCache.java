package com.autorestart.dashboard;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Caches the dashboard bearer credential and renews it before the server
 * expires it.
 * <p>
 * Renewal is single-flight: the first caller that finds the cache empty or
 * stale performs the login, every caller arriving meanwhile waits on the same
 * future and receives the same credential or the same failure. A failed login
 * leaves the cache empty, so the next call tries again.
 */
@Slf4j
public class CredentialCache {

    private final Supplier<Credential> login;
    private final Clock clock;
    private final Duration validityThreshold;

    private final ReentrantLock lock = new ReentrantLock();
    /** Guarded by {@link #lock}. */
    private Credential current;
    /** Guarded by {@link #lock}; non-null while a login is running. */
    private CompletableFuture<Credential> inFlight;

    public CredentialCache(Supplier<Credential> login, Clock clock, Duration validityThreshold) {
        this.login = login;
        this.clock = clock;
        this.validityThreshold = validityThreshold;
    }

    /**
     * Return the cached credential if still valid, otherwise log in (or join
     * the login already in progress).
     *
     * @throws AuthenticationError if the login fails
     */
    public Credential getValid() {
        CompletableFuture<Credential> refresh;
        boolean owner = false;

        lock.lock();
        try {
            if (current != null && current.isValidAt(clock.instant(), validityThreshold)) {
                return current;
            }
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                owner = true;
            }
            refresh = inFlight;
        } finally {
            lock.unlock();
        }

        if (owner) {
            runLogin(refresh);
        }
        return await(refresh);
    }

    /**
     * Drop the cached credential so the next {@link #getValid()} logs in
     * regardless of age.
     */
    public void invalidate() {
        lock.lock();
        try {
            current = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop the cached credential only if it is still {@code rejected}. When
     * several requests fail with the same token, only the first one forces a
     * new login; the others pick up the credential it obtained.
     */
    public void invalidate(Credential rejected) {
        lock.lock();
        try {
            if (current == rejected) {
                current = null;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current credential without triggering a login; null when empty.
     */
    public Credential peek() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    private void runLogin(CompletableFuture<Credential> refresh) {
        Credential fresh;
        try {
            fresh = login.get();
        } catch (RuntimeException | Error e) {
            lock.lock();
            try {
                current = null;
                inFlight = null;
            } finally {
                lock.unlock();
            }
            refresh.completeExceptionally(e);
            return;
        }

        lock.lock();
        try {
            current = fresh;
            inFlight = null;
        } finally {
            lock.unlock();
        }
        refresh.complete(fresh);
    }

    private static Credential await(CompletableFuture<Credential> refresh) {
        try {
            return refresh.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new AuthenticationError("Dashboard login failed: " + cause, null, cause);
        }
    }
}
