package org.nocodenation.oauth2manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Holds the PKCE code verifiers of authorizations that are in flight.
 * <p>
 * Each verifier is stored under its (service, state) pair when the authorization URL is
 * generated and is removed when the callback for that state is exchanged. Entries live
 * for a fixed time-to-live; an expired entry is treated as absent on access and is
 * removed by a periodic sweep, so abandoned authorizations do not accumulate.
 */
public class PkceChallengeCache implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PkceChallengeCache.class);

    private final Map<Key, Entry> verifiers = new ConcurrentHashMap<>();
    private final Duration timeToLive;
    private final Duration sweepInterval;
    private final Clock clock;

    private ScheduledExecutorService sweepScheduler;

    /**
     * Creates a cache.
     *
     * @param timeToLive how long an unconsumed verifier stays valid
     * @param sweepInterval how often expired entries are removed once {@link #start()} is called
     * @param clock the clock used for entry ages
     */
    public PkceChallengeCache(Duration timeToLive, Duration sweepInterval, Clock clock) {
        if (timeToLive.isNegative() || timeToLive.isZero()) {
            throw new IllegalArgumentException("PKCE time-to-live must be positive");
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("PKCE sweep interval must be positive");
        }
        this.timeToLive = timeToLive;
        this.sweepInterval = sweepInterval;
        this.clock = clock;
    }

    /**
     * Stores a verifier, replacing any entry for the same service and state.
     *
     * @param serviceName the service the authorization is for
     * @param state the state sent with the authorization request
     * @param codeVerifier the PKCE code verifier
     */
    public void put(String serviceName, String state, String codeVerifier) {
        verifiers.put(new Key(serviceName, state), new Entry(codeVerifier, clock.instant()));
    }

    /**
     * Removes and returns the verifier for a service and state.
     * <p>
     * The removal is atomic, so of several concurrent callers with the same pair only one
     * receives the verifier.
     *
     * @param serviceName the service named by the callback
     * @param state the state returned by the authorization server
     * @return the code verifier
     * @throws StateMismatchException if no entry exists, it was already taken, or it expired
     */
    public String takeAndRemove(String serviceName, String state) throws StateMismatchException {
        Entry entry = state == null ? null : verifiers.remove(new Key(serviceName, state));
        if (entry == null) {
            LOGGER.warn("State mismatch for service {}: no pending authorization for the returned state", serviceName);
            throw new StateMismatchException(serviceName, "State mismatch in OAuth callback for service " + serviceName);
        }
        if (isExpired(entry, clock.instant())) {
            LOGGER.warn("State mismatch for service {}: pending authorization expired", serviceName);
            throw new StateMismatchException(serviceName, "Authorization for service " + serviceName
                    + " expired, restart the authorization flow");
        }
        return entry.codeVerifier;
    }

    /**
     * Checks whether a service has at least one unexpired authorization in flight.
     *
     * @param serviceName the service name
     * @return true if an authorization is pending
     */
    public boolean hasPending(String serviceName) {
        Instant now = clock.instant();
        return verifiers.entrySet().stream()
                .anyMatch(e -> e.getKey().serviceName.equals(serviceName) && !isExpired(e.getValue(), now));
    }

    /**
     * Removes every expired entry.
     *
     * @return the number of entries removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int before = verifiers.size();
        verifiers.values().removeIf(entry -> isExpired(entry, now));
        int removed = before - verifiers.size();
        if (removed > 0) {
            LOGGER.debug("Removed {} expired PKCE verifiers", removed);
        }
        return removed;
    }

    public int size() {
        return verifiers.size();
    }

    /**
     * Starts the background sweep of expired entries.
     */
    public synchronized void start() {
        if (sweepScheduler != null) {
            return;
        }
        sweepScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "OAuth2-PKCE-Sweep");
            thread.setDaemon(true);
            return thread;
        });

        long intervalMillis = sweepInterval.toMillis();
        sweepScheduler.scheduleWithFixedDelay(() -> {
            try {
                sweepExpired();
            } catch (RuntimeException e) {
                LOGGER.error("PKCE verifier sweep failed", e);
            }
        }, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);

        LOGGER.debug("PKCE verifier sweep started (every {} ms)", intervalMillis);
    }

    /**
     * Stops the background sweep and drops every pending verifier.
     */
    @Override
    public synchronized void close() {
        if (sweepScheduler != null) {
            sweepScheduler.shutdown();
            try {
                if (!sweepScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    sweepScheduler.shutdownNow();
                    LOGGER.warn("PKCE verifier sweep did not terminate gracefully, forced shutdown");
                }
            } catch (InterruptedException e) {
                sweepScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            sweepScheduler = null;
        }
        verifiers.clear();
    }

    private boolean isExpired(Entry entry, Instant now) {
        return !now.isBefore(entry.createdAt.plus(timeToLive));
    }

    private static final class Key {
        private final String serviceName;
        private final String state;

        private Key(String serviceName, String state) {
            this.serviceName = serviceName;
            this.state = state;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Key)) {
                return false;
            }
            Key key = (Key) o;
            return Objects.equals(serviceName, key.serviceName) && Objects.equals(state, key.state);
        }

        @Override
        public int hashCode() {
            return Objects.hash(serviceName, state);
        }
    }

    private static final class Entry {
        private final String codeVerifier;
        private final Instant createdAt;

        private Entry(String codeVerifier, Instant createdAt) {
            this.codeVerifier = codeVerifier;
            this.createdAt = createdAt;
        }
    }
}
