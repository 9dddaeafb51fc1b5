package io.agentcard.sdk.keys;

import com.nimbusds.jose.jwk.JWKSet;
import io.agentcard.sdk.SignatureVerificationException;
import io.agentcard.sdk.VerificationError;
import io.agentcard.sdk.jws.AlgorithmPolicy;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Per-URI cache in front of a {@link KeySetFetcher}.
 *
 * <ul>
 *   <li>A fetched key set is served from memory until {@code cacheMaxAge} has elapsed.</li>
 *   <li>A failed fetch is remembered for {@code cooldown}; during that window callers get the same failure
 *       without another request.</li>
 *   <li>At most one fetch per URI is in flight. Concurrent callers for the same URI wait on that URI's lock and
 *       then read the outcome it stored.</li>
 * </ul>
 *
 * <p>Entries older than both windows are dropped by a sweep that runs at most once per
 * {@code max(cacheMaxAge, cooldown)}, so URIs named once do not stay in memory. Instances are thread-safe and
 * nothing is persisted.</p>
 */
public final class KeySetResolver {

    private static final Logger LOGGER = Logger.getLogger(KeySetResolver.class.getName());

    public static final Duration DEFAULT_CACHE_MAX_AGE = Duration.ofMinutes(5);
    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(30);

    private final KeySetFetcher fetcher;
    private final Duration cacheMaxAge;
    private final Duration cooldown;
    private final Clock clock;
    private final Duration retention;
    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private volatile Instant nextSweep;

    public KeySetResolver(KeySetFetcher fetcher, Duration cacheMaxAge, Duration cooldown, Clock clock) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.cacheMaxAge = positiveOrDefault(cacheMaxAge, DEFAULT_CACHE_MAX_AGE);
        this.cooldown = positiveOrDefault(cooldown, DEFAULT_COOLDOWN);
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.retention = this.cacheMaxAge.compareTo(this.cooldown) >= 0 ? this.cacheMaxAge : this.cooldown;
        this.nextSweep = this.clock.instant().plus(retention);
    }

    /**
     * Returns the key set published at {@code uri}, from the cache when possible.
     *
     * @param timeout bound on the fetch and on the wait for a fetch already in flight.
     */
    public JWKSet resolve(String uri, Duration timeout) throws SignatureVerificationException {
        sweepIfDue();
        Entry entry = entries.computeIfAbsent(uri, key -> new Entry());

        JWKSet cached = fromCache(uri, entry.snapshot);
        if (cached != null) {
            return cached;
        }

        acquire(entry, uri, timeout);
        try {
            cached = fromCache(uri, entry.snapshot);
            if (cached != null) {
                return cached;
            }
            return fetchInto(entry, uri, timeout);
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Re-fetches a key set after a lookup found no usable key, which usually means the publisher rotated keys.
     * The cached set is returned unchanged when it was fetched less than {@code cooldown} ago.
     */
    public JWKSet reload(String uri, Duration timeout) throws SignatureVerificationException {
        Entry entry = entries.computeIfAbsent(uri, key -> new Entry());
        acquire(entry, uri, timeout);
        try {
            Snapshot snapshot = entry.snapshot;
            if (snapshot != null && isWithin(snapshot, cooldown)) {
                if (snapshot.failure() != null) {
                    throw replay(snapshot.failure());
                }
                return snapshot.keys();
            }
            LOGGER.fine(() -> "[agentcard-sdk] reloading JWKS " + uri);
            return fetchInto(entry, uri, timeout);
        } finally {
            entry.lock.unlock();
        }
    }

    public void invalidate(String uri) {
        entries.remove(uri);
    }

    public void clear() {
        entries.clear();
    }

    int size() {
        return entries.size();
    }

    private void sweepIfDue() {
        Instant now = clock.instant();
        if (now.isBefore(nextSweep)) {
            return;
        }
        nextSweep = now.plus(retention);
        int before = entries.size();
        entries.forEach((uri, entry) -> {
            // an entry whose lock is held has a fetch in flight
            if (entry.snapshot == null || !entry.lock.tryLock()) {
                return;
            }
            try {
                Snapshot snapshot = entry.snapshot;
                if (snapshot != null && !isWithin(snapshot, retention)) {
                    entries.remove(uri, entry);
                }
            } finally {
                entry.lock.unlock();
            }
        });
        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[agentcard-sdk] JWKS cache sweep removed %d entries", before - entries.size()));
    }

    private JWKSet fromCache(String uri, Snapshot snapshot) throws SignatureVerificationException {
        if (snapshot == null) {
            return null;
        }
        if (snapshot.failure() != null) {
            if (isWithin(snapshot, cooldown)) {
                LOGGER.fine(() -> "[agentcard-sdk] JWKS " + uri + " in failure cooldown");
                throw replay(snapshot.failure());
            }
            return null;
        }
        if (isWithin(snapshot, cacheMaxAge)) {
            LOGGER.fine(() -> "[agentcard-sdk] JWKS cache hit for " + uri);
            return snapshot.keys();
        }
        return null;
    }

    private JWKSet fetchInto(Entry entry, String uri, Duration timeout) throws SignatureVerificationException {
        URI target = AlgorithmPolicy.parseKeySetUri(uri);
        LOGGER.fine(() -> "[agentcard-sdk] fetching JWKS " + uri);
        try {
            JWKSet keys = fetcher.fetch(target, timeout);
            if (keys == null) {
                throw new SignatureVerificationException(VerificationError.KEY_FETCH_ERROR,
                    "Failed to fetch JWKS from " + uri + ": empty response");
            }
            entry.snapshot = new Snapshot(keys, null, clock.instant());
            LOGGER.fine(() -> String.format(Locale.ROOT,
                "[agentcard-sdk] JWKS %s returned %d keys", uri, keys.getKeys().size()));
            return keys;
        } catch (SignatureVerificationException ex) {
            entry.snapshot = new Snapshot(null, ex, clock.instant());
            LOGGER.warning(() -> "[agentcard-sdk] " + ex.getMessage());
            throw ex;
        }
    }

    private void acquire(Entry entry, String uri, Duration timeout) throws SignatureVerificationException {
        try {
            if (!entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new SignatureVerificationException(VerificationError.KEY_FETCH_TIMEOUT,
                    "JWKS request to " + uri + " timed out after " + timeout.toMillis() + " ms");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SignatureVerificationException(VerificationError.KEY_FETCH_ERROR,
                "JWKS request to " + uri + " interrupted", ex);
        }
    }

    private static SignatureVerificationException replay(SignatureVerificationException failure) {
        return new SignatureVerificationException(failure.getError(), failure.getMessage(), failure);
    }

    private boolean isWithin(Snapshot snapshot, Duration window) {
        return clock.instant().isBefore(snapshot.at().plus(window));
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile Snapshot snapshot;
    }

    private record Snapshot(JWKSet keys, SignatureVerificationException failure, Instant at) {
    }
}
