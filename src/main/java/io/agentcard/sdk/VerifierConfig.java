package io.agentcard.sdk;

import io.agentcard.sdk.keys.HttpKeySetFetcher;
import io.agentcard.sdk.keys.KeySetFetcher;
import io.agentcard.sdk.keys.KeySetResolver;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link AgentCardVerifier} instances.
 */
public final class VerifierConfig {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = VerificationOptions.DEFAULT_TIMEOUT;
    public static final Duration DEFAULT_CACHE_MAX_AGE = KeySetResolver.DEFAULT_CACHE_MAX_AGE;
    public static final Duration DEFAULT_COOLDOWN = KeySetResolver.DEFAULT_COOLDOWN;
    public static final int DEFAULT_PARALLELISM = 1;

    private final HttpClient httpClient;
    private final KeySetFetcher keySetFetcher;
    private final Duration cacheMaxAge;
    private final Duration cooldown;
    private final int parallelism;
    private final Clock clock;

    private VerifierConfig(Builder builder) {
        this.httpClient = builder.httpClient;
        this.keySetFetcher = builder.keySetFetcher;
        this.cacheMaxAge = builder.cacheMaxAge;
        this.cooldown = builder.cooldown;
        this.parallelism = builder.parallelism;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static VerifierConfig defaults() {
        return builder().build();
    }

    public VerifierConfig withDefaults() {
        Duration resolvedMaxAge = Optional.ofNullable(cacheMaxAge).orElse(DEFAULT_CACHE_MAX_AGE);
        if (resolvedMaxAge.isNegative()) {
            throw new IllegalArgumentException("CacheMaxAge cannot be negative");
        }
        if (resolvedMaxAge.isZero()) {
            resolvedMaxAge = DEFAULT_CACHE_MAX_AGE;
        }

        Duration resolvedCooldown = Optional.ofNullable(cooldown).orElse(DEFAULT_COOLDOWN);
        if (resolvedCooldown.isNegative()) {
            throw new IllegalArgumentException("Cooldown cannot be negative");
        }
        if (resolvedCooldown.isZero()) {
            resolvedCooldown = DEFAULT_COOLDOWN;
        }

        if (parallelism < 0) {
            throw new IllegalArgumentException("Parallelism cannot be negative");
        }
        int resolvedParallelism = parallelism == 0 ? DEFAULT_PARALLELISM : parallelism;

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        }

        KeySetFetcher resolvedFetcher = keySetFetcher;
        if (resolvedFetcher == null) {
            resolvedFetcher = new HttpKeySetFetcher(resolvedClient);
        }

        return new Builder()
            .httpClient(resolvedClient)
            .keySetFetcher(resolvedFetcher)
            .cacheMaxAge(resolvedMaxAge)
            .cooldown(resolvedCooldown)
            .parallelism(resolvedParallelism)
            .clock(Optional.ofNullable(clock).orElse(Clock.systemUTC()))
            .buildInternal();
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public KeySetFetcher getKeySetFetcher() {
        return keySetFetcher;
    }

    public Duration getCacheMaxAge() {
        return cacheMaxAge;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public int getParallelism() {
        return parallelism;
    }

    public Clock getClock() {
        return clock;
    }

    public static final class Builder {
        private HttpClient httpClient;
        private KeySetFetcher keySetFetcher;
        private Duration cacheMaxAge;
        private Duration cooldown;
        private int parallelism;
        private Clock clock;

        /**
         * Client used by the default {@link HttpKeySetFetcher}. Ignored when a custom fetcher is supplied.
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder keySetFetcher(KeySetFetcher keySetFetcher) {
            this.keySetFetcher = keySetFetcher;
            return this;
        }

        public Builder cacheMaxAge(Duration cacheMaxAge) {
            this.cacheMaxAge = cacheMaxAge;
            return this;
        }

        public Builder cooldown(Duration cooldown) {
            this.cooldown = cooldown;
            return this;
        }

        /**
         * Number of signature entries verified concurrently. {@code 1} verifies them one after another.
         */
        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public VerifierConfig build() {
            return new VerifierConfig(this).withDefaults();
        }

        private VerifierConfig buildInternal() {
            return new VerifierConfig(this);
        }
    }
}
