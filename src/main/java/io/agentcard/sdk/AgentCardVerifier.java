package io.agentcard.sdk;

import io.agentcard.sdk.canonical.CanonicalSerializer;
import io.agentcard.sdk.jws.HeaderCodec;
import io.agentcard.sdk.jws.JwsHeader;
import io.agentcard.sdk.keys.KeySetResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * <p>
 * Entry point for verifying the signatures of an Agent Card. The verifier is thread-safe: create one instance per
 * process and reuse it, so the key set cache it owns is shared by every verification.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Every entry of the card's {@code signatures} array is verified independently; a failing entry never stops
 *       the others.</li>
 *   <li>The card is valid only when it carries at least one signature and all of them verify.</li>
 *   <li>Key sets are fetched once per URI and cached (see {@link KeySetResolver}).</li>
 *   <li>With {@link VerifierConfig#getParallelism()} above one, entries are verified on a verifier-owned pool;
 *       results are returned in card order either way.</li>
 * </ul>
 */
public final class AgentCardVerifier implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(AgentCardVerifier.class.getName());

    private final VerifierConfig config;
    private final KeySetResolver keySetResolver;
    private final SignatureVerifier signatureVerifier;
    private final ExecutorService executor;

    public AgentCardVerifier() {
        this(VerifierConfig.defaults());
    }

    public AgentCardVerifier(VerifierConfig config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.keySetResolver = new KeySetResolver(
            this.config.getKeySetFetcher(),
            this.config.getCacheMaxAge(),
            this.config.getCooldown(),
            this.config.getClock()
        );
        this.signatureVerifier = new SignatureVerifier(keySetResolver);
        this.executor = this.config.getParallelism() > 1
            ? Executors.newFixedThreadPool(this.config.getParallelism(), new VerifierThreadFactory())
            : null;
    }

    public VerificationResult verify(AgentCard card) {
        return verify(card, VerificationOptions.defaults());
    }

    /**
     * Verifies every signature of {@code card}. Never throws for card content; failures are reported per entry.
     */
    public VerificationResult verify(AgentCard card, VerificationOptions options) {
        Objects.requireNonNull(card, "card");
        VerificationOptions resolved = options == null ? VerificationOptions.defaults() : options;

        List<AgentCardSignature> signatures = card.signatures();
        if (signatures.isEmpty()) {
            LOGGER.info(() -> "[agentcard-sdk] Agent Card carries no signatures");
            return ResultAggregator.aggregate(List.of());
        }

        byte[] payload = CanonicalSerializer.canonicalize(card);
        List<SignatureResult> results = executor == null
            ? verifySequentially(signatures, payload, resolved)
            : verifyConcurrently(signatures, payload, resolved);

        VerificationResult result = ResultAggregator.aggregate(results);
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[agentcard-sdk] %d of %d signatures verified", result.summary().valid(), result.summary().total()));
        return result;
    }

    /**
     * Decodes the protected header of {@code signature} without verifying anything.
     *
     * @return the header, or empty when it does not decode.
     */
    public static Optional<JwsHeader> inspectSignatureHeader(AgentCardSignature signature) {
        if (signature == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(HeaderCodec.decode(signature.protectedHeader()));
        } catch (SignatureVerificationException ex) {
            return Optional.empty();
        }
    }

    public KeySetResolver keySetResolver() {
        return keySetResolver;
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private List<SignatureResult> verifySequentially(List<AgentCardSignature> signatures, byte[] payload,
                                                     VerificationOptions options) {
        List<SignatureResult> results = new ArrayList<>(signatures.size());
        for (int i = 0; i < signatures.size(); i++) {
            results.add(signatureVerifier.verify(i, signatures.get(i), payload, options));
        }
        return results;
    }

    private List<SignatureResult> verifyConcurrently(List<AgentCardSignature> signatures, byte[] payload,
                                                     VerificationOptions options) {
        List<CompletableFuture<SignatureResult>> futures = new ArrayList<>(signatures.size());
        for (int i = 0; i < signatures.size(); i++) {
            int index = i;
            AgentCardSignature signature = signatures.get(i);
            futures.add(CompletableFuture
                .supplyAsync(() -> signatureVerifier.verify(index, signature, payload, options), executor)
                .exceptionally(ex -> SignatureResult.failed(index, VerificationError.INTERNAL_ERROR,
                    "Unknown verification error: " + ex.getMessage())));
        }

        List<SignatureResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<SignatureResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private static final class VerifierThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "agentcard-verifier-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
