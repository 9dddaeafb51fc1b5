package io.agentcard.sdk;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nimbusds.jose.jwk.JWKSet;
import io.agentcard.sdk.canonical.CanonicalSerializer;
import io.agentcard.sdk.keys.KeySetFetcher;
import io.agentcard.sdk.keys.KeySetResolver;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SignatureVerifierTest {

    private static final String JKU = "https://keys.example.com/jwks.json";

    private final ObjectNode card = CardFixtures.sampleCard();
    private final byte[] payload = CanonicalSerializer.canonicalize(card);

    @Test
    void undefinedEntryIsMalformed() {
        SignatureVerifier verifier = verifierFor((uri, timeout) -> CardFixtures.publicKeys(CardFixtures.RSA_KEY), Clock.systemUTC());

        SignatureResult result = verifier.verify(3, null, payload, VerificationOptions.defaults());

        assertFalse(result.valid());
        assertEquals(3, result.index());
        assertEquals(VerificationError.MALFORMED_ENTRY, result.code());
        assertEquals("Signature is undefined", result.error());
    }

    @Test
    void runtimeFaultBecomesInternalError() {
        KeySetFetcher broken = (uri, timeout) -> {
            throw new IllegalStateException("boom");
        };
        SignatureVerifier verifier = verifierFor(broken, Clock.systemUTC());

        SignatureResult result = verifier.verify(0, CardFixtures.signRsa(card, JKU), payload, VerificationOptions.defaults());

        assertFalse(result.valid());
        assertEquals(VerificationError.INTERNAL_ERROR, result.code());
        assertEquals("Unknown verification error: boom", result.error());
    }

    @Test
    void malformedKeyUriIsReportedAsSuchWhenInsecureAllowed() {
        AtomicInteger fetches = new AtomicInteger();
        SignatureVerifier verifier = verifierFor((uri, timeout) -> {
            fetches.incrementAndGet();
            return CardFixtures.publicKeys(CardFixtures.EC_KEY);
        }, Clock.systemUTC());
        VerificationOptions insecure = VerificationOptions.defaults().withAllowInsecure(true);

        for (String member : new String[]{"jku", "jwks_uri"}) {
            AgentCardSignature entry = new AgentCardSignature(
                CardFixtures.encodeHeader("{\"alg\":\"ES256\",\"" + member + "\":\"http://exa mple.com/keys\"}"), "c2ln");

            SignatureResult result = verifier.verify(0, entry, payload, insecure);

            assertFalse(result.valid());
            assertEquals(VerificationError.INVALID_KEY_URI, result.code(), member);
            assertEquals("Invalid JWKS URI format", result.error());
            assertEquals("ES256", result.algorithm());
        }
        assertEquals(0, fetches.get());
    }

    @Test
    void unknownKeyWithinCooldownDoesNotRefetch() {
        AtomicInteger fetches = new AtomicInteger();
        SignatureVerifier verifier = verifierFor((uri, timeout) -> {
            fetches.incrementAndGet();
            return CardFixtures.publicKeys(CardFixtures.EC_KEY);
        }, Clock.systemUTC());

        SignatureResult result = verifier.verify(0, CardFixtures.signRsa(card, JKU), payload, VerificationOptions.defaults());

        assertFalse(result.valid());
        assertEquals(VerificationError.CRYPTOGRAPHIC_MISMATCH, result.code());
        assertTrue(result.error().contains("no applicable key"));
        assertEquals("RS256", result.algorithm());
        assertEquals(JKU, result.jwksUri());
        assertEquals(SignatureResult.DETAILS_FAILED, result.details());
        assertEquals(1, fetches.get());
    }

    @Test
    void rotatedKeyIsPickedUpByReload() {
        AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2024-01-01T00:00:00Z"));
        AtomicReference<JWKSet> published = new AtomicReference<>(CardFixtures.publicKeys(CardFixtures.EC_KEY));
        AtomicInteger fetches = new AtomicInteger();
        SignatureVerifier verifier = verifierFor((uri, timeout) -> {
            fetches.incrementAndGet();
            return published.get();
        }, new SettableClock(now));

        AgentCardSignature rsa = CardFixtures.signRsa(card, JKU);
        assertFalse(verifier.verify(0, rsa, payload, VerificationOptions.defaults()).valid());

        published.set(CardFixtures.publicKeys(CardFixtures.EC_KEY, CardFixtures.RSA_KEY));
        now.set(now.get().plusSeconds(31));

        SignatureResult result = verifier.verify(0, rsa, payload, VerificationOptions.defaults());

        assertTrue(result.valid(), result.error());
        assertEquals(2, fetches.get());
    }

    private static SignatureVerifier verifierFor(KeySetFetcher fetcher, Clock clock) {
        return new SignatureVerifier(new KeySetResolver(fetcher, Duration.ofMinutes(5), Duration.ofSeconds(30), clock));
    }

    private static final class SettableClock extends Clock {
        private final AtomicReference<Instant> now;

        SettableClock(AtomicReference<Instant> now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now.get();
        }
    }
}
