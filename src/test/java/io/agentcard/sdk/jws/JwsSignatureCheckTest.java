package io.agentcard.sdk.jws;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSObject;
import com.nimbusds.jose.Payload;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;
import com.nimbusds.jose.util.Base64URL;
import io.agentcard.sdk.SignatureVerificationException;
import io.agentcard.sdk.VerificationError;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.security.interfaces.RSAPublicKey;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JwsSignatureCheckTest {

    private static final byte[] PAYLOAD = "{\"name\":\"Agent\"}".getBytes(StandardCharsets.UTF_8);

    private static ECKey signingKey;
    private static ECKey otherKey;

    @BeforeAll
    static void generateKeys() throws Exception {
        signingKey = new ECKeyGenerator(Curve.P_256).keyID("ec-1").generate();
        otherKey = new ECKeyGenerator(Curve.P_256).keyID("ec-2").generate();
    }

    @Test
    void verifiesWithMatchingKey() throws Exception {
        JwsSignatureCheck check = JwsSignatureCheck.parse(signEc(new JWSHeader.Builder(JWSAlgorithm.ES256).keyID("ec-1").build(), PAYLOAD));

        List<JWK> candidates = check.selectKeys(new JWKSet(List.of(otherKey.toPublicJWK(), signingKey.toPublicJWK())));

        assertEquals(1, candidates.size());
        assertDoesNotThrow(() -> check.verify(candidates));
    }

    @Test
    void triesEveryCandidateWhenHeaderHasNoKeyId() throws Exception {
        JwsSignatureCheck check = JwsSignatureCheck.parse(signEc(new JWSHeader.Builder(JWSAlgorithm.ES256).build(), PAYLOAD));

        List<JWK> candidates = check.selectKeys(new JWKSet(List.of(otherKey.toPublicJWK(), signingKey.toPublicJWK())));

        assertEquals(2, candidates.size());
        assertDoesNotThrow(() -> check.verify(candidates));
    }

    @Test
    void treatsEmptyKeyIdAsAbsent() throws Exception {
        JwsSignatureCheck check = JwsSignatureCheck.parse(signEc(new JWSHeader.Builder(JWSAlgorithm.ES256).keyID("").build(), PAYLOAD));

        List<JWK> candidates = check.selectKeys(new JWKSet(List.of(otherKey.toPublicJWK(), signingKey.toPublicJWK())));

        assertEquals(2, candidates.size());
        assertDoesNotThrow(() -> check.verify(candidates));
    }

    @Test
    void reportsMissingKey() throws Exception {
        JwsSignatureCheck check = JwsSignatureCheck.parse(signEc(new JWSHeader.Builder(JWSAlgorithm.ES256).keyID("unknown").build(), PAYLOAD));

        List<JWK> candidates = check.selectKeys(new JWKSet(signingKey.toPublicJWK()));

        assertTrue(candidates.isEmpty());
        SignatureVerificationException ex = assertThrows(SignatureVerificationException.class, () -> check.verify(candidates));
        assertEquals(VerificationError.CRYPTOGRAPHIC_MISMATCH, ex.getError());
        assertTrue(ex.getMessage().contains("no applicable key"));
    }

    @Test
    void skipsKeysPublishedForAnotherAlgorithm() throws Exception {
        JWK es384Key = new ECKey.Builder(signingKey.toPublicJWK()).algorithm(JWSAlgorithm.ES384).build();
        JwsSignatureCheck check = JwsSignatureCheck.parse(signEc(new JWSHeader.Builder(JWSAlgorithm.ES256).keyID("ec-1").build(), PAYLOAD));

        assertTrue(check.selectKeys(new JWKSet(es384Key)).isEmpty());
    }

    @Test
    void rejectsTamperedPayload() throws Exception {
        String compact = signEc(new JWSHeader.Builder(JWSAlgorithm.ES256).keyID("ec-1").build(), PAYLOAD);
        String[] parts = compact.split("\\.");
        String tampered = parts[0] + "." + Base64URL.encode("{\"name\":\"Other\"}") + "." + parts[2];
        JwsSignatureCheck check = JwsSignatureCheck.parse(tampered);

        List<JWK> candidates = check.selectKeys(new JWKSet(signingKey.toPublicJWK()));

        SignatureVerificationException ex = assertThrows(SignatureVerificationException.class, () -> check.verify(candidates));
        assertEquals(VerificationError.CRYPTOGRAPHIC_MISMATCH, ex.getError());
    }

    @Test
    void rejectsShortRsaKeys() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(1024);
        KeyPair pair = generator.generateKeyPair();
        RSAKey weak = new RSAKey.Builder((RSAPublicKey) pair.getPublic()).keyID("weak").build();

        String header = new JWSHeader.Builder(JWSAlgorithm.RS256).keyID("weak").build().toBase64URL().toString();
        String payload = Base64URL.encode(PAYLOAD).toString();
        Signature signer = Signature.getInstance("SHA256withRSA");
        signer.initSign(pair.getPrivate());
        signer.update((header + "." + payload).getBytes(StandardCharsets.US_ASCII));
        String compact = header + "." + payload + "." + Base64URL.encode(signer.sign());

        JwsSignatureCheck check = JwsSignatureCheck.parse(compact);
        List<JWK> candidates = check.selectKeys(new JWKSet(weak));

        assertEquals(1, candidates.size());
        SignatureVerificationException ex = assertThrows(SignatureVerificationException.class, () -> check.verify(candidates));
        assertTrue(ex.getMessage().contains("2048"));
    }

    @Test
    void rejectsUnparseableStructure() {
        SignatureVerificationException ex = assertThrows(SignatureVerificationException.class,
            () -> JwsSignatureCheck.parse("only-one-part"));
        assertEquals(VerificationError.CRYPTOGRAPHIC_MISMATCH, ex.getError());
    }

    private static String signEc(JWSHeader header, byte[] payload) throws Exception {
        JWSObject jws = new JWSObject(header, new Payload(payload));
        jws.sign(new ECDSASigner(signingKey));
        return jws.serialize();
    }
}
