package io.agentcard.sdk.jws;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSObject;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.ECDSAVerifier;
import com.nimbusds.jose.crypto.Ed25519Verifier;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKMatcher;
import com.nimbusds.jose.jwk.JWKSelector;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.OctetKeyPair;
import com.nimbusds.jose.jwk.RSAKey;
import io.agentcard.sdk.SignatureVerificationException;
import io.agentcard.sdk.VerificationError;

import java.text.ParseException;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Cryptographic check of an assembled compact JWS against a JSON Web Key Set.
 *
 * <p>Candidate keys are those whose type and curve fit the header algorithm, whose {@code kid} equals the
 * header's (when the header names one), whose {@code use} is {@code sig} or absent, and whose {@code alg} is the
 * header algorithm or absent. The signature is accepted when any candidate verifies it.</p>
 */
public final class JwsSignatureCheck {

    public static final int MIN_RSA_KEY_SIZE = 2048;

    private final JWSObject jwsObject;

    private JwsSignatureCheck(JWSObject jwsObject) {
        this.jwsObject = jwsObject;
    }

    public static JwsSignatureCheck parse(String compactJws) throws SignatureVerificationException {
        Objects.requireNonNull(compactJws, "compactJws");
        try {
            return new JwsSignatureCheck(JWSObject.parse(compactJws));
        } catch (ParseException ex) {
            throw mismatch("invalid JWS structure (" + ex.getMessage() + ")", ex);
        }
    }

    public JWSAlgorithm algorithm() {
        return jwsObject.getHeader().getAlgorithm();
    }

    public List<JWK> selectKeys(JWKSet keySet) {
        JWSHeader header = jwsObject.getHeader();
        if (header.getKeyID() != null && header.getKeyID().isEmpty()) {
            // empty kid means no kid
            header = new JWSHeader.Builder(header).keyID(null).build();
        }
        JWKMatcher matcher = JWKMatcher.forJWSHeader(header);
        if (matcher == null || keySet == null) {
            return Collections.emptyList();
        }
        return new JWKSelector(matcher).select(keySet);
    }

    /**
     * Verifies the signature with each candidate in turn.
     *
     * @throws SignatureVerificationException with {@link VerificationError#CRYPTOGRAPHIC_MISMATCH} when no candidate
     *                                        produces a match.
     */
    public void verify(List<JWK> candidates) throws SignatureVerificationException {
        if (candidates == null || candidates.isEmpty()) {
            throw mismatch("no applicable key found in the JSON Web Key Set", null);
        }

        String reason = "signature does not match";
        JOSEException lastError = null;
        for (JWK candidate : candidates) {
            try {
                if (jwsObject.verify(verifierFor(candidate))) {
                    return;
                }
            } catch (JOSEException ex) {
                lastError = ex;
                reason = ex.getMessage();
            }
        }
        throw mismatch(reason, lastError);
    }

    private JWSVerifier verifierFor(JWK key) throws JOSEException {
        if (key instanceof RSAKey) {
            RSAKey rsaKey = (RSAKey) key;
            if (rsaKey.size() < MIN_RSA_KEY_SIZE) {
                throw new JOSEException(algorithm() + " requires an RSA key of " + MIN_RSA_KEY_SIZE + " bits or larger");
            }
            return new RSASSAVerifier(rsaKey);
        }
        if (key instanceof ECKey) {
            return new ECDSAVerifier((ECKey) key);
        }
        if (key instanceof OctetKeyPair) {
            return new Ed25519Verifier(((OctetKeyPair) key).toPublicJWK());
        }
        throw new JOSEException("unsupported key type " + key.getKeyType());
    }

    private static SignatureVerificationException mismatch(String reason, Throwable cause) {
        return new SignatureVerificationException(
            VerificationError.CRYPTOGRAPHIC_MISMATCH,
            "Signature verification failed: " + reason,
            cause
        );
    }
}
