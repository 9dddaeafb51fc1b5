package io.agentcard.sdk;

import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import io.agentcard.sdk.jws.AlgorithmPolicy;
import io.agentcard.sdk.jws.DetachedAssembler;
import io.agentcard.sdk.jws.HeaderCodec;
import io.agentcard.sdk.jws.JwsHeader;
import io.agentcard.sdk.jws.JwsSignatureCheck;
import io.agentcard.sdk.keys.KeySetResolver;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Verifies a single signature entry: decode the header, apply the algorithm policy, resolve the key set, then
 * check the signature over the card's canonical payload.
 *
 * <p>{@link #verify} never throws. Every failure, including unexpected runtime faults, becomes an invalid
 * {@link SignatureResult}, so one broken entry cannot affect the others.</p>
 */
public final class SignatureVerifier {

    private static final Logger LOGGER = Logger.getLogger(SignatureVerifier.class.getName());

    static final String UNDEFINED_ENTRY = "Signature is undefined";
    static final String MISSING_KEY_URI = "No JWKS URI found in signature header (jku or jwks_uri required)";

    private final KeySetResolver keySetResolver;

    public SignatureVerifier(KeySetResolver keySetResolver) {
        this.keySetResolver = Objects.requireNonNull(keySetResolver, "keySetResolver");
    }

    /**
     * @param index            position of the entry in the card.
     * @param signature        the entry, {@code null} when the card holds a non-object at this position.
     * @param canonicalPayload canonical bytes of the card without its signatures.
     */
    public SignatureResult verify(int index, AgentCardSignature signature, byte[] canonicalPayload,
                                  VerificationOptions options) {
        if (signature == null) {
            return SignatureResult.failed(index, VerificationError.MALFORMED_ENTRY, UNDEFINED_ENTRY);
        }
        try {
            return verifyEntry(index, signature, canonicalPayload, options);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, ex, () -> "[agentcard-sdk] unexpected failure verifying signature " + (index + 1));
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            return SignatureResult.failed(index, VerificationError.INTERNAL_ERROR, "Unknown verification error: " + message);
        }
    }

    private SignatureResult verifyEntry(int index, AgentCardSignature signature, byte[] canonicalPayload,
                                        VerificationOptions options) {
        JwsHeader header;
        try {
            header = HeaderCodec.decode(signature.protectedHeader());
        } catch (SignatureVerificationException ex) {
            return SignatureResult.failed(index, ex.getError(), ex.getMessage());
        }

        try {
            AlgorithmPolicy.validate(header, options.allowInsecure());
        } catch (SignatureVerificationException ex) {
            return failed(index, header, ex);
        }

        String keySetUri = header.keySetUri();
        if (keySetUri == null) {
            return SignatureResult.failed(index, VerificationError.MISSING_KEY_URI, MISSING_KEY_URI)
                .withHeader(header.alg(), header.keyId());
        }

        try {
            AlgorithmPolicy.parseKeySetUri(keySetUri);
            String compact = DetachedAssembler.assemble(signature.protectedHeader(), canonicalPayload, signature.signature());
            JwsSignatureCheck check = JwsSignatureCheck.parse(compact);

            JWKSet keySet = keySetResolver.resolve(keySetUri, options.timeout());
            List<JWK> candidates = check.selectKeys(keySet);
            if (candidates.isEmpty()) {
                candidates = check.selectKeys(keySetResolver.reload(keySetUri, options.timeout()));
            }
            check.verify(candidates);
        } catch (SignatureVerificationException ex) {
            LOGGER.fine(() -> "[agentcard-sdk] signature " + (index + 1) + " rejected: " + ex.getMessage());
            return failed(index, header, ex).withKeySet(keySetUri);
        }

        return SignatureResult.verified(index, header.alg(), header.keyId(), keySetUri);
    }

    private static SignatureResult failed(int index, JwsHeader header, SignatureVerificationException ex) {
        return SignatureResult.failed(index, ex.getError(), ex.getMessage()).withHeader(header.alg(), header.keyId());
    }
}
