package io.agentcard.sdk.jws;

import io.agentcard.sdk.SignatureVerificationException;
import io.agentcard.sdk.VerificationError;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * Header checks applied before any key material is fetched.
 *
 * <p>Only asymmetric algorithms are accepted. HMAC algorithms are deliberately absent: a verifier that accepted
 * them could be made to use a published public key as a shared secret.</p>
 */
public final class AlgorithmPolicy {

    public static final String ALGORITHM_NONE = "none";

    public static final Set<String> SUPPORTED_ALGORITHMS = Set.of(
        "RS256", "RS384", "RS512",
        "ES256", "ES384", "ES512",
        "PS256", "PS384", "PS512",
        "EdDSA"
    );

    private AlgorithmPolicy() {
    }

    /**
     * Validates the algorithm and, unless {@code allowInsecure} is set, the transport of the key set URI.
     * {@code alg=none} is rejected regardless of {@code allowInsecure}.
     */
    public static void validate(JwsHeader header, boolean allowInsecure) throws SignatureVerificationException {
        String alg = header.alg();
        if (alg == null || alg.isEmpty()) {
            throw new SignatureVerificationException(VerificationError.MISSING_ALGORITHM,
                "Missing algorithm (alg) in signature header");
        }
        if (ALGORITHM_NONE.equals(alg)) {
            throw new SignatureVerificationException(VerificationError.DISALLOWED_ALGORITHM,
                "Algorithm \"none\" is not allowed for security reasons");
        }
        if (!SUPPORTED_ALGORITHMS.contains(alg)) {
            throw new SignatureVerificationException(VerificationError.UNSUPPORTED_ALGORITHM,
                "Unsupported algorithm: " + alg);
        }

        String keySetUri = header.keySetUri();
        if (keySetUri != null && !allowInsecure) {
            URI uri = parseKeySetUri(keySetUri);
            if (!"https".equals(uri.getScheme().toLowerCase(Locale.ROOT))) {
                throw new SignatureVerificationException(VerificationError.INSECURE_KEY_URI,
                    "JWKS URI must use HTTPS for security");
            }
        }
    }

    /**
     * Parses a key set URI, requiring an absolute URI with scheme and host.
     */
    public static URI parseKeySetUri(String value) throws SignatureVerificationException {
        try {
            URI uri = new URI(value);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new SignatureVerificationException(VerificationError.INVALID_KEY_URI,
                    "Invalid JWKS URI format");
            }
            return uri;
        } catch (URISyntaxException ex) {
            throw new SignatureVerificationException(VerificationError.INVALID_KEY_URI,
                "Invalid JWKS URI format", ex);
        }
    }
}
