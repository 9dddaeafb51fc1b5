package io.agentcard.sdk.keys;

import com.nimbusds.jose.jwk.JWKSet;
import io.agentcard.sdk.SignatureVerificationException;

import java.net.URI;
import java.time.Duration;

/**
 * Retrieves a JSON Web Key Set from its published location.
 */
@FunctionalInterface
public interface KeySetFetcher {

    /**
     * @throws SignatureVerificationException with {@code KEY_FETCH_TIMEOUT} when {@code timeout} elapses, or
     *                                        {@code KEY_FETCH_ERROR} for any other failure.
     */
    JWKSet fetch(URI uri, Duration timeout) throws SignatureVerificationException;
}
