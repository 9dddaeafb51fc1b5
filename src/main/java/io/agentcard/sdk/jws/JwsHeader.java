package io.agentcard.sdk.jws;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Recognised members of a JWS protected header. Anything else in the header is ignored.
 *
 * @param alg     signing algorithm, may be {@code null} when the header omits it.
 * @param typ     optional media type.
 * @param kid     optional key identifier.
 * @param jku     optional JWK Set URL.
 * @param jwksUri optional JWKS URI, consulted only when {@code jku} is absent.
 */
public record JwsHeader(
    String alg,
    String typ,
    String kid,
    String jku,
    @JsonProperty("jwks_uri") String jwksUri
) {

    /**
     * Returns the URI of the key set to verify against: {@code jku} when non-empty, otherwise {@code jwks_uri}
     * when non-empty, otherwise {@code null}.
     */
    public String keySetUri() {
        if (jku != null && !jku.isEmpty()) {
            return jku;
        }
        if (jwksUri != null && !jwksUri.isEmpty()) {
            return jwksUri;
        }
        return null;
    }

    /**
     * @return {@code kid} or {@code null} when absent or empty.
     */
    public String keyId() {
        return kid == null || kid.isEmpty() ? null : kid;
    }
}
