package io.agentcard.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the Agent Card {@code signatures} array: a detached JWS with the payload left out.
 *
 * @param protectedHeader base64url encoded JWS protected header (JSON member {@code protected}).
 * @param signature       base64url encoded signature bytes.
 */
public record AgentCardSignature(
    @JsonProperty("protected") String protectedHeader,
    @JsonProperty("signature") String signature
) {
}
