package io.agentcard.sdk.jws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentcard.sdk.SignatureVerificationException;
import io.agentcard.sdk.VerificationError;
import io.agentcard.sdk.internal.Json;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Decodes base64url encoded JWS protected headers.
 */
public final class HeaderCodec {

    private HeaderCodec() {
    }

    public static JwsHeader decode(String protectedHeader) throws SignatureVerificationException {
        if (protectedHeader == null || protectedHeader.isEmpty()) {
            throw malformed("value is missing", null);
        }

        byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(protectedHeader);
        } catch (IllegalArgumentException ex) {
            throw malformed("not valid base64url (" + ex.getMessage() + ")", ex);
        }

        String json;
        try {
            json = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(raw))
                .toString();
        } catch (CharacterCodingException ex) {
            throw malformed("not valid UTF-8", ex);
        }

        JsonNode node;
        try {
            node = Json.mapper().readTree(json);
        } catch (JsonProcessingException ex) {
            throw malformed(ex.getOriginalMessage(), ex);
        }
        if (node == null || !node.isObject()) {
            throw malformed("header is not a JSON object", null);
        }

        return new JwsHeader(
            text(node, "alg"),
            text(node, "typ"),
            text(node, "kid"),
            text(node, "jku"),
            text(node, "jwks_uri")
        );
    }

    private static String text(JsonNode node, String field) throws SignatureVerificationException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw malformed("'" + field + "' must be a string", null);
        }
        return value.asText();
    }

    private static SignatureVerificationException malformed(String reason, Throwable cause) {
        return new SignatureVerificationException(
            VerificationError.MALFORMED_HEADER,
            "Invalid protected header format: " + reason,
            cause
        );
    }
}
