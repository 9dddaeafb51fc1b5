package io.agentcard.sdk.jws;

import java.util.Base64;

/**
 * Rebuilds the compact JWS serialization of a detached signature. Cards transmit only the protected header and
 * the signature; the payload is the canonical form of the card being verified.
 */
public final class DetachedAssembler {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private DetachedAssembler() {
    }

    public static String assemble(String protectedHeader, byte[] canonicalPayload, String signature) {
        return nullToEmpty(protectedHeader) + '.' + ENCODER.encodeToString(canonicalPayload) + '.' + nullToEmpty(signature);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
