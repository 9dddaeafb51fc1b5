package io.agentcard.sdk;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Outcome of verifying one entry of the card's {@code signatures} array.
 *
 * @param index     position of the entry in the card.
 * @param valid     whether the signature verified.
 * @param algorithm header {@code alg}, when the header decoded.
 * @param keyId     header {@code kid}, when present.
 * @param jwksUri   key set URI the entry was checked against, once resolution started.
 * @param error     human-readable failure reason.
 * @param details   verification summary, present once the cryptographic stage was reached.
 * @param code      failure category, {@code null} for valid entries. Not part of the JSON form.
 */
@JsonPropertyOrder({"index", "valid", "algorithm", "keyId", "jwksUri", "error", "details"})
public record SignatureResult(
    int index,
    boolean valid,
    String algorithm,
    String keyId,
    String jwksUri,
    String error,
    String details,
    @JsonIgnore VerificationError code
) {

    public static final String DETAILS_VERIFIED = "Signature verified successfully";
    public static final String DETAILS_FAILED = "Signature verification failed";

    public static SignatureResult verified(int index, String algorithm, String keyId, String jwksUri) {
        return new SignatureResult(index, true, algorithm, keyId, jwksUri, null, DETAILS_VERIFIED, null);
    }

    public static SignatureResult failed(int index, VerificationError code, String error) {
        return new SignatureResult(index, false, null, null, null, error, null, code);
    }

    public SignatureResult withHeader(String algorithm, String keyId) {
        return new SignatureResult(index, valid, algorithm, keyId, jwksUri, error, details, code);
    }

    public SignatureResult withKeySet(String jwksUri) {
        return new SignatureResult(index, valid, algorithm, keyId, jwksUri, error, valid ? details : DETAILS_FAILED, code);
    }
}
