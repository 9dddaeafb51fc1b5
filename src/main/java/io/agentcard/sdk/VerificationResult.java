package io.agentcard.sdk;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.agentcard.sdk.internal.Json;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Card-level verdict. {@code valid} holds only when at least one signature is present and every signature verified.
 *
 * @param valid      overall verdict.
 * @param signatures per-entry outcomes in card order.
 * @param summary    counts and collected error messages.
 */
@JsonPropertyOrder({"valid", "signatures", "summary"})
public record VerificationResult(
    boolean valid,
    List<SignatureResult> signatures,
    Summary summary
) {

    public VerificationResult {
        signatures = signatures == null ? List.of() : List.copyOf(signatures);
    }

    /**
     * Renders the result in its wire form. Absent optional members are omitted.
     */
    public String toJson() {
        try {
            return Json.mapper().writeValueAsString(this);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    @JsonPropertyOrder({"total", "valid", "failed", "errors"})
    public record Summary(int total, int valid, int failed, List<String> errors) {

        public Summary {
            errors = errors == null ? List.of() : List.copyOf(errors);
        }
    }
}
