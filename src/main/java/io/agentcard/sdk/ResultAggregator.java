package io.agentcard.sdk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Folds per-signature outcomes into a {@link VerificationResult}.
 */
public final class ResultAggregator {

    public static final String NO_SIGNATURES = "No signatures present in Agent Card";

    private ResultAggregator() {
    }

    public static VerificationResult aggregate(List<SignatureResult> results) {
        if (results == null || results.isEmpty()) {
            return new VerificationResult(false, List.of(),
                new VerificationResult.Summary(0, 0, 0, List.of(NO_SIGNATURES)));
        }

        List<SignatureResult> ordered = new ArrayList<>(results);
        ordered.sort(Comparator.comparingInt(SignatureResult::index));

        int validCount = 0;
        List<String> errors = new ArrayList<>();
        for (SignatureResult result : ordered) {
            if (result.valid()) {
                validCount++;
            } else if (result.error() != null) {
                errors.add("Signature " + (result.index() + 1) + ": " + result.error());
            }
        }

        int total = ordered.size();
        return new VerificationResult(
            validCount == total,
            ordered,
            new VerificationResult.Summary(total, validCount, total - validCount, errors)
        );
    }
}
