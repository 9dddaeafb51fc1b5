package io.agentcard.sdk;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link VerificationResult} as console lines.
 */
public final class ResultFormatter {

    private static final String PASS = "✅";
    private static final String FAIL = "❌";
    private static final String WARN = "⚠️ ";

    private ResultFormatter() {
    }

    public static List<String> format(VerificationResult result) {
        List<String> lines = new ArrayList<>();
        VerificationResult.Summary summary = result.summary();
        if (summary.total() == 0) {
            lines.add(WARN + " " + ResultAggregator.NO_SIGNATURES);
            return lines;
        }

        lines.add((result.valid() ? PASS : FAIL) + " Signature verification: "
            + summary.valid() + "/" + summary.total() + " signatures valid");

        for (int i = 0; i < result.signatures().size(); i++) {
            SignatureResult signature = result.signatures().get(i);
            StringBuilder line = new StringBuilder()
                .append(signature.valid() ? PASS : FAIL)
                .append(" Signature ").append(i + 1).append('/').append(summary.total());
            if (signature.algorithm() != null && !signature.algorithm().isEmpty()) {
                line.append(": ").append(signature.algorithm());
            }
            if (signature.keyId() != null && !signature.keyId().isEmpty()) {
                line.append(" (key: ").append(signature.keyId()).append(')');
            }
            String host = host(signature.jwksUri());
            if (host != null) {
                line.append(" from ").append(host);
            }
            lines.add(line.toString());

            if (signature.error() != null && !signature.error().isEmpty()) {
                lines.add("   Error: " + signature.error());
            }
            if (signature.valid() && signature.details() != null && !signature.details().isEmpty()) {
                lines.add("   " + signature.details());
            }
        }
        return lines;
    }

    private static String host(String uri) {
        if (uri == null || uri.isEmpty()) {
            return null;
        }
        try {
            return new URI(uri).getHost();
        } catch (URISyntaxException ex) {
            // shown without origin
            return null;
        }
    }
}
