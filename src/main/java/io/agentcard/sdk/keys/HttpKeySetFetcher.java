package io.agentcard.sdk.keys;

import com.nimbusds.jose.jwk.JWKSet;
import io.agentcard.sdk.SignatureVerificationException;
import io.agentcard.sdk.VerificationError;
import io.agentcard.sdk.internal.HttpUtil;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.text.ParseException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * {@link KeySetFetcher} issuing a single GET with the JDK {@link HttpClient}.
 */
public final class HttpKeySetFetcher implements KeySetFetcher {

    private final HttpClient httpClient;

    public HttpKeySetFetcher(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public JWKSet fetch(URI uri, Duration timeout) throws SignatureVerificationException {
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"https".equals(scheme) && !"http".equals(scheme)) {
            throw new SignatureVerificationException(VerificationError.KEY_FETCH_ERROR,
                "Failed to fetch JWKS from " + uri + ": unsupported scheme '" + uri.getScheme() + "'");
        }

        HttpResponse<String> response;
        try {
            response = HttpUtil.get(httpClient, uri, "application/json, application/jwk-set+json", timeout);
        } catch (HttpTimeoutException | TimeoutException ex) {
            throw new SignatureVerificationException(VerificationError.KEY_FETCH_TIMEOUT,
                "JWKS request to " + uri + " timed out after " + timeout.toMillis() + " ms", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SignatureVerificationException(VerificationError.KEY_FETCH_ERROR,
                "JWKS request to " + uri + " interrupted", ex);
        } catch (IOException ex) {
            throw new SignatureVerificationException(VerificationError.KEY_FETCH_ERROR,
                "Failed to fetch JWKS from " + uri + ": " + describe(ex), ex);
        }

        if (response.statusCode() != 200) {
            throw new SignatureVerificationException(VerificationError.KEY_FETCH_ERROR,
                "Failed to fetch JWKS from " + uri + ": expected 200 OK, got " + response.statusCode());
        }

        try {
            return JWKSet.parse(response.body());
        } catch (ParseException ex) {
            throw new SignatureVerificationException(VerificationError.KEY_FETCH_ERROR,
                "Failed to fetch JWKS from " + uri + ": response is not a JSON Web Key Set (" + ex.getMessage() + ")", ex);
        }
    }

    private static String describe(IOException ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
