package io.agentcard.sdk.internal;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Helper methods for issuing HTTP requests.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    /**
     * Issues a GET and reads the body as UTF-8. The whole exchange, body included, is bounded by {@code timeout};
     * the request is cancelled when it elapses.
     */
    public static HttpResponse<String> get(HttpClient client, URI uri, String accept, Duration timeout)
        throws IOException, InterruptedException, TimeoutException {

        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .header("Accept", accept)
            .timeout(timeout)
            .GET()
            .build();

        CompletableFuture<HttpResponse<String>> future =
            client.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw ex;
        } catch (InterruptedException ex) {
            future.cancel(true);
            throw ex;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException(cause == null ? ex.getMessage() : cause.getMessage(), cause);
        }
    }
}
