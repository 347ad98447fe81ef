package io.codescalpel.license;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Sends a verification request to the remote verifier.
 *
 * <p>{@link HttpVerifierTransport} is the production implementation.
 */
public interface VerifierTransport {

    /**
     * POST a JSON body.
     *
     * @param uri the verify endpoint
     * @param jsonBody request body
     * @param timeout per-request timeout
     * @return status and body of the response
     * @throws IOException on network failure or timeout
     * @throws InterruptedException if the calling thread is interrupted
     */
    Response post(URI uri, String jsonBody, Duration timeout) throws IOException, InterruptedException;

    /**
     * Raw verifier response.
     */
    record Response(int statusCode, String body) {

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
