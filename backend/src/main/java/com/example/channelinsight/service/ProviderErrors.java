package com.example.channelinsight.service;

import com.example.channelinsight.exception.ProviderException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

final class ProviderErrors {

    private ProviderErrors() {
    }

    static ProviderException translate(String provider, String operation, RestClientException ex) {
        if (ex instanceof RestClientResponseException response) {
            HttpStatusCode status = response.getStatusCode();
            boolean retryable = status.is5xxServerError() || status.value() == 429 || isQuotaRejection(response);
            return new ProviderException(provider,
                    operation + " failed with HTTP " + status.value(), false, retryable, ex);
        }
        if (ex instanceof ResourceAccessException && isTimeout(ex)) {
            return new ProviderException(provider, operation + " timed out", true, true, ex);
        }
        return new ProviderException(provider, operation + " failed: " + ex.getMessage(), false, true, ex);
    }

    private static boolean isTimeout(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SocketTimeoutException || current instanceof InterruptedIOException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    // YouTube reports rate limiting as 403 with a rateLimitExceeded or quotaExceeded reason.
    private static boolean isQuotaRejection(RestClientResponseException response) {
        if (response.getStatusCode().value() != 403) {
            return false;
        }
        String body = response.getResponseBodyAsString();
        return body.contains("rateLimitExceeded") || body.contains("userRateLimitExceeded");
    }
}
