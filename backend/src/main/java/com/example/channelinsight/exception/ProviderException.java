package com.example.channelinsight.exception;

public class ProviderException extends AnalysisException {

    private final String provider;
    private final boolean timeout;
    private final boolean retryable;

    public ProviderException(String provider, String message, boolean timeout, boolean retryable,
                             Throwable cause) {
        super(timeout ? ErrorCode.PROVIDER_TIMEOUT : ErrorCode.PROVIDER_ERROR,
                provider + ": " + message, cause);
        this.provider = provider;
        this.timeout = timeout;
        this.retryable = retryable;
    }

    public ProviderException(String provider, String message, boolean timeout, Throwable cause) {
        this(provider, message, timeout, true, cause);
    }

    public ProviderException(String provider, String message) {
        this(provider, message, false, true, null);
    }

    public String getProvider() {
        return provider;
    }

    public boolean isTimeout() {
        return timeout;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
