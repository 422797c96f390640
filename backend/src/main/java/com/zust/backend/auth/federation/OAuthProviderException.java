package com.zust.backend.auth.federation;

import lombok.Getter;

/**
 * Provider call failed or answered with something unusable.
 * upstreamStatus is null when no HTTP response was received.
 */
@Getter
public class OAuthProviderException extends RuntimeException {

    public enum Stage {
        EXCHANGE,
        FETCH
    }

    private final String provider;
    private final Stage stage;
    private final Integer upstreamStatus;
    private final String upstreamBody;

    public OAuthProviderException(String provider, Stage stage, Integer upstreamStatus, String upstreamBody, String message) {
        super(message);
        this.provider = provider;
        this.stage = stage;
        this.upstreamStatus = upstreamStatus;
        this.upstreamBody = upstreamBody;
    }

    public OAuthProviderException(String provider, Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.stage = stage;
        this.upstreamStatus = null;
        this.upstreamBody = null;
    }
}
