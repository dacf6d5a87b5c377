package com.openrag.authservice.domain;

/** The OAuth provider failed during code exchange or identity lookup. */
public class OAuthExchangeFailedException extends RuntimeException {

    private final String connectorType;

    public OAuthExchangeFailedException(String connectorType, String message, Throwable cause) {
        super(message, cause);
        this.connectorType = connectorType;
    }

    public String connectorType() {
        return connectorType;
    }
}
