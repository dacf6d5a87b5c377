package com.openrag.security;

/**
 * Required authentication settings are missing or unusable.
 * <p>
 * Fatal when raised at startup (key material, half-configured OAuth providers). Also raised when
 * an OAuth flow is requested while the deployment runs without OAuth credentials.
 */
public class AuthConfigurationException extends RuntimeException {

    public AuthConfigurationException(String message) {
        super(message);
    }

    public AuthConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
