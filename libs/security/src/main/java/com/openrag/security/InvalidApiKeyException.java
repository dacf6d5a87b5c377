package com.openrag.security;

/**
 * A machine client presented no usable API key, or one the validator rejected.
 */
public class InvalidApiKeyException extends RuntimeException {

    /** Why the key was rejected; each maps to a stable error string on the wire. */
    public enum Reason {
        MISSING("API key required",
                "Provide API key via X-API-Key header or Authorization: Bearer header"),
        INVALID("Invalid API key",
                "The provided API key is invalid or has been revoked");

        private final String error;
        private final String detail;

        Reason(String error, String detail) {
            this.error = error;
            this.detail = detail;
        }

        public String error() {
            return error;
        }

        public String detail() {
            return detail;
        }
    }

    private final Reason reason;

    public InvalidApiKeyException(Reason reason) {
        super(reason.error());
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
