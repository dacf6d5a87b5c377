package com.openrag.authservice.domain;

import java.util.Arrays;
import java.util.Optional;

/** Why an OAuth connection is being made. */
public enum OAuthPurpose {
    /** Link an external account as an ingestion source. */
    DATA_SOURCE("data_source"),
    /** Sign in to the application. */
    APP_AUTH("app_auth");

    private final String wireName;

    OAuthPurpose(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<OAuthPurpose> fromWireName(String value) {
        return Arrays.stream(values()).filter(p -> p.wireName.equals(value)).findFirst();
    }
}
