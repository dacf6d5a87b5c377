package com.openrag.authservice.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * An initiated OAuth connection waiting for its callback.
 *
 * @param connectionId server-assigned id, echoed by the client at callback
 * @param connectorType provider connector type
 * @param purpose login or data-source link
 * @param connectionName display name of the connection
 * @param redirectUri redirect URI sent to the provider; must be repeated at code exchange
 * @param stateNonce single-use state bound to this connection
 * @param ownerUserId user who started the flow, null when anonymous
 * @param webhookUrl change-notification URL for the connector, null when not configured
 * @param createdAt when init ran
 * @param expiresAt after this instant the callback is rejected
 */
public record PendingConnection(
        String connectionId,
        String connectorType,
        OAuthPurpose purpose,
        String connectionName,
        String redirectUri,
        String stateNonce,
        String ownerUserId,
        String webhookUrl,
        Instant createdAt,
        Instant expiresAt) {

    public PendingConnection {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(connectorType, "connectorType");
        Objects.requireNonNull(purpose, "purpose");
        Objects.requireNonNull(stateNonce, "stateNonce");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    /**
     * The same connection as a data source owned by {@code owner}, which is how a completed app
     * login keeps its Google Drive credentials.
     */
    public PendingConnection asDataSource(String name, String owner) {
        return new PendingConnection(connectionId, connectorType, OAuthPurpose.DATA_SOURCE, name,
                redirectUri, stateNonce, owner, webhookUrl, createdAt, expiresAt);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "PendingConnection[connectionId=" + connectionId + ", connectorType=" + connectorType
                + ", purpose=" + purpose + ", ownerUserId=" + ownerUserId + ", expiresAt=" + expiresAt + "]";
    }
}
