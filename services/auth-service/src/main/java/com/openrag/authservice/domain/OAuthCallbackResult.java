package com.openrag.authservice.domain;

/**
 * Outcome of a successful OAuth callback.
 *
 * <p>For {@link OAuthPurpose#APP_AUTH} the result carries a freshly minted session token. It is
 * meant for the session cookie only and must not be written into a response body.
 *
 * @param connectionId the completed connection
 * @param purpose connection purpose
 * @param connectorType connector type
 * @param userId signed-in user for app login, connection owner for data sources
 * @param sessionToken session token for app login, null for data sources
 * @param dataSourceConnectionId for app login, the Google Drive data source the login credentials
 *     were kept under; null for data sources
 */
public record OAuthCallbackResult(
        String connectionId,
        OAuthPurpose purpose,
        String connectorType,
        String userId,
        String sessionToken,
        String dataSourceConnectionId) {

    public static final String STATUS_AUTHENTICATED = "authenticated";

    public boolean isAppLogin() {
        return purpose == OAuthPurpose.APP_AUTH;
    }

    @Override
    public String toString() {
        return "OAuthCallbackResult[connectionId=" + connectionId + ", purpose=" + purpose
                + ", connectorType=" + connectorType + ", userId=" + userId
                + ", dataSourceConnectionId=" + dataSourceConnectionId + "]";
    }
}
