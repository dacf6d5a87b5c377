/**
 * Domain layer: OAuth connection flow and discovery documents.
 *
 * <ul>
 *   <li>Depends on {@code com.openrag.security} for tokens and identities
 *   <li>Must not depend on the {@code api}, {@code config} or {@code infrastructure} packages
 *   <li>Collaborators that reach external systems ({@link OAuthTokenExchanger}, {@link
 *       ProviderIdentityResolver}, {@link ConnectionCredentialStore}) are ports implemented in
 *       {@code infrastructure}
 * </ul>
 */
package com.openrag.authservice.domain;
