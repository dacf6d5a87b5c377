package com.openrag.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.interfaces.RSAPublicKey;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Issues and verifies session tokens.
 * <p>
 * Tokens are compact JWS signed with the process {@link KeyMaterial}. Their claims are
 * OIDC-shaped so OpenSearch can validate them as an identity provider would:
 * {@code iss, sub, aud, exp, iat, auth_time, email, name, preferred_username} plus the RBAC
 * claims {@code roles}, {@code user_roles} and {@code groups}.
 * <p>
 * {@link #verifyToken(String)} is binary on purpose: a bad signature, an expired token, a
 * foreign issuer or audience and plain garbage all yield {@link Optional#empty()}. The reason
 * is only logged at DEBUG.
 * <p>
 * Thread-safe; one instance serves every request.
 */
public final class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    /** Lifetime of browser session tokens, equal to the {@code auth_token} cookie max-age. */
    public static final Duration DEFAULT_SESSION_LIFETIME = Duration.ofDays(7);

    /** Audiences written into every token; a token must name at least one of them. */
    public static final List<String> DEFAULT_AUDIENCES = List.of("opensearch", "openrag");

    /** Issuer used when no FQDN is configured. */
    public static final String DEFAULT_ISSUER = "http://openrag-backend:8000";

    /** Backend role granted when the user carries none. */
    public static final String DEFAULT_ROLE = "openrag_user";

    // Re-mint the cached anonymous token this long before it expires.
    private static final Duration ANONYMOUS_TOKEN_RENEWAL = Duration.ofHours(1);

    /**
     * Token settings.
     *
     * @param issuer          {@code iss} written and required on verification
     * @param audiences       {@code aud} written; verification requires an intersection
     * @param sessionLifetime default token lifetime
     */
    public record Settings(String issuer, List<String> audiences, Duration sessionLifetime) {

        public Settings {
            if (issuer == null || issuer.isBlank()) {
                issuer = DEFAULT_ISSUER;
            }
            audiences = audiences == null || audiences.isEmpty() ? DEFAULT_AUDIENCES : List.copyOf(audiences);
            if (sessionLifetime == null || sessionLifetime.isZero() || sessionLifetime.isNegative()) {
                sessionLifetime = DEFAULT_SESSION_LIFETIME;
            }
        }

        public static Settings defaults() {
            return new Settings(DEFAULT_ISSUER, DEFAULT_AUDIENCES, DEFAULT_SESSION_LIFETIME);
        }
    }

    private record CachedToken(String token, Instant expiresAt) {
    }

    private final KeyMaterial keys;
    private final Settings settings;
    private final Clock clock;
    private final AtomicReference<CachedToken> anonymousToken = new AtomicReference<>();

    public SessionManager(KeyMaterial keys, Settings settings) {
        this(keys, settings, Clock.systemUTC());
    }

    public SessionManager(KeyMaterial keys, Settings settings, Clock clock) {
        this.keys = Objects.requireNonNull(keys, "keys");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Issues a token with the default session lifetime. */
    public String issueToken(User user) {
        return issueToken(user, settings.sessionLifetime());
    }

    /**
     * Issues a token for {@code user} valid for {@code lifetime}.
     *
     * @throws IllegalArgumentException if the lifetime is shorter than one second
     */
    public String issueToken(User user, Duration lifetime) {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(lifetime, "lifetime");
        if (lifetime.getSeconds() < 1) {
            throw new IllegalArgumentException("token lifetime must be at least one second");
        }
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(lifetime);

        List<String> roles = user.roles().isEmpty() ? List.of(DEFAULT_ROLE) : sorted(user.roles());
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .issuer(settings.issuer())
                .subject(user.userId())
                .audience(settings.audiences())
                .issueTime(Date.from(issuedAt))
                .expirationTime(Date.from(expiresAt))
                .claim("auth_time", issuedAt.getEpochSecond())
                .claim("user_id", user.userId())
                .claim("email", user.email())
                .claim("name", user.name())
                .claim("preferred_username", user.email())
                .claim("email_verified", true)
                .claim("provider", user.provider())
                .claim("roles", roles)
                .claim("user_roles", roles)
                .claim("groups", sorted(user.groups()))
                .build();
        JWSHeader header = new JWSHeader.Builder(keys.algorithm())
                .keyID(KeyMaterial.KEY_ID)
                .type(JOSEObjectType.JWT)
                .build();

        SignedJWT jwt = new SignedJWT(header, claims);
        try {
            jwt.sign(keys.signer());
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign session token", e);
        }
        return jwt.serialize();
    }

    /**
     * Verifies signature, algorithm, expiry, issuer and audience.
     *
     * @return the claims of a valid token, empty for anything else; never throws
     */
    public Optional<SessionClaims> verifyToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(verifyOrThrow(token));
        } catch (TokenRejectedException e) {
            log.debug("Session token rejected: {}", e.getMessage());
        } catch (ParseException | JOSEException | RuntimeException e) {
            log.debug("Session token rejected: {}", e.toString());
        }
        return Optional.empty();
    }

    /** Resolves a token to its user, or empty when the token is invalid. */
    public Optional<User> getUserFromToken(String token) {
        return verifyToken(token).map(SessionClaims::toUser);
    }

    /**
     * Token to forward downstream for {@code userId}.
     * <p>
     * Returns {@code jwtToken} when present. Anonymous callers (and every caller in no-auth mode)
     * get a cached token minted for {@link User#anonymous()} so downstream services always
     * receive a JWT.
     */
    public String effectiveJwtToken(String userId, String jwtToken, boolean noAuthMode) {
        if (jwtToken != null) {
            return jwtToken;
        }
        if (noAuthMode || userId == null || User.ANONYMOUS_USER_ID.equals(userId)) {
            return anonymousToken();
        }
        return null;
    }

    public String algorithm() {
        return keys.algorithm().getName();
    }

    public String keyId() {
        return KeyMaterial.KEY_ID;
    }

    public String issuer() {
        return settings.issuer();
    }

    /** Public key PEM, or empty in symmetric mode where no JWKS can be published. */
    public Optional<String> publicKeyPem() {
        return keys.publicKeyPem();
    }

    public Optional<RSAPublicKey> rsaPublicKey() {
        return keys.publicKey();
    }

    private SessionClaims verifyOrThrow(String token) throws ParseException, JOSEException, TokenRejectedException {
        SignedJWT jwt = SignedJWT.parse(token);
        if (!keys.algorithm().equals(jwt.getHeader().getAlgorithm())) {
            throw new TokenRejectedException("unexpected algorithm " + jwt.getHeader().getAlgorithm());
        }
        if (!jwt.verify(keys.verifier())) {
            throw new TokenRejectedException("bad signature");
        }
        JWTClaimsSet claims = jwt.getJWTClaimsSet();
        Date exp = claims.getExpirationTime();
        Date iat = claims.getIssueTime();
        if (exp == null || iat == null) {
            throw new TokenRejectedException("missing exp or iat");
        }
        if (!clock.instant().isBefore(exp.toInstant())) {
            throw new TokenRejectedException("expired");
        }
        if (!settings.issuer().equals(claims.getIssuer())) {
            throw new TokenRejectedException("unexpected issuer " + claims.getIssuer());
        }
        List<String> audience = claims.getAudience();
        if (audience == null || audience.stream().noneMatch(settings.audiences()::contains)) {
            throw new TokenRejectedException("unexpected audience " + audience);
        }
        return new SessionClaims(
                claims.getSubject(),
                claims.getIssuer(),
                audience,
                exp.toInstant(),
                iat.toInstant(),
                claims.getStringClaim("email"),
                claims.getStringClaim("name"),
                claims.getStringClaim("preferred_username"),
                claims.getStringClaim("provider"),
                claims.getStringListClaim("roles"),
                claims.getStringListClaim("groups"));
    }

    private String anonymousToken() {
        Instant renewAfter = clock.instant().plus(ANONYMOUS_TOKEN_RENEWAL);
        CachedToken cached = anonymousToken.get();
        if (cached != null && cached.expiresAt().isAfter(renewAfter)) {
            return cached.token();
        }
        String token = issueToken(User.anonymous());
        Instant expiresAt = clock.instant().truncatedTo(ChronoUnit.SECONDS).plus(settings.sessionLifetime());
        anonymousToken.set(new CachedToken(token, expiresAt));
        log.debug("Minted anonymous session token");
        return token;
    }

    private static List<String> sorted(Collection<String> values) {
        return new ArrayList<>(new TreeSet<>(values));
    }

    private static final class TokenRejectedException extends Exception {
        TokenRejectedException(String reason) {
            super(reason);
        }
    }
}
