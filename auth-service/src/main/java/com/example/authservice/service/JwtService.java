package com.example.authservice.service;

import com.example.authservice.entity.User;
import com.example.authservice.security.TokenFailure;
import com.example.authservice.security.TokenKind;
import com.example.authservice.security.TokenVerification;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

/**
 * JWT Service for token generation and validation.
 *
 * Algorithm: HS256, key from {@code app.jwt.secret} (at least 32 bytes).
 * Every token carries {@code sub}, {@code type}, {@code iat} and {@code exp}; the type claim
 * is part of the signed payload, so a token of the wrong kind fails like a forgery.
 *
 * Default TTLs: access 30 minutes, refresh 7 days, password reset 1 hour,
 * email verification 7 days.
 */
@Service
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    public static final String CLAIM_TYPE = "type";
    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_ROLE = "role";
    public static final String CLAIM_SESSION_ID = "session_id";
    public static final String CLAIM_JTI = "jti";

    private static final int JTI_BYTES = 32;

    private final SecretKey secretKey;
    private final Clock clock;
    private final JwtParser parser;
    private final SecureRandom secureRandom = new SecureRandom();

    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Duration passwordResetTtl;
    private final Duration emailVerificationTtl;

    public JwtService(
            @Value("${app.jwt.secret}") String jwtSecret,
            @Value("${app.jwt.access-token-ttl:30m}") Duration accessTokenTtl,
            @Value("${app.jwt.refresh-token-ttl:7d}") Duration refreshTokenTtl,
            @Value("${app.jwt.password-reset-ttl:1h}") Duration passwordResetTtl,
            @Value("${app.jwt.email-verification-ttl:7d}") Duration emailVerificationTtl,
            Clock clock) {
        // HS256 requires at least 256 bits (32 bytes) key
        this.secretKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        this.clock = clock;
        this.accessTokenTtl = accessTokenTtl;
        this.refreshTokenTtl = refreshTokenTtl;
        this.passwordResetTtl = passwordResetTtl;
        this.emailVerificationTtl = emailVerificationTtl;
        this.parser = Jwts.parser()
                .verifyWith(secretKey)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    // ==================== Generic engine ====================

    /**
     * Sign a token of the given kind.
     *
     * @param kind        purpose, written to the {@code type} claim
     * @param subject     {@code sub} claim
     * @param ttl         lifetime from now
     * @param extraClaims additional claims, may be empty
     * @return compact JWS
     */
    public String createToken(TokenKind kind, String subject, Duration ttl, Map<String, ?> extraClaims) {
        Instant now = clock.instant();
        Instant expiration = now.plus(ttl);

        return Jwts.builder()
                .claims(extraClaims)
                .subject(subject)                              // sub
                .claim(CLAIM_TYPE, kind.getClaimValue())       // type
                .issuedAt(Date.from(now))                      // iat
                .expiration(Date.from(expiration))             // exp
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Verify signature, expiry and kind. Never throws.
     */
    public TokenVerification verifyToken(String token, TokenKind expected) {
        if (token == null || token.isBlank()) {
            return TokenVerification.rejected(TokenFailure.MALFORMED);
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token.trim()).getPayload();
        } catch (ExpiredJwtException e) {
            return TokenVerification.rejected(TokenFailure.EXPIRED);
        } catch (SecurityException | UnsupportedJwtException e) {
            log.debug("Token signature rejected: {}", e.getMessage());
            return TokenVerification.rejected(TokenFailure.INVALID_SIGNATURE);
        } catch (MalformedJwtException | IllegalArgumentException e) {
            return TokenVerification.rejected(TokenFailure.MALFORMED);
        } catch (JwtException e) {
            log.debug("Token rejected: {}", e.getMessage());
            return TokenVerification.rejected(TokenFailure.MALFORMED);
        }

        if (!expected.getClaimValue().equals(claims.get(CLAIM_TYPE, String.class))) {
            return TokenVerification.rejected(TokenFailure.KIND_MISMATCH);
        }
        return TokenVerification.valid(claims);
    }

    // ==================== Token factories ====================

    /**
     * Access token: sub = user id, plus email, role and the session it belongs to.
     */
    public String createAccessToken(User user, UUID sessionId) {
        return createToken(TokenKind.ACCESS, user.getId().toString(), accessTokenTtl, Map.of(
                CLAIM_EMAIL, user.getEmail(),
                CLAIM_ROLE, user.getRole().getValue(),
                CLAIM_SESSION_ID, sessionId.toString()));
    }

    /**
     * Refresh token with a random {@code jti} so two tokens issued in the same second differ.
     */
    public String createRefreshToken(UUID userId, Duration ttl) {
        return createToken(TokenKind.REFRESH, userId.toString(), ttl, Map.of(CLAIM_JTI, newJti()));
    }

    public String createPasswordResetToken(User user) {
        return createToken(TokenKind.PASSWORD_RESET, user.getId().toString(), passwordResetTtl,
                Map.of(CLAIM_JTI, newJti()));
    }

    public String createEmailVerificationToken(User user) {
        return createToken(TokenKind.EMAIL_VERIFICATION, user.getId().toString(), emailVerificationTtl,
                Map.of(CLAIM_EMAIL, user.getEmail()));
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }

    public Duration getRefreshTokenTtl() {
        return refreshTokenTtl;
    }

    public Duration getPasswordResetTtl() {
        return passwordResetTtl;
    }

    private String newJti() {
        byte[] bytes = new byte[JTI_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
