package com.zust.backend.security.token;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;

import com.zust.backend.auth.config.AuthProperties;
import com.zust.backend.auth.domain.AccountRole;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ClaimJwtException;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;

/**
 * Bearer token (JWT, HS256) issue and parse.
 *
 * - Knows nothing about HTTP or the database. parse() only answers "did we sign this, is it
 *   still within its lifetime, are its claims well-formed".
 * - The token_version comparison and the access/refresh decision happen in SessionAuthority.
 * - Every parse failure comes out as a TokenException; the Reason picks the 401 code.
 *
 * Token layout:
 * <pre>
 * header : {"alg":"HS256"}
 * payload: {"iss":"Zust","sub":"&lt;account uuid&gt;","role":"USER",
 *           "token_type":"access-token","version":3,"iat":...,"exp":...}
 * </pre>
 *
 * Algorithm:
 * - only HMAC headers are verified. The parser holds a SecretKey, and jjwt refuses to use a
 *   SecretKey for an RS256/ES256 header (UnsupportedJwtException → BAD_SIGNATURE), so a token
 *   re-signed with another algorithm never reaches the claim checks.
 * - alg "none" is refused the same way.
 */
@Service
public class TokenCodec {

    static final String ROLE_CLAIM = "role";
    static final String TOKEN_TYPE_CLAIM = "token_type";
    static final String VERSION_CLAIM = "version";

    private static final int MIN_SECRET_BYTES = 32;
    private static final SignatureAlgorithm SIGNING_ALGORITHM = SignatureAlgorithm.HS256;

    private final AuthProperties.Jwt jwtProps;
    private final Clock clock;
    private final SecretKey key;
    private final JwtParser parser;

    public TokenCodec(AuthProperties props, Clock clock) {
        this.jwtProps = props.jwt();
        this.clock = clock;
        this.key = buildHmacKey(jwtProps.secret());
        this.parser = buildParser(jwtProps.issuer(), jwtProps.clockSkewSeconds(), this.key, this.clock);
    }

    /**
     * Signs a token for one account.
     *
     * @param version the account's token_version at issue time, compared on every later verify
     * @param ttl     access 15 min / refresh 7 days in production, any positive duration here
     */
    public String issue(UUID subject, AccountRole role, TokenKind kind, int version, Duration ttl) {
        if (subject == null) throw new IllegalArgumentException("subject must not be null");
        if (role == null) throw new IllegalArgumentException("role must not be null");
        if (kind == null) throw new IllegalArgumentException("InvalidKind: token kind must not be null");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) throw new IllegalArgumentException("ttl must be positive");

        Instant now = clock.instant();
        Instant exp = now.plus(ttl);

        return Jwts.builder()
                .setIssuer(jwtProps.issuer())                   // iss
                .setSubject(subject.toString())                 // sub: account id
                .claim(ROLE_CLAIM, role.name())                 // role: "USER"
                .claim(TOKEN_TYPE_CLAIM, kind.claimValue())     // token_type: "access-token"
                .claim(VERSION_CLAIM, version)                  // version
                .setIssuedAt(Date.from(now))                    // iat
                .setExpiration(Date.from(exp))                  // exp
                .signWith(key, SIGNING_ALGORITHM)
                .compact();
    }

    /**
     * Variant taking the wire name of the kind ("access-token" / "refresh-token").
     * @throws IllegalArgumentException (InvalidKind) for any other name
     */
    public String issue(UUID subject, AccountRole role, String kindName, int version, Duration ttl) {
        return issue(subject, role, TokenKind.fromClaimValue(kindName), version, ttl);
    }

    /**
     * Verifies signature, issuer and lifetime, then reads the claims.
     *
     * The order is jjwt's: signature first, then exp/nbf (with the configured clock skew),
     * then the required issuer. Only a token that passed all three has its claims read.
     *
     * @throws TokenException with EXPIRED, MALFORMED, BAD_SIGNATURE or INVALID_CLAIMS
     */
    public TokenClaims parse(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenException(TokenException.Reason.MALFORMED, "token is null or blank");
        }

        Claims claims;
        try {
            claims = parser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            throw new TokenException(TokenException.Reason.EXPIRED, "token expired", e);
        } catch (ClaimJwtException e) {
            // wrong issuer, missing issuer, not yet valid
            throw new TokenException(TokenException.Reason.INVALID_CLAIMS, e.getMessage(), e);
        } catch (UnsupportedJwtException | SecurityException e) {
            // alg none, RS256/ES256 headers, signature mismatch
            throw new TokenException(TokenException.Reason.BAD_SIGNATURE, e.getMessage(), e);
        } catch (MalformedJwtException | IllegalArgumentException e) {
            throw new TokenException(TokenException.Reason.MALFORMED, e.getMessage(), e);
        } catch (JwtException e) {
            throw new TokenException(TokenException.Reason.MALFORMED, e.getMessage(), e);
        }

        return toTokenClaims(claims);
    }

    // every claim is required; a missing one is INVALID_CLAIMS, not MALFORMED
    private static TokenClaims toTokenClaims(Claims claims) {
        try {
            UUID subject = parseSubject(claims.getSubject());
            AccountRole role = parseRole(claims.get(ROLE_CLAIM, String.class));
            TokenKind kind = TokenKind.fromClaimValue(claims.get(TOKEN_TYPE_CLAIM, String.class));

            Integer version = claims.get(VERSION_CLAIM, Integer.class);
            if (version == null) {
                throw new IllegalArgumentException("version claim missing");
            }
            if (claims.getIssuedAt() == null || claims.getExpiration() == null) {
                throw new IllegalArgumentException("iat/exp claims missing");
            }

            return new TokenClaims(subject, role, kind, version,
                    claims.getIssuedAt().toInstant(), claims.getExpiration().toInstant());
        } catch (IllegalArgumentException | JwtException e) {
            throw new TokenException(TokenException.Reason.INVALID_CLAIMS, e.getMessage(), e);
        }
    }

    private static UUID parseSubject(String sub) {
        if (sub == null || sub.isBlank()) {
            throw new IllegalArgumentException("subject is missing");
        }
        return UUID.fromString(sub);
    }

    private static AccountRole parseRole(String roleRaw) {
        if (roleRaw == null || roleRaw.isBlank()) {
            throw new IllegalArgumentException("role claim missing");
        }
        return AccountRole.valueOf(roleRaw);
    }

    private static SecretKey buildHmacKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must not be blank");
        }

        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }

        return Keys.hmacShaKeyFor(bytes);
    }

    private static JwtParser buildParser(String issuer, long clockSkewSeconds, SecretKey key, Clock clock) {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalStateException("JWT issuer must not be blank");
        }

        return Jwts.parserBuilder()
                .requireIssuer(issuer)
                .setSigningKey(key)
                .setAllowedClockSkewSeconds(clockSkewSeconds)
                // jjwt works on Date, bridge the injected Clock
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }
}
