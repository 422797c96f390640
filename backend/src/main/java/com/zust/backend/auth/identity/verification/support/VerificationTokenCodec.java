package com.zust.backend.auth.identity.verification.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Component;

import com.zust.backend.auth.config.AuthProperties;
import com.zust.backend.global.ApiException;
import com.zust.backend.global.ErrorCode;

/**
 * Email verification link token.
 *
 * <pre>
 * payload = "{accountId}|{issuedAtEpochNanos}"
 * token   = base64url(payload) + "." + base64url(HMAC-SHA256(secret, payload))
 * </pre>
 *
 * Nothing is stored: the signature proves we issued it, the timestamp bounds its life.
 */
@Component
public class VerificationTokenCodec {

    private static final String HMAC_ALG = "HmacSHA256";
    private static final String FIELD_SEPARATOR = "|";
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final byte[] secret;
    private final Duration ttl;
    private final Clock clock;

    public VerificationTokenCodec(AuthProperties props, Clock clock) {
        this.secret = props.verification().hmacSecret().getBytes(StandardCharsets.UTF_8);
        this.ttl = Duration.ofSeconds(props.verification().ttlSeconds());
        this.clock = clock;
    }

    public String issue(UUID accountId) {
        if (accountId == null) throw new IllegalArgumentException("accountId must not be null");

        Instant now = clock.instant();
        long nanos = Math.addExact(Math.multiplyExact(now.getEpochSecond(), NANOS_PER_SECOND), now.getNano());

        byte[] payload = (accountId + FIELD_SEPARATOR + nanos).getBytes(StandardCharsets.UTF_8);
        return ENCODER.encodeToString(payload) + "." + ENCODER.encodeToString(hmac(payload));
    }

    /**
     * @return the account the token was issued for
     * @throws ApiException VERIFICATION_TOKEN_INVALID or VERIFICATION_TOKEN_EXPIRED
     */
    public UUID parse(String token) {
        if (token == null || token.isBlank()) {
            throw new ApiException(ErrorCode.VERIFICATION_TOKEN_MISSING);
        }

        int dot = token.indexOf('.');
        if (dot <= 0 || dot != token.lastIndexOf('.') || dot == token.length() - 1) {
            throw invalid();
        }

        byte[] payload;
        byte[] signature;
        try {
            payload = DECODER.decode(token.substring(0, dot));
            signature = DECODER.decode(token.substring(dot + 1));
        } catch (IllegalArgumentException e) {
            throw invalid();
        }

        if (!MessageDigest.isEqual(hmac(payload), signature)) {
            throw invalid();
        }

        String[] fields = new String(payload, StandardCharsets.UTF_8).split("\\|", -1);
        if (fields.length != 2) {
            throw invalid();
        }

        UUID accountId;
        long issuedNanos;
        try {
            accountId = UUID.fromString(fields[0]);
            issuedNanos = Long.parseLong(fields[1]);
        } catch (IllegalArgumentException e) {
            throw invalid();
        }

        Instant issuedAt = Instant.ofEpochSecond(
                Math.floorDiv(issuedNanos, NANOS_PER_SECOND),
                Math.floorMod(issuedNanos, NANOS_PER_SECOND));

        if (Duration.between(issuedAt, clock.instant()).compareTo(ttl) > 0) {
            throw new ApiException(ErrorCode.VERIFICATION_TOKEN_EXPIRED);
        }
        return accountId;
    }

    private byte[] hmac(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALG);
            mac.init(new SecretKeySpec(secret, HMAC_ALG));
            return mac.doFinal(payload);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to compute HMAC-SHA256", e);
        }
    }

    private static ApiException invalid() {
        return new ApiException(ErrorCode.VERIFICATION_TOKEN_INVALID);
    }
}
