package com.imperium.aries.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * 签发与校验登录 token（HS256）。声明：username、user_img、iat、exp。
 */
@Component
public class JwtTokenProvider {

    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_USER_IMG = "user_img";

    private static final Logger log = LoggerFactory.getLogger(JwtTokenProvider.class);
    private static final int MIN_SECRET_LENGTH = 32;

    private final SecretKey secretKey;
    private final long expireSeconds;
    private final Clock clock;

    public JwtTokenProvider(
            @Value("${app.auth.jwt-secret}") String secret,
            @Value("${app.auth.token-expire-seconds:86400}") long expireSeconds,
            Clock clock) {
        // HS256 要求密钥至少 256 位
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            log.warn("JWT secret is shorter than {} characters, padding it. Configure app.auth.jwt-secret.", MIN_SECRET_LENGTH);
            secret = String.format("%-" + MIN_SECRET_LENGTH + "s", secret != null ? secret : "aries");
        }
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expireSeconds = expireSeconds;
        this.clock = clock;
    }

    public String createToken(String username, String userImg) {
        Instant now = clock.instant();
        return Jwts.builder()
                .claim(CLAIM_USERNAME, username)
                .claim(CLAIM_USER_IMG, userImg != null ? userImg : "")
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusSeconds(expireSeconds)))
                .signWith(secretKey)
                .compact();
    }

    /**
     * 校验签名与有效期。
     *
     * @return 声明；token 为空、被篡改或已过期时返回 empty
     */
    public Optional<TokenClaims> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            return Optional.of(new TokenClaims(
                    claims.get(CLAIM_USERNAME, String.class),
                    claims.get(CLAIM_USER_IMG, String.class),
                    claims.getIssuedAt().toInstant(),
                    claims.getExpiration().toInstant()));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public long getExpireSeconds() {
        return expireSeconds;
    }
}
