package com.imperium.aries.security;

import java.time.Instant;

/**
 * 已校验 token 中的声明。
 */
public record TokenClaims(String username, String userImg, Instant issuedAt, Instant expiresAt) {
}
