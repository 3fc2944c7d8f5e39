package com.imperium.aries.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.aries.common.Result;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * /api/v1/** 下除 /api/v1/auth/** 以外的接口都要求 Authorization: Bearer &lt;token&gt;。
 * 校验失败时返回 code=105 的响应信封（HTTP 200）。
 */
@Component
public class JwtAuthFilter extends OncePerRequestFilter {

    public static final String ATTR_CLAIMS = "tokenClaims";
    static final String UNAUTHORIZED_MSG = "未登录或登录已过期";

    private static final String API_PREFIX = "/api/v1/";
    private static final String AUTH_PREFIX = "/api/v1/auth/";
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProvider tokenProvider;
    private final ObjectMapper objectMapper;

    public JwtAuthFilter(JwtTokenProvider tokenProvider, ObjectMapper objectMapper) {
        this.tokenProvider = tokenProvider;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return HttpMethod.OPTIONS.matches(request.getMethod())
                || !path.startsWith(API_PREFIX)
                || path.startsWith(AUTH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        Optional<TokenClaims> claims = tokenProvider.parse(resolveToken(request));
        if (claims.isEmpty()) {
            response.setStatus(HttpServletResponse.SC_OK);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), Result.unauthorized(UNAUTHORIZED_MSG));
            return;
        }
        request.setAttribute(ATTR_CLAIMS, claims.get());
        filterChain.doFilter(request, response);
    }

    private static String resolveToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            return header.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }
}
