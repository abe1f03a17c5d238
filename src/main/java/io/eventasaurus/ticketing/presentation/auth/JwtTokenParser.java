package io.eventasaurus.ticketing.presentation.auth;

import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;
import io.eventasaurus.ticketing.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * Authorization: Bearer &lt;jwt&gt; 헤더에서 현재 사용자를 꺼낸다.
 * 토큰 발급은 인증 서비스 책임이며 여기서는 HMAC 서명 검증만 한다.
 */
@Slf4j
@Component
public class JwtTokenParser {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey key;

    public JwtTokenParser(AuthProperties authProperties) {
        this.key = Keys.hmacShaKeyFor(authProperties.jwtSecret().getBytes(StandardCharsets.UTF_8));
    }

    public AuthUser requireUser(String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            throw new BusinessException(ErrorCode.UNAUTHENTICATED);
        }

        String token = authorization.substring(BEARER_PREFIX.length());
        try {
            Claims claims = Jwts.parser().verifyWith(key).build().parseSignedClaims(token).getPayload();
            Long userId = parseUserId(claims.get("userId"));
            return new AuthUser(userId, claims.get("email", String.class));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            throw new BusinessException(ErrorCode.UNAUTHENTICATED, "Invalid or expired token");
        }
    }

    private static Long parseUserId(Object claim) {
        if (claim instanceof Number) {
            return ((Number) claim).longValue();
        }
        if (claim instanceof String && !((String) claim).isBlank()) {
            return Long.parseLong((String) claim);
        }
        throw new IllegalArgumentException("userId claim is missing");
    }
}
