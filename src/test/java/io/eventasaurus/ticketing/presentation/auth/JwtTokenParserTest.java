package io.eventasaurus.ticketing.presentation.auth;

import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;
import io.eventasaurus.ticketing.config.AuthProperties;
import io.eventasaurus.ticketing.support.TestTokens;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Date;

import static org.assertj.core.api.Assertions.*;

class JwtTokenParserTest {

    private final JwtTokenParser parser = new JwtTokenParser(new AuthProperties(TestTokens.JWT_SECRET));

    @Test
    @DisplayName("유효한 Bearer 토큰 - userId, email 추출")
    void requireUser_성공() {
        AuthUser user = parser.requireUser(TestTokens.bearer(42L));

        assertThat(user.userId()).isEqualTo(42L);
        assertThat(user.email()).isEqualTo("user42@example.com");
    }

    @Test
    @DisplayName("userId 가 문자열 클레임이어도 허용")
    void requireUser_문자열userId() {
        String token = Jwts.builder()
            .claim("userId", "7")
            .signWith(Keys.hmacShaKeyFor(TestTokens.JWT_SECRET.getBytes(StandardCharsets.UTF_8)))
            .compact();

        assertThat(parser.requireUser("Bearer " + token).userId()).isEqualTo(7L);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"Basic abc", "Bearer ", "Bearer not.a.jwt"})
    @DisplayName("헤더 누락/형식 오류 - UNAUTHENTICATED")
    void requireUser_형식오류_예외발생(String authorization) {
        assertThatThrownBy(() -> parser.requireUser(authorization))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.UNAUTHENTICATED);
    }

    @Test
    @DisplayName("다른 키로 서명된 토큰 - UNAUTHENTICATED")
    void requireUser_서명불일치_예외발생() {
        String token = Jwts.builder()
            .claim("userId", 1L)
            .signWith(Keys.hmacShaKeyFor("another-secret-another-secret-another-secret!!".getBytes(StandardCharsets.UTF_8)))
            .compact();

        assertThatThrownBy(() -> parser.requireUser("Bearer " + token))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.UNAUTHENTICATED);
    }

    @Test
    @DisplayName("만료된 토큰 - UNAUTHENTICATED")
    void requireUser_만료_예외발생() {
        String token = Jwts.builder()
            .claim("userId", 1L)
            .expiration(new Date(System.currentTimeMillis() - 60_000L))
            .signWith(Keys.hmacShaKeyFor(TestTokens.JWT_SECRET.getBytes(StandardCharsets.UTF_8)))
            .compact();

        assertThatThrownBy(() -> parser.requireUser("Bearer " + token))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.UNAUTHENTICATED);
    }

    @Test
    @DisplayName("userId 클레임 없음 - UNAUTHENTICATED")
    void requireUser_userId없음_예외발생() {
        String token = Jwts.builder()
            .subject("someone")
            .signWith(Keys.hmacShaKeyFor(TestTokens.JWT_SECRET.getBytes(StandardCharsets.UTF_8)))
            .compact();

        assertThatThrownBy(() -> parser.requireUser("Bearer " + token))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.UNAUTHENTICATED);
    }
}
