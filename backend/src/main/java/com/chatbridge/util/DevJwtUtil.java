package com.chatbridge.util;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * 개발용 간단한 JWT 유틸리티
 * 실제 프로덕션에서는 외부 인증 서버가 발급한 토큰을 사용해야 합니다.
 */
@Component
@Profile("dev")
public class DevJwtUtil {

    // 개발용 시크릿 키 (32바이트 이상)
    private static final String SECRET = "dev-secret-key-for-local-development-only-do-not-use-in-production";
    private static final SecretKey KEY = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));
    private static final long EXPIRATION_HOURS = 24;

    /**
     * 개발용 JWT 토큰 생성
     *
     * @param userId      사용자 ID
     * @param displayName 표시 이름
     * @return JWT 토큰
     */
    public String generateToken(String userId, String displayName) {
        Instant now = Instant.now();
        Instant expiration = now.plus(EXPIRATION_HOURS, ChronoUnit.HOURS);

        return Jwts.builder()
                .subject(userId)
                .claim("name", displayName)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiration))
                .signWith(KEY)
                .compact();
    }

    public String extractUsername(String token) {
        return parse(token).getSubject();
    }

    /**
     * name 클레임이 없으면 사용자 ID를 그대로 사용합니다.
     */
    public String extractDisplayName(String token) {
        Claims claims = parse(token);
        String name = claims.get("name", String.class);
        return name != null ? name : claims.getSubject();
    }

    /**
     * JWT 토큰 검증
     *
     * @param token JWT 토큰
     * @return 유효 여부
     */
    public boolean validateToken(String token) {
        try {
            parse(token);
            return true;
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }

    private Claims parse(String token) {
        return Jwts.parser()
                .verifyWith(KEY)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
