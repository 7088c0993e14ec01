package com.chatbridge.auth.service;

import com.chatbridge.auth.dto.VerifiedIdentity;
import com.chatbridge.exception.UnauthenticatedException;
import com.chatbridge.util.JwtUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

/**
 * 프로덕션 모드용 IdentityVerifier 구현체
 * HMAC 서명된 JWT를 Spring Security JwtDecoder로 검증합니다.
 */
@Slf4j
@Component
@Profile("!dev")
@RequiredArgsConstructor
public class JwtIdentityVerifier implements IdentityVerifier {

    private final JwtDecoder jwtDecoder;

    @Override
    public VerifiedIdentity verify(String token) {
        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(token);
        } catch (JwtException e) {
            log.debug("JWT verification failed: {}", e.getMessage());
            throw new UnauthenticatedException("Invalid authentication token");
        }

        JwtUtils.UserInfo userInfo = JwtUtils.extractUserInfo(jwt);
        if (userInfo.userId() == null || userInfo.userId().isBlank()) {
            throw new UnauthenticatedException("Token has no subject");
        }
        return new VerifiedIdentity(userInfo.userId(), userInfo.name());
    }
}
