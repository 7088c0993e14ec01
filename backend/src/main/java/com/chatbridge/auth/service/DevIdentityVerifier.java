package com.chatbridge.auth.service;

import com.chatbridge.auth.dto.VerifiedIdentity;
import com.chatbridge.exception.UnauthenticatedException;
import com.chatbridge.util.DevJwtUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * 개발 모드용 IdentityVerifier 구현체
 * DevJwtUtil로 발급한 토큰 외에 평문 사용자 ID도 그대로 받아들입니다.
 */
@Slf4j
@Component
@Profile("dev")
@RequiredArgsConstructor
public class DevIdentityVerifier implements IdentityVerifier {

    // Compact JWS: header.payload.signature
    private static final Pattern JWS_SHAPE = Pattern.compile("^[\\w-]+\\.[\\w-]+\\.[\\w-]*$");
    private static final Pattern PLAIN_USER_ID = Pattern.compile("^[\\w.@-]{1,64}$");

    private final DevJwtUtil devJwtUtil;

    @Override
    public VerifiedIdentity verify(String token) {
        if (JWS_SHAPE.matcher(token).matches()) {
            if (!devJwtUtil.validateToken(token)) {
                throw new UnauthenticatedException("Invalid authentication token");
            }
            String userId = devJwtUtil.extractUsername(token);
            log.debug("Dev token accepted: {}", userId);
            return new VerifiedIdentity(userId, devJwtUtil.extractDisplayName(token));
        }

        if (!PLAIN_USER_ID.matcher(token).matches()) {
            throw new UnauthenticatedException("Invalid authentication token");
        }
        log.debug("Dev plain user id accepted: {}", token);
        return new VerifiedIdentity(token, token);
    }
}
