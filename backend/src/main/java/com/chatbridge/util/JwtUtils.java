package com.chatbridge.util;

import org.springframework.security.oauth2.jwt.Jwt;

/**
 * JWT 토큰에서 사용자 정보를 추출하는 유틸리티 클래스
 */
public class JwtUtils {

    private JwtUtils() {
        // 유틸리티 클래스이므로 인스턴스화 방지
    }

    /**
     * JWT에서 사용자 정보를 추출합니다.
     *
     * @param jwt JWT 토큰
     * @return 사용자 정보 (userId, name)
     */
    public static UserInfo extractUserInfo(Jwt jwt) {
        String userId = jwt.getSubject();
        return new UserInfo(userId, extractName(jwt, userId));
    }

    /**
     * 표시 이름을 name, preferred_username, username 클레임 순서로 찾습니다.
     * 모두 없으면 이메일의 @ 앞부분, 그것도 없으면 사용자 ID를 사용합니다.
     */
    static String extractName(Jwt jwt, String userId) {
        for (String claim : new String[]{"name", "preferred_username", "username"}) {
            String value = jwt.getClaimAsString(claim);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        String email = jwt.getClaimAsString("email");
        if (email != null && email.contains("@")) {
            return email.substring(0, email.indexOf('@'));
        }
        return userId;
    }

    /**
     * JWT에서 추출한 사용자 정보를 담는 record
     */
    public record UserInfo(String userId, String name) {
    }
}
