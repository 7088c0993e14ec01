package com.chatbridge;

import com.chatbridge.auth.service.IdentityVerifier;
import com.chatbridge.auth.service.JwtIdentityVerifier;
import com.chatbridge.message.service.LoggingMessageArchive;
import com.chatbridge.message.service.MessageArchive;
import com.chatbridge.session.service.SessionCoordinator;
import com.chatbridge.websocket.service.Broadcaster;
import com.chatbridge.websocket.service.StompBroadcaster;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DisplayName("애플리케이션 컨텍스트 스모크 테스트")
class ChatBridgeApplicationTest {

    @Autowired
    private SessionCoordinator sessionCoordinator;

    @Autowired
    private IdentityVerifier identityVerifier;

    @Autowired
    private MessageArchive messageArchive;

    @Autowired
    private Broadcaster broadcaster;

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    @DisplayName("기본 프로필에서 JWT 검증기와 STOMP 브로드캐스터가 연결된다")
    void contextLoads() {
        assertThat(sessionCoordinator).isNotNull();
        assertThat(identityVerifier).isInstanceOf(JwtIdentityVerifier.class);
        assertThat(messageArchive).isInstanceOf(LoggingMessageArchive.class);
        assertThat(broadcaster).isInstanceOf(StompBroadcaster.class);
    }

    @Test
    @DisplayName("/health는 인증 없이 접근할 수 있다")
    @SuppressWarnings("rawtypes")
    void health_IsPublic() {
        // when
        ResponseEntity<Map> response = restTemplate.getForEntity("/health", Map.class);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("status", "UP");
    }
}
