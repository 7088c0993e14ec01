package com.chatbridge.config;

import com.chatbridge.session.service.SessionCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;

@Slf4j
@Configuration
@EnableWebSocketMessageBroker
@Order(Ordered.HIGHEST_PRECEDENCE + 99)
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    // SessionCoordinator는 브로커 템플릿에 의존하므로 지연 조회합니다
    private final ObjectProvider<SessionCoordinator> sessionCoordinator;
    private final String[] allowedOrigins;

    public WebSocketConfig(ObjectProvider<SessionCoordinator> sessionCoordinator,
                           @Value("${chat.socket.allowed-origins:http://localhost:3001}") String[] allowedOrigins) {
        this.sessionCoordinator = sessionCoordinator;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        // 클라이언트가 구독할 수 있는 destination prefix
        config.enableSimpleBroker("/topic", "/queue");
        // 클라이언트가 메시지를 보낼 때 사용할 destination prefix
        config.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();
    }

    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registration) {
        registration.setSendTimeLimit(10_000)
                .setSendBufferSizeLimit(512 * 1024)
                .setMessageSizeLimit(64 * 1024);
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(new ChannelInterceptor() {
            @Override
            public Message<?> preSend(Message<?> message, MessageChannel channel) {
                MessageHeaders headers = message.getHeaders();
                SimpMessageType type = SimpMessageHeaderAccessor.getMessageType(headers);
                String sessionId = SimpMessageHeaderAccessor.getSessionId(headers);
                if (type == null || sessionId == null) {
                    return message;
                }

                // CONNECT: 세션 생성 (인증은 authenticate 이벤트로 수행)
                if (type == SimpMessageType.CONNECT) {
                    sessionCoordinator.getObject().connect(sessionId);
                }
                // DISCONNECT: 비정상 종료 시에도 Spring이 DISCONNECT를 합성하므로 중복 호출될 수 있습니다
                else if (type == SimpMessageType.DISCONNECT) {
                    sessionCoordinator.getObject().disconnect(sessionId);
                }
                return message;
            }
        });
    }
}
