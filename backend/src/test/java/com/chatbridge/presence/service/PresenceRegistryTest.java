package com.chatbridge.presence.service;

import com.chatbridge.exception.UnknownUserException;
import com.chatbridge.room.domain.Room;
import com.chatbridge.room.domain.RoomType;
import com.chatbridge.room.service.RoomDirectory;
import com.chatbridge.support.ManualMonotonicClock;
import com.chatbridge.support.MutableClock;
import com.chatbridge.typing.service.TypingTracker;
import com.chatbridge.user.dto.UserPresence;
import com.chatbridge.user.service.UserRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PresenceRegistry 단위 테스트")
class PresenceRegistryTest {

    private MutableClock clock;
    private RoomDirectory roomDirectory;
    private TypingTracker typingTracker;
    private PresenceRegistry presenceRegistry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        UserRegistry userRegistry = new UserRegistry(clock);
        userRegistry.register("alice", "Alice");
        userRegistry.register("bob", "Bob");
        roomDirectory = new RoomDirectory(userRegistry, clock, 100);
        typingTracker = new TypingTracker(roomDirectory, new ManualMonotonicClock(), 5);
        presenceRegistry = new PresenceRegistry(userRegistry, typingTracker, clock);
    }

    @Test
    @DisplayName("온라인이 되면 연결 핸들과 마지막 접속 시각이 기록된다")
    void setOnline_RecordsConnection() {
        // when
        presenceRegistry.setOnline("alice", "conn-1");

        // then
        assertThat(presenceRegistry.isOnline("alice")).isTrue();
        assertThat(presenceRegistry.connectionOf("alice")).contains("conn-1");
        assertThat(presenceRegistry.get("alice"))
                .get()
                .extracting(UserPresence::getLastSeen)
                .isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("등록되지 않은 사용자는 UnknownUserException")
    void setOnline_UnknownUser_Throws() {
        assertThatThrownBy(() -> presenceRegistry.setOnline("ghost", "conn-1"))
                .isInstanceOf(UnknownUserException.class);
    }

    @Test
    @DisplayName("다른 연결로 다시 접속하면 이전 연결을 반환한다")
    void setOnline_Reconnect_ReturnsPreviousConnection() {
        // given
        presenceRegistry.setOnline("alice", "conn-1");

        // when & then
        assertThat(presenceRegistry.setOnline("alice", "conn-2")).contains("conn-1");
        assertThat(presenceRegistry.connectionOf("alice")).contains("conn-2");
    }

    @Test
    @DisplayName("오프라인이 되면 연결과 타이핑 상태가 지워진다")
    void setOffline_ClearsConnectionAndTyping() {
        // given
        Room room = roomDirectory.createRoom("general", RoomType.PUBLIC, "alice");
        presenceRegistry.setOnline("alice", "conn-1");
        typingTracker.setTyping("alice", room.getId());
        clock.advance(Duration.ofMinutes(1));

        // when
        presenceRegistry.setOffline("alice");
        presenceRegistry.setOffline("alice");

        // then
        assertThat(presenceRegistry.isOnline("alice")).isFalse();
        assertThat(presenceRegistry.connectionOf("alice")).isEmpty();
        assertThat(typingTracker.listTyping(room.getId())).isEmpty();
        assertThat(presenceRegistry.get("alice").get().getLastSeen())
                .isEqualTo(Instant.parse("2024-01-01T00:01:00Z"));
    }

    @Test
    @DisplayName("이미 다른 곳에서 재접속한 사용자의 오래된 연결은 오프라인으로 만들지 않는다")
    void releaseConnection_Stale_KeepsUserOnline() {
        // given
        presenceRegistry.setOnline("alice", "conn-1");
        presenceRegistry.setOnline("alice", "conn-2");

        // when
        boolean released = presenceRegistry.releaseConnection("alice", "conn-1");

        // then
        assertThat(released).isFalse();
        assertThat(presenceRegistry.connectionOf("alice")).contains("conn-2");
        assertThat(presenceRegistry.releaseConnection("alice", "conn-2")).isTrue();
        assertThat(presenceRegistry.isOnline("alice")).isFalse();
    }

    @Test
    @DisplayName("하트비트는 마지막 접속 시각만 갱신한다")
    void touch_UpdatesLastSeen() {
        // given
        presenceRegistry.setOnline("alice", "conn-1");
        clock.advance(Duration.ofSeconds(30));

        // when
        presenceRegistry.touch("alice");

        // then
        UserPresence snapshot = presenceRegistry.get("alice").orElseThrow();
        assertThat(snapshot.isOnline()).isTrue();
        assertThat(snapshot.getLastSeen()).isEqualTo(Instant.parse("2024-01-01T00:00:30Z"));
        assertThatThrownBy(() -> presenceRegistry.touch("ghost"))
                .isInstanceOf(UnknownUserException.class);
    }

    @Test
    @DisplayName("온라인 목록은 스냅샷이며 이후 변경에 영향받지 않는다")
    void listOnline_IsSnapshot() {
        // given
        presenceRegistry.setOnline("bob", "conn-2");
        presenceRegistry.setOnline("alice", "conn-1");

        // when
        List<UserPresence> snapshot = presenceRegistry.listOnline();
        presenceRegistry.setOffline("bob");

        // then
        assertThat(snapshot).extracting(UserPresence::getUserId).containsExactly("alice", "bob");
        assertThat(presenceRegistry.listOnline()).extracting(UserPresence::getUserId).containsExactly("alice");
        assertThat(presenceRegistry.onlineConnections()).containsExactly("conn-1");
    }

    @Test
    @DisplayName("전체 목록과 검색 결과에는 오프라인 사용자도 접속 상태와 함께 포함된다")
    void listAllAndSearch_IncludeOfflineUsers() {
        // given
        presenceRegistry.setOnline("alice", "conn-1");

        // when
        List<UserPresence> all = presenceRegistry.listAll();
        List<UserPresence> found = presenceRegistry.search("bo");

        // then
        assertThat(all).extracting(UserPresence::getUserId).containsExactly("alice", "bob");
        assertThat(all).extracting(UserPresence::isOnline).containsExactly(true, false);
        assertThat(found).extracting(UserPresence::getUsername).containsExactly("Bob");
        assertThat(found.get(0).isOnline()).isFalse();
    }
}
