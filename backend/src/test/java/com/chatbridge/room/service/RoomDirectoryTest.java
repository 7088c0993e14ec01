package com.chatbridge.room.service;

import com.chatbridge.exception.InvalidNameException;
import com.chatbridge.exception.NotRoomMemberException;
import com.chatbridge.exception.RoomNotFoundException;
import com.chatbridge.exception.UnknownUserException;
import com.chatbridge.room.domain.Room;
import com.chatbridge.room.domain.RoomType;
import com.chatbridge.room.dto.RoomSummary;
import com.chatbridge.support.MutableClock;
import com.chatbridge.user.service.UserRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RoomDirectory 단위 테스트")
class RoomDirectoryTest {

    private MutableClock clock;
    private UserRegistry userRegistry;
    private RoomDirectory roomDirectory;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        userRegistry = new UserRegistry(clock);
        roomDirectory = new RoomDirectory(userRegistry, clock, 100);
        userRegistry.register("alice", "Alice");
        userRegistry.register("bob", "Bob");
    }

    @Test
    @DisplayName("방을 만들면 생성자가 자동으로 참여한다")
    void createRoom_CreatorAutoJoined() {
        // when
        Room room = roomDirectory.createRoom("general", RoomType.PUBLIC, "alice");

        // then
        assertThat(room.getMemberIds()).containsExactly("alice");
        assertThat(room.getCreatedBy()).isEqualTo("alice");
        assertThat(roomDirectory.isMember("alice", room.getId())).isTrue();
    }

    @Test
    @DisplayName("이름이 비어 있거나 100자를 넘으면 InvalidNameException")
    void createRoom_InvalidName_Throws() {
        assertThatThrownBy(() -> roomDirectory.createRoom("  ", RoomType.PUBLIC, "alice"))
                .isInstanceOf(InvalidNameException.class);
        assertThatThrownBy(() -> roomDirectory.createRoom("x".repeat(101), RoomType.PUBLIC, "alice"))
                .isInstanceOf(InvalidNameException.class);

        assertThat(roomDirectory.createRoom("x".repeat(100), RoomType.PUBLIC, "alice")).isNotNull();
    }

    @Test
    @DisplayName("이름 길이는 UTF-16 단위가 아니라 문자 수로 센다")
    void createRoom_NameLengthCountsCodePoints() {
        String emoji = Character.toString(0x1F600);

        assertThat(roomDirectory.createRoom(emoji.repeat(100), RoomType.PUBLIC, "alice")).isNotNull();
        assertThatThrownBy(() -> roomDirectory.createRoom(emoji.repeat(101), RoomType.PUBLIC, "alice"))
                .isInstanceOf(InvalidNameException.class);
    }

    @Test
    @DisplayName("같은 이름의 방을 여러 개 만들 수 있다")
    void createRoom_NamesNotUnique() {
        // when
        Room first = roomDirectory.createRoom("general", RoomType.PUBLIC, "alice");
        Room second = roomDirectory.createRoom("general", RoomType.PUBLIC, "bob");

        // then
        assertThat(first.getId()).isNotEqualTo(second.getId());
        assertThat(roomDirectory.roomCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("초기 멤버 중 알 수 없는 사용자가 있으면 방을 만들지 않는다")
    void createRoom_UnknownInitialMember_NothingStored() {
        assertThatThrownBy(() -> roomDirectory.createRoom("team", RoomType.PRIVATE, "alice", List.of("bob", "ghost")))
                .isInstanceOf(UnknownUserException.class);

        assertThat(roomDirectory.roomCount()).isZero();
    }

    @Test
    @DisplayName("참여는 멱등이고 이미 멤버면 false를 반환한다")
    void join_Idempotent() {
        // given
        Room room = roomDirectory.createRoom("general", RoomType.PUBLIC, "alice");

        // when
        boolean first = roomDirectory.join("bob", room.getId());
        boolean second = roomDirectory.join("bob", room.getId());

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(roomDirectory.members(room.getId())).containsExactlyInAnyOrder("alice", "bob");
    }

    @Test
    @DisplayName("없는 방에 참여하면 RoomNotFoundException, 알 수 없는 사용자는 UnknownUserException")
    void join_Failures() {
        Room room = roomDirectory.createRoom("general", RoomType.PUBLIC, "alice");

        assertThatThrownBy(() -> roomDirectory.join("bob", "nope"))
                .isInstanceOf(RoomNotFoundException.class);
        assertThatThrownBy(() -> roomDirectory.join("ghost", room.getId()))
                .isInstanceOf(UnknownUserException.class);
    }

    @Test
    @DisplayName("비공개 방은 멤버가 아니면 참여할 수 없다")
    void join_PrivateRoom_NonMemberRejected() {
        // given
        Room secret = roomDirectory.createRoom("secret", RoomType.PRIVATE, "alice");

        // when & then
        assertThatThrownBy(() -> roomDirectory.join("bob", secret.getId()))
                .isInstanceOf(NotRoomMemberException.class);
        assertThat(roomDirectory.isMember("bob", secret.getId())).isFalse();
        assertThat(roomDirectory.join("alice", secret.getId())).isFalse();
    }

    @Test
    @DisplayName("비공개 방의 초기 멤버는 이미 멤버다")
    void join_PrivateRoom_InitialMember() {
        // given
        Room secret = roomDirectory.createRoom("secret", RoomType.PRIVATE, "alice", List.of("bob"));

        // when
        boolean added = roomDirectory.join("bob", secret.getId());

        // then
        assertThat(added).isFalse();
        assertThat(roomDirectory.members(secret.getId())).containsExactlyInAnyOrder("alice", "bob");
    }

    @Test
    @DisplayName("멤버가 아닌 사용자의 나가기는 아무 일도 하지 않는다")
    void leave_NonMember_NoOp() {
        // given
        Room room = roomDirectory.createRoom("general", RoomType.PUBLIC, "alice");

        // when
        boolean removed = roomDirectory.leave("bob", room.getId());

        // then
        assertThat(removed).isFalse();
        assertThat(roomDirectory.members(room.getId())).containsExactly("alice");
    }

    @Test
    @DisplayName("멤버가 모두 나가도 방은 유지된다")
    void leave_LastMember_RoomKept() {
        // given
        Room room = roomDirectory.createRoom("general", RoomType.PUBLIC, "alice");

        // when
        roomDirectory.leave("alice", room.getId());

        // then
        assertThat(roomDirectory.exists(room.getId())).isTrue();
        assertThat(roomDirectory.listRooms()).extracting(RoomSummary::getMemberCount).containsExactly(0);
    }

    @Test
    @DisplayName("비공개 방은 멤버에게만 보인다")
    void listVisibleRooms_PrivateOnlyForMembers() {
        // given
        Room open = roomDirectory.createRoom("general", RoomType.PUBLIC, "alice");
        clock.advance(Duration.ofSeconds(1));
        Room secret = roomDirectory.createRoom("secret", RoomType.PRIVATE, "alice");

        // when & then
        assertThat(roomDirectory.listVisibleRooms("alice"))
                .extracting(RoomSummary::getRoomId)
                .containsExactly(open.getId(), secret.getId());
        assertThat(roomDirectory.listVisibleRooms("bob"))
                .extracting(RoomSummary::getRoomId)
                .containsExactly(open.getId());
    }

    @Test
    @DisplayName("활동 시각은 앞으로만 이동한다")
    void touchActivity_MovesForward() {
        // given
        Room room = roomDirectory.createRoom("general", RoomType.PUBLIC, "alice");
        clock.advance(Duration.ofMinutes(5));

        // when
        roomDirectory.touchActivity(room.getId());

        // then
        assertThat(room.getLastActivity()).isEqualTo(clock.instant());
    }
}
