package com.chatbridge.readreceipt.service;

import com.chatbridge.message.domain.ChatMessage;
import com.chatbridge.room.domain.RoomType;
import com.chatbridge.room.dto.LastMessagePreview;
import com.chatbridge.room.dto.RoomSummary;
import com.chatbridge.room.service.RoomDirectory;
import com.chatbridge.support.MutableClock;
import com.chatbridge.user.service.UserRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UnreadCountService 단위 테스트")
class UnreadCountServiceTest {

    private MutableClock clock;
    private RoomDirectory roomDirectory;
    private DeliveryTracker deliveryTracker;
    private UnreadCountService unreadCountService;
    private String roomId;
    private int sequence;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        UserRegistry userRegistry = new UserRegistry(clock);
        userRegistry.register("alice", "Alice");
        userRegistry.register("bob", "Bob");
        userRegistry.register("carol", "Carol");
        roomDirectory = new RoomDirectory(userRegistry, clock, 100);
        deliveryTracker = new DeliveryTracker(roomDirectory, 1000);
        unreadCountService = new UnreadCountService(deliveryTracker, roomDirectory, userRegistry);

        roomId = roomDirectory.createRoom("general", RoomType.PUBLIC, "alice").getId();
        roomDirectory.join("bob", roomId);
    }

    @Test
    @DisplayName("새 메시지는 보낸 사람을 제외한 멤버의 안 읽은 수를 늘리고 읽음 표시하면 줄어든다")
    void getUnreadCount_TracksReadReceipts() {
        // given
        String first = send("alice", "hi");
        send("alice", "anyone?");

        // when
        int before = unreadCountService.getUnreadCount("bob", roomId);
        deliveryTracker.markRead(first, "bob");
        int after = unreadCountService.getUnreadCount("bob", roomId);

        // then
        assertThat(before).isEqualTo(2);
        assertThat(after).isEqualTo(1);
        assertThat(unreadCountService.getUnreadCount("alice", roomId)).isZero();
        assertThat(unreadCountService.getUnreadCount("carol", roomId)).isZero();
    }

    @Test
    @DisplayName("방 목록에는 마지막 메시지가 들어가고 안 읽은 수는 멤버인 방에만 들어간다")
    void listRoomsFor_AddsUnreadAndLastMessage() {
        // given
        send("alice", "first");
        send("bob", "latest");
        clock.advance(Duration.ofSeconds(1));
        String emptyRoomId = roomDirectory.createRoom("quiet", RoomType.PUBLIC, "carol").getId();

        // when
        List<RoomSummary> forBob = unreadCountService.listRoomsFor("bob");
        List<RoomSummary> forCarol = unreadCountService.listRoomsFor("carol");

        // then
        assertThat(forBob).extracting(RoomSummary::getRoomId).containsExactly(roomId, emptyRoomId);
        RoomSummary general = forBob.get(0);
        assertThat(general.getUnreadCount()).isEqualTo(1);
        LastMessagePreview last = general.getLastMessage();
        assertThat(last.getContent()).isEqualTo("latest");
        assertThat(last.getSender()).isEqualTo("Bob");

        assertThat(forBob.get(1).getUnreadCount()).isNull();
        assertThat(forBob.get(1).getLastMessage()).isNull();
        assertThat(forCarol.get(0).getUnreadCount()).isNull();
        assertThat(forCarol.get(1).getUnreadCount()).isZero();
    }

    private String send(String senderId, String content) {
        sequence++;
        ChatMessage message = ChatMessage.builder()
                .messageId(String.format("%d.%06d", 1, sequence))
                .roomId(roomId)
                .senderId(senderId)
                .content(content)
                .createdAt(clock.instant())
                .build();
        deliveryTracker.recordMessage(message);
        clock.advance(Duration.ofSeconds(1));
        return message.getMessageId();
    }
}
