package com.chatbridge.readreceipt.service;

import com.chatbridge.exception.MessageNotFoundException;
import com.chatbridge.exception.RoomNotFoundException;
import com.chatbridge.message.domain.ChatMessage;
import com.chatbridge.readreceipt.dto.MessageReceipts;
import com.chatbridge.room.domain.RoomType;
import com.chatbridge.room.service.RoomDirectory;
import com.chatbridge.support.MutableClock;
import com.chatbridge.user.service.UserRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DeliveryTracker 단위 테스트")
class DeliveryTrackerTest {

    private MutableClock clock;
    private RoomDirectory roomDirectory;
    private DeliveryTracker deliveryTracker;
    private String roomId;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        UserRegistry userRegistry = new UserRegistry(clock);
        userRegistry.register("alice", "Alice");
        roomDirectory = new RoomDirectory(userRegistry, clock, 100);
        deliveryTracker = new DeliveryTracker(roomDirectory, 1000);
        roomId = roomDirectory.createRoom("general", RoomType.PUBLIC, "alice").getId();
    }

    @Test
    @DisplayName("메시지를 기록하면 빈 수신 집합으로 저장되고 방 활동 시각이 갱신된다")
    void recordMessage_StoresWithEmptyReceipts() {
        // given
        clock.advance(Duration.ofMinutes(1));
        ChatMessage message = message(1, clock.instant());

        // when
        deliveryTracker.recordMessage(message);

        // then
        MessageReceipts receipts = deliveryTracker.receipts(message.getMessageId());
        assertThat(receipts.getDeliveredTo()).isEmpty();
        assertThat(receipts.getReadBy()).isEmpty();
        assertThat(roomDirectory.requireRoom(roomId).getLastActivity()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("없는 방의 메시지는 RoomNotFoundException")
    void recordMessage_UnknownRoom_Throws() {
        ChatMessage orphan = ChatMessage.builder()
                .messageId("1.000000")
                .roomId("nope")
                .senderId("alice")
                .content("hi")
                .createdAt(clock.instant())
                .build();

        assertThatThrownBy(() -> deliveryTracker.recordMessage(orphan))
                .isInstanceOf(RoomNotFoundException.class);
        assertThat(deliveryTracker.getMessage("1.000000")).isEmpty();
    }

    @Test
    @DisplayName("중복 ID로 거부된 메시지는 방 활동 시각을 바꾸지 않는다")
    void recordMessage_DuplicateId_ActivityUnchanged() {
        // given
        deliveryTracker.recordMessage(message(1, clock.instant()));
        Instant lastActivity = roomDirectory.requireRoom(roomId).getLastActivity();
        clock.advance(Duration.ofMinutes(1));

        // when & then
        assertThatThrownBy(() -> deliveryTracker.recordMessage(message(1, clock.instant())))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(roomDirectory.requireRoom(roomId).getLastActivity()).isEqualTo(lastActivity);
        assertThat(deliveryTracker.messageCount(roomId)).isEqualTo(1);
    }

    @Test
    @DisplayName("안 읽은 수는 본인이 보낸 메시지와 읽음 표시한 메시지를 제외한다")
    void unreadCount_ExcludesOwnAndRead() {
        // given
        for (int i = 1; i <= 3; i++) {
            deliveryTracker.recordMessage(message(i, clock.instant()));
            clock.advance(Duration.ofSeconds(1));
        }

        // when
        deliveryTracker.markRead(String.format("%d.%06d", 1, 2), "bob");
        deliveryTracker.markDelivered(String.format("%d.%06d", 1, 3), "bob");

        // then
        assertThat(deliveryTracker.unreadCount(roomId, "bob")).isEqualTo(2);
        assertThat(deliveryTracker.unreadCount(roomId, "alice")).isZero();
        assertThat(deliveryTracker.unreadCount("other", "bob")).isZero();
        assertThat(deliveryTracker.lastMessage(roomId).map(ChatMessage::getContent)).contains("message 3");
        assertThat(deliveryTracker.lastMessage("other")).isEmpty();
    }

    @Test
    @DisplayName("읽음과 전달 표시는 서로 독립적이고 중복 표시는 false를 반환한다")
    void markReadAndDelivered_Independent() {
        // given
        ChatMessage message = message(1, clock.instant());
        deliveryTracker.recordMessage(message);

        // when
        boolean firstRead = deliveryTracker.markRead(message.getMessageId(), "bob");
        boolean secondRead = deliveryTracker.markRead(message.getMessageId(), "bob");

        // then
        assertThat(firstRead).isTrue();
        assertThat(secondRead).isFalse();
        MessageReceipts receipts = deliveryTracker.receipts(message.getMessageId());
        assertThat(receipts.getReadBy()).containsExactly("bob");
        assertThat(receipts.getDeliveredTo()).isEmpty();

        assertThat(deliveryTracker.markDelivered(message.getMessageId(), "bob")).isTrue();
        assertThat(deliveryTracker.receipts(message.getMessageId()).getDeliveredTo()).containsExactly("bob");
    }

    @Test
    @DisplayName("알 수 없는 메시지 ID는 MessageNotFoundException")
    void markRead_UnknownMessage_Throws() {
        assertThatThrownBy(() -> deliveryTracker.markRead("missing", "bob"))
                .isInstanceOf(MessageNotFoundException.class);
        assertThatThrownBy(() -> deliveryTracker.markDelivered("missing", "bob"))
                .isInstanceOf(MessageNotFoundException.class);
    }

    @Test
    @DisplayName("60개 중 limit 50 offset 0이면 최신 50개, offset 50이면 가장 오래된 10개를 반환한다")
    void getRoomMessages_PaginatesNewestFirst() {
        // given
        for (int i = 1; i <= 60; i++) {
            deliveryTracker.recordMessage(message(i, clock.instant()));
            clock.advance(Duration.ofSeconds(1));
        }

        // when
        List<ChatMessage> firstPage = deliveryTracker.getRoomMessages(roomId, 50, 0);
        List<ChatMessage> secondPage = deliveryTracker.getRoomMessages(roomId, 50, 50);

        // then
        assertThat(firstPage).hasSize(50);
        assertThat(firstPage.get(0).getContent()).isEqualTo("message 60");
        assertThat(firstPage.get(49).getContent()).isEqualTo("message 11");
        assertThat(secondPage).hasSize(10);
        assertThat(secondPage.get(0).getContent()).isEqualTo("message 10");
        assertThat(secondPage.get(9).getContent()).isEqualTo("message 1");
    }

    @Test
    @DisplayName("limit이 0 이하이거나 방에 메시지가 없으면 빈 목록을 반환한다")
    void getRoomMessages_EmptyCases() {
        deliveryTracker.recordMessage(message(1, clock.instant()));

        assertThat(deliveryTracker.getRoomMessages(roomId, 0, 0)).isEmpty();
        assertThat(deliveryTracker.getRoomMessages("other", 10, 0)).isEmpty();
        assertThat(deliveryTracker.getRoomMessages(roomId, 10, 5)).isEmpty();
        assertThat(deliveryTracker.getRoomMessages(roomId, 10, -3)).hasSize(1);
    }

    @Test
    @DisplayName("방별 보관 한도를 넘으면 가장 오래된 메시지부터 제거된다")
    void recordMessage_OverCapacity_EvictsOldest() {
        // given
        DeliveryTracker small = new DeliveryTracker(roomDirectory, 3);
        for (int i = 1; i <= 5; i++) {
            small.recordMessage(message(i, clock.instant()));
            clock.advance(Duration.ofSeconds(1));
        }

        // then
        assertThat(small.messageCount(roomId)).isEqualTo(3);
        assertThat(small.getRoomMessages(roomId, 10, 0))
                .extracting(ChatMessage::getContent)
                .containsExactly("message 5", "message 4", "message 3");
        assertThat(small.getMessage(String.format("%d.%06d", 1, 1))).isEmpty();
    }

    private ChatMessage message(int seq, Instant createdAt) {
        return ChatMessage.builder()
                .messageId(String.format("%d.%06d", 1, seq))
                .roomId(roomId)
                .senderId("alice")
                .content("message " + seq)
                .createdAt(createdAt)
                .build();
    }
}
