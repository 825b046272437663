package ch.crossword.crosswordbackend.client;

import ch.crossword.crosswordbackend.web.api.dto.GameEventDto;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySyncHubTest {

    private final InMemorySyncHub hub = new InMemorySyncHub();
    private final UUID gameId = UUID.randomUUID();

    @Test
    void publish_shouldReachEveryChannelOfTheGame_includingPublisher() {
        RecordingListener a = new RecordingListener();
        RecordingListener b = new RecordingListener();
        RecordingListener other = new RecordingListener();
        SyncChannel channelA = hub.newChannel();
        hub.newChannel().open(gameId, UUID.randomUUID(), b);
        hub.newChannel().open(UUID.randomUUID(), UUID.randomUUID(), other);
        channelA.open(gameId, UUID.randomUUID(), a);

        channelA.publish(GameEventDto.gameStarted(gameId));

        assertThat(a.events).hasSize(1);
        assertThat(b.events).hasSize(1);
        assertThat(other.events).isEmpty();
        assertThat(a.subscribed).isEqualTo(1);
    }

    @Test
    void close_shouldStopDelivery_andMakePublishANoOp() {
        RecordingListener listener = new RecordingListener();
        SyncChannel channel = hub.newChannel();
        channel.open(gameId, UUID.randomUUID(), listener);

        channel.close();
        hub.broadcast(gameId, GameEventDto.gameStarted(gameId));
        channel.publish(GameEventDto.gameStarted(gameId));

        assertThat(listener.events).isEmpty();
        assertThat(channel.isOpen()).isFalse();
        assertThat(hub.subscriberCount(gameId)).isZero();
    }

    @Test
    void closingLastChannel_shouldDropTheGameTopic() {
        UUID otherGame = UUID.randomUUID();
        SyncChannel first = hub.newChannel();
        SyncChannel second = hub.newChannel();
        SyncChannel elsewhere = hub.newChannel();
        first.open(gameId, UUID.randomUUID(), new RecordingListener());
        second.open(gameId, UUID.randomUUID(), new RecordingListener());
        elsewhere.open(otherGame, UUID.randomUUID(), new RecordingListener());

        first.close();
        assertThat(hub.activeGameCount()).isEqualTo(2);

        second.close();
        elsewhere.close();
        assertThat(hub.activeGameCount()).isZero();

        RecordingListener late = new RecordingListener();
        hub.newChannel().open(gameId, UUID.randomUUID(), late);
        hub.broadcast(gameId, GameEventDto.gameStarted(gameId));

        assertThat(late.events).hasSize(1);
        assertThat(hub.activeGameCount()).isEqualTo(1);
    }

    @Test
    void close_duringDelivery_shouldNotFailOtherSubscribers() {
        RecordingListener second = new RecordingListener();
        SyncChannel first = hub.newChannel();
        first.open(gameId, UUID.randomUUID(), new SyncListener() {
            @Override
            public void onSubscribed() {
            }

            @Override
            public void onEvent(GameEventDto event) {
                first.close();
            }
        });
        hub.newChannel().open(gameId, UUID.randomUUID(), second);

        hub.broadcast(gameId, GameEventDto.gameStarted(gameId));

        assertThat(second.events).hasSize(1);
        assertThat(hub.subscriberCount(gameId)).isEqualTo(1);
    }

    @Test
    void open_twice_shouldThrow() {
        SyncChannel channel = hub.newChannel();
        channel.open(gameId, UUID.randomUUID(), new RecordingListener());

        assertThatThrownBy(() -> channel.open(gameId, UUID.randomUUID(), new RecordingListener()))
                .isInstanceOf(IllegalStateException.class);
    }

    static class RecordingListener implements SyncListener {
        final List<GameEventDto> events = new ArrayList<>();
        int subscribed;

        @Override
        public void onSubscribed() {
            subscribed++;
        }

        @Override
        public void onEvent(GameEventDto event) {
            events.add(event);
        }
    }
}
