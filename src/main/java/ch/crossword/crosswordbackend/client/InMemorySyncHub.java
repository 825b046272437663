package ch.crossword.crosswordbackend.client;

import ch.crossword.crosswordbackend.web.api.dto.GameEventDto;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process event bus with one topic per game, for several sessions inside one JVM.
 *
 * <p>Events are delivered synchronously on the publishing thread to every open channel of the
 * game, the publisher's own channel included.
 */
@Slf4j
public class InMemorySyncHub {

    private final Map<UUID, List<Channel>> topics = new ConcurrentHashMap<>();

    public SyncChannel newChannel() {
        return new Channel();
    }

    /**
     * Publishes on behalf of the server, e.g. lifecycle events.
     */
    public void broadcast(UUID gameId, GameEventDto event) {
        List<Channel> subscribers = topics.get(gameId);
        if (subscribers == null) {
            return;
        }
        for (Channel channel : subscribers) {
            channel.deliver(event);
        }
    }

    public int subscriberCount(UUID gameId) {
        List<Channel> subscribers = topics.get(gameId);
        return subscribers == null ? 0 : subscribers.size();
    }

    /**
     * @return number of games with at least one open channel
     */
    public int activeGameCount() {
        return topics.size();
    }

    private final class Channel implements SyncChannel {

        private volatile UUID gameId;
        private volatile SyncListener listener;

        @Override
        public void open(UUID gameId, UUID playerId, SyncListener listener) {
            if (this.listener != null) {
                throw new IllegalStateException("Channel already open for game " + this.gameId);
            }
            this.gameId = gameId;
            this.listener = listener;
            topics.compute(gameId, (id, subscribers) -> {
                List<Channel> list = subscribers == null ? new CopyOnWriteArrayList<>() : subscribers;
                list.add(this);
                return list;
            });
            log.debug("Player {} subscribed to game {}", playerId, gameId);
            listener.onSubscribed();
        }

        @Override
        public void publish(GameEventDto event) {
            UUID current = gameId;
            if (listener == null || current == null) {
                log.debug("Dropped {} event on closed channel", event.type());
                return;
            }
            broadcast(current, event);
        }

        @Override
        public void close() {
            UUID current = gameId;
            listener = null;
            gameId = null;
            if (current != null) {
                // the last channel out drops the topic
                topics.computeIfPresent(current, (id, subscribers) -> {
                    subscribers.remove(this);
                    return subscribers.isEmpty() ? null : subscribers;
                });
            }
        }

        @Override
        public boolean isOpen() {
            return listener != null;
        }

        void deliver(GameEventDto event) {
            SyncListener target = listener;
            if (target != null) {
                target.onEvent(event);
            }
        }
    }
}
