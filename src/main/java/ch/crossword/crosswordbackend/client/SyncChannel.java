package ch.crossword.crosswordbackend.client;

import ch.crossword.crosswordbackend.web.api.dto.GameEventDto;

import java.util.UUID;

/**
 * Publish/subscribe connection to one game's event topic.
 *
 * <p>Delivery is best effort: events may be duplicated or lost, which clients tolerate through
 * idempotent application and reconciliation. A channel serves one game at a time and is owned by
 * the session that opened it.
 */
public interface SyncChannel {

    /**
     * Subscribes to the game's events.
     *
     * @param gameId game to follow
     * @param playerId own player id, sent along for presence tracking; {@code null} for spectators
     * @param listener receives the subscription confirmation and all events
     * @throws IllegalStateException if the channel is already open
     */
    void open(UUID gameId, UUID playerId, SyncListener listener);

    /**
     * Publishes an event to the open game. Ignored when the channel is closed.
     */
    void publish(GameEventDto event);

    /**
     * Unsubscribes. Events still in flight are dropped without reaching the listener.
     * Closing a closed channel does nothing.
     */
    void close();

    boolean isOpen();
}
