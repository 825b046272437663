package ch.crossword.crosswordbackend.web.api.dto;

import ch.crossword.crosswordbackend.domain.enums.GameEventType;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published on {@code /topic/games/{gameId}/events}.
 *
 * <p>Only the fields relevant to the event type are set:
 * <ul>
 *   <li>{@code CELL_CLAIMED}: row, col, letter, playerId</li>
 *   <li>{@code PLAYER_JOINED}: player</li>
 *   <li>{@code PLAYER_LEFT}: playerId</li>
 *   <li>{@code GAME_STARTED}, {@code GAME_COMPLETED}, {@code ROOM_CLOSED}: none</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GameEventDto(
        GameEventType type,
        UUID gameId,
        Instant timeStamp,
        Integer row,
        Integer col,
        String letter,
        UUID playerId,
        PlayerDto player
) {

    public static GameEventDto cellClaimed(UUID gameId, int row, int col, String letter, UUID playerId) {
        return new GameEventDto(GameEventType.CELL_CLAIMED, gameId, Instant.now(), row, col, letter, playerId, null);
    }

    public static GameEventDto playerJoined(UUID gameId, PlayerDto player) {
        return new GameEventDto(GameEventType.PLAYER_JOINED, gameId, Instant.now(), null, null, null, null, player);
    }

    public static GameEventDto playerLeft(UUID gameId, UUID playerId) {
        return new GameEventDto(GameEventType.PLAYER_LEFT, gameId, Instant.now(), null, null, null, playerId, null);
    }

    public static GameEventDto gameStarted(UUID gameId) {
        return lifecycle(GameEventType.GAME_STARTED, gameId);
    }

    public static GameEventDto gameCompleted(UUID gameId) {
        return lifecycle(GameEventType.GAME_COMPLETED, gameId);
    }

    public static GameEventDto roomClosed(UUID gameId) {
        return lifecycle(GameEventType.ROOM_CLOSED, gameId);
    }

    private static GameEventDto lifecycle(GameEventType type, UUID gameId) {
        return new GameEventDto(type, gameId, Instant.now(), null, null, null, null, null);
    }

    /**
     * Id of the player this event originates from, for sender checks.
     */
    public UUID senderId() {
        if (playerId != null) {
            return playerId;
        }
        return player == null ? null : player.id();
    }
}
