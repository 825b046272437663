package ch.crossword.crosswordbackend.domain.enums;

/**
 * Event types published on a game's event topic.
 */
public enum GameEventType {
    CELL_CLAIMED,
    PLAYER_JOINED,
    PLAYER_LEFT,
    GAME_STARTED,
    GAME_COMPLETED,
    ROOM_CLOSED;

    /**
     * Events that clients may publish themselves. All other types are published by the server only.
     */
    public boolean isClientOriginated() {
        return this == CELL_CLAIMED || this == PLAYER_JOINED;
    }
}
