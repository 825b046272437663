package ch.crossword.crosswordbackend.domain.enums;

/**
 * Lifecycle status of a game.
 *
 * <p>Allowed transitions:
 * <ul>
 *   <li>WAITING -> ACTIVE (host starts the game)</li>
 *   <li>ACTIVE -> COMPLETED (every fillable cell is claimed)</li>
 *   <li>any -> CLOSED (host closes the room, terminal)</li>
 * </ul>
 */
public enum GameStatus {
    /**
     * Multiplayer lobby: players may join, cells cannot be claimed yet.
     */
    WAITING,
    ACTIVE,
    COMPLETED,
    /**
     * Terminal. The room was closed by its host.
     */
    CLOSED;

    /**
     * Checks whether a game in this status may move to {@code next}.
     *
     * <p>Staying in the same status is not a transition and returns {@code false}.
     *
     * @param next requested status
     * @return {@code true} if the transition is allowed
     */
    public boolean canTransitionTo(GameStatus next) {
        if (this == next || this == CLOSED) {
            return false;
        }
        return switch (next) {
            case ACTIVE -> this == WAITING;
            case COMPLETED -> this == ACTIVE;
            case CLOSED -> true;
            case WAITING -> false;
        };
    }

    /**
     * Players may join or rejoin only while the game is waiting or running.
     */
    public boolean isJoinable() {
        return this == WAITING || this == ACTIVE;
    }
}
