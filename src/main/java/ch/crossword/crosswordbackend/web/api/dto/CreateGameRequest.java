package ch.crossword.crosswordbackend.web.api.dto;

import java.util.UUID;

/**
 * Request to start a new game on a stored puzzle.
 *
 * @param puzzleId puzzle to play
 * @param userId caller identity of the host
 * @param displayName host display name, defaults to {@code "Player 1"}
 * @param multiplayer {@code true} opens a waiting room with a short code, {@code false} starts a solo game
 * @param spectator host only watches (e.g. a TV screen) and gets no player record
 * @param wrongAnswerTimeoutSeconds optional lockout, one of 0, 1, 2, 3, 5
 */
public record CreateGameRequest(
        UUID puzzleId,
        String userId,
        String displayName,
        boolean multiplayer,
        boolean spectator,
        Integer wrongAnswerTimeoutSeconds
) {}
