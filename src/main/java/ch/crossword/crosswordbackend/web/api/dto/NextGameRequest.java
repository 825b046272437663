package ch.crossword.crosswordbackend.web.api.dto;

import java.util.UUID;

/**
 * Request to move a room on to a new puzzle, keeping its short code.
 *
 * @param puzzleId puzzle of the follow-up game
 * @param userId caller identity, must be the host of the current game
 * @param displayName host display name in the new game
 * @param spectator host only watches and gets no player record
 * @param wrongAnswerTimeoutSeconds optional lockout for the new game
 */
public record NextGameRequest(
        UUID puzzleId,
        String userId,
        String displayName,
        boolean spectator,
        Integer wrongAnswerTimeoutSeconds
) {}
