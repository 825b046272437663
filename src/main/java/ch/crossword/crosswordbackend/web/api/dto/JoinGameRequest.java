package ch.crossword.crosswordbackend.web.api.dto;

/**
 * Request to join (or rejoin) a game.
 *
 * @param userId caller identity; joining twice with the same id returns the existing player
 * @param displayName name shown to other players
 */
public record JoinGameRequest(
        String userId,
        String displayName
) {}
