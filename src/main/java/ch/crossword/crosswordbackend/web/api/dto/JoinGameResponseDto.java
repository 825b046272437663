package ch.crossword.crosswordbackend.web.api.dto;

/**
 * Result of a join: the joined player and the full game snapshot.
 */
public record JoinGameResponseDto(
        PlayerDto player,
        GameStateDto game
) {}
