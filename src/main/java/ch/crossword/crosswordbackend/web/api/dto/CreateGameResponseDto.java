package ch.crossword.crosswordbackend.web.api.dto;

import ch.crossword.crosswordbackend.domain.enums.GameStatus;

import java.util.UUID;

/**
 * @param gameId created game
 * @param shortCode room code, {@code null} for solo games
 * @param status initial status
 * @param playerId the host's player id, {@code null} for spectator hosts
 */
public record CreateGameResponseDto(
        UUID gameId,
        String shortCode,
        GameStatus status,
        UUID playerId
) {}
