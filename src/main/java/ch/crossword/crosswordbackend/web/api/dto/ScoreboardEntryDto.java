package ch.crossword.crosswordbackend.web.api.dto;

import java.util.UUID;

/**
 * One row of the game scoreboard.
 *
 * @param playerId player
 * @param displayName player name
 * @param color player color
 * @param cells cells claimed by the player
 * @param clues words the player completed
 */
public record ScoreboardEntryDto(
        UUID playerId,
        String displayName,
        String color,
        int cells,
        int clues
) {}
