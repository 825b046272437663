package ch.crossword.crosswordbackend.web.api.dto;

import ch.crossword.crosswordbackend.domain.Player;

import java.util.UUID;

/**
 * Client view of a player.
 *
 * @param id player id, referenced by claimed cells and events
 * @param userId caller-supplied identity, used to recognise repeated joins
 * @param displayName name shown to other players
 * @param color hex color assigned on join
 * @param score number of cells claimed
 */
public record PlayerDto(
        UUID id,
        String userId,
        String displayName,
        String color,
        int score
) {

    public static PlayerDto from(Player player) {
        return new PlayerDto(
                player.getId(),
                player.getUserId(),
                player.getDisplayName(),
                player.getColor(),
                player.getScore()
        );
    }
}
