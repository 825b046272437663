package ch.crossword.crosswordbackend.web.api.dto;

import java.util.UUID;

/**
 * Request body for actions of a joined player, such as leaving.
 *
 * @param playerId acting player
 */
public record PlayerActionRequest(
        UUID playerId
) {}
